package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * A JSON array of records persisted in a single file.
 *
 * <p>
 * Writes go to a sibling temp file which is then moved over the target, so a crash
 * mid-write leaves the previous content intact.
 *
 * @param <T> the record type
 */
final class JsonStateFile<T> {

	private static final Logger logger = LoggerFactory.getLogger(JsonStateFile.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	private final TypeReference<List<T>> type;

	JsonStateFile(Path file, ObjectMapper objectMapper, TypeReference<List<T>> type) {
		this.file = file;
		this.objectMapper = objectMapper;
		this.type = type;
	}

	Path path() {
		return file;
	}

	List<T> read() {
		if (!Files.exists(file)) {
			logger.info("No state file at {}, starting empty", file);
			return List.of();
		}
		try {
			List<T> items = objectMapper.readValue(file.toFile(), type);
			logger.info("Loaded {} entries from {}", items.size(), file);
			return items;
		}
		catch (IOException e) {
			throw new StorageException("Failed to read state file: " + file, e);
		}
	}

	void write(List<T> items) {
		Path temp = file.resolveSibling(file.getFileName() + ".tmp");
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), items);
			try {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Wrote {} entries to {}", items.size(), file);
		}
		catch (IOException e) {
			throw new StorageException("Failed to write state file: " + file, e);
		}
	}

}
