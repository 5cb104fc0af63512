package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system implementation of {@link CursorStore}.
 *
 * <p>
 * All cursors live in one {@code cursors.json} file in the state directory. Reads are
 * served from memory. A successful {@link #compareAndSet} rewrites the file before the
 * in-memory value changes, so a failed write never advances a cursor.
 */
public class FileSystemCursorStore implements CursorStore {

	static final String FILE_NAME = "cursors.json";

	private final JsonStateFile<Cursor> stateFile;

	private final Map<RepositoryId, Cursor> cursors = new ConcurrentHashMap<>();

	private final Object writeLock = new Object();

	/**
	 * Open the store, loading existing cursors.
	 * @param stateDirectory directory containing {@code cursors.json}
	 * @param objectMapper mapper used for (de)serialization
	 * @throws StorageException if an existing file cannot be read
	 */
	public FileSystemCursorStore(Path stateDirectory, ObjectMapper objectMapper) {
		this.stateFile = new JsonStateFile<>(stateDirectory.resolve(FILE_NAME), objectMapper,
				new TypeReference<List<Cursor>>() {
				});
		for (Cursor cursor : stateFile.read()) {
			cursors.put(cursor.repositoryId(), cursor);
		}
	}

	@Override
	public Optional<Cursor> get(RepositoryId repositoryId) {
		return Optional.ofNullable(cursors.get(repositoryId));
	}

	@Override
	public boolean compareAndSet(RepositoryId repositoryId, @Nullable Cursor expected, Cursor next) {
		InMemoryCursorStore.requireSameRepository(repositoryId, next);
		synchronized (writeLock) {
			if (!Objects.equals(cursors.get(repositoryId), expected)) {
				return false;
			}
			List<Cursor> snapshot = new ArrayList<>(cursors.values());
			snapshot.removeIf(cursor -> cursor.repositoryId().equals(repositoryId));
			snapshot.add(next);
			snapshot.sort(Comparator.comparing(cursor -> cursor.repositoryId().fullName()));
			stateFile.write(snapshot);
			cursors.put(repositoryId, next);
			return true;
		}
	}

	@Override
	public Collection<Cursor> all() {
		return List.copyOf(cursors.values());
	}

}
