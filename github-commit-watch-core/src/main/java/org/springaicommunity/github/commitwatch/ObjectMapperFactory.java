package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Creates the {@link ObjectMapper} shared by the state files and the GitHub client.
 *
 * <p>
 * Record components are written as snake_case keys ({@code lastCommitId} &rarr;
 * {@code last_commit_id}), instants as ISO-8601 strings, and unknown keys in GitHub
 * responses or older state files are ignored.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
