package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One row of the {@code list} command.
 */
public record RepositoryStatus(RepositoryId repositoryId, @Nullable String defaultBranch,
		@Nullable Instant lastCheckedAt, @Nullable String lastCommitId, @Nullable Instant lastCommitTimestamp,
		ReachabilityState reachability, CheckState checkState, int consecutiveFailures) {

	static RepositoryStatus of(Cursor cursor, CheckState checkState) {
		return new RepositoryStatus(cursor.repositoryId(), cursor.defaultBranch(), cursor.lastCheckedAt(),
				cursor.lastCommitId(), cursor.lastCommitTimestamp(), cursor.state(), checkState,
				cursor.consecutiveFailures());
	}

}
