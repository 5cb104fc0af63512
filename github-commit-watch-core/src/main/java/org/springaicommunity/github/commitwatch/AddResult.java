package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

/**
 * Reply to {@link CommitWatchService#add}.
 *
 * @param status outcome of the request
 * @param repositoryId the normalized repository
 * @param defaultBranch the tracked branch, when it could be resolved
 * @param reactivated whether an unreachable repository was made active again
 * @param detail failure reason for {@code NOT_FOUND} and {@code FAILED}
 */
public record AddResult(Status status, RepositoryId repositoryId, @Nullable String defaultBranch,
		boolean reactivated, @Nullable String detail) {

	public enum Status {

		ADDED, ALREADY_SUBSCRIBED, NOT_FOUND, FAILED

	}

	static AddResult rejected(Status status, RepositoryId repositoryId, String detail) {
		return new AddResult(status, repositoryId, null, false, detail);
	}

}
