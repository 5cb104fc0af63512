package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

/**
 * Upstream source-hosting API as seen by the check cycle.
 *
 * <p>
 * Implementations raise {@link RepositoryAccessException} with a {@link FailureKind} for
 * every failure and must bound each call with a timeout.
 */
public interface RepositoryClient {

	/**
	 * Resolve the default branch of a repository.
	 * @param repositoryId the repository
	 * @return the default branch and browsable URL
	 * @throws RepositoryAccessException {@code NOT_FOUND} if the repository does not
	 * exist or is inaccessible, {@code RATE_LIMITED}, {@code TRANSIENT} or {@code AUTH}
	 */
	RepositoryInfo resolveDefaultBranch(RepositoryId repositoryId);

	/**
	 * List the commits of a branch that are newer than the cursor.
	 *
	 * <p>
	 * Without a cursor only the branch tip is returned, which is enough to establish a
	 * baseline. With a cursor, every commit strictly newer than it is returned newest
	 * first, or an empty listing if there is nothing new. If the cursor is no longer an
	 * ancestor of the tip the listing is flagged as rewritten and holds only the tip.
	 * @param repositoryId the repository
	 * @param branch the branch to list
	 * @param cursor id of the last seen commit, or null for a baseline
	 * @return the listing
	 * @throws RepositoryAccessException on failure, with the same kinds as
	 * {@link #resolveDefaultBranch}
	 */
	CommitListing listCommitsSince(RepositoryId repositoryId, String branch, @Nullable String cursor);

}
