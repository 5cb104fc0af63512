package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Per-repository watch state: the most recently notified commit on the tracked branch
 * plus the metadata the scheduler and failure policy need across cycles.
 *
 * <p>
 * Instances are immutable and compared by value; {@link CursorStore#compareAndSet} relies
 * on that equality to detect concurrent writers.
 *
 * @param repositoryId the repository this cursor belongs to
 * @param lastCommitId id of the newest notified commit, null until a baseline exists
 * @param lastCommitTimestamp author timestamp of that commit
 * @param defaultBranch the tracked branch, null until resolved
 * @param repositoryUrl browsable repository URL, null until resolved
 * @param lastCheckedAt time of the last successful check cycle
 * @param consecutiveFailures failed cycles since the last success
 * @param consecutiveNotFound length of the current run of NOT_FOUND results; any other
 * outcome ends the run
 * @param state whether scheduled checks run for this repository
 */
public record Cursor(RepositoryId repositoryId, @Nullable String lastCommitId, @Nullable Instant lastCommitTimestamp,
		@Nullable String defaultBranch, @Nullable String repositoryUrl, @Nullable Instant lastCheckedAt,
		int consecutiveFailures, int consecutiveNotFound, ReachabilityState state) {

	/**
	 * Create the state of a repository that has never been checked.
	 * @param repositoryId the repository
	 * @return a cursor without baseline, branch or failures
	 */
	public static Cursor initial(RepositoryId repositoryId) {
		return new Cursor(repositoryId, null, null, null, null, null, 0, 0, ReachabilityState.ACTIVE);
	}

	/**
	 * Returns true once a baseline commit has been recorded.
	 * @return whether {@link #lastCommitId()} is set
	 */
	@JsonIgnore
	public boolean hasBaseline() {
		return lastCommitId != null;
	}

	public Cursor withCommit(CommitRef commit) {
		return new Cursor(repositoryId, commit.id(), commit.timestamp(), defaultBranch, repositoryUrl, lastCheckedAt,
				consecutiveFailures, consecutiveNotFound, state);
	}

	public Cursor withRepositoryInfo(RepositoryInfo info) {
		return new Cursor(repositoryId, lastCommitId, lastCommitTimestamp, info.defaultBranch(), info.htmlUrl(),
				lastCheckedAt, consecutiveFailures, consecutiveNotFound, state);
	}

	/**
	 * Record a successful cycle: failures reset, repository active again.
	 * @param checkedAt completion time of the cycle
	 * @return the updated cursor
	 */
	public Cursor withSuccess(Instant checkedAt) {
		return new Cursor(repositoryId, lastCommitId, lastCommitTimestamp, defaultBranch, repositoryUrl, checkedAt, 0,
				0, ReachabilityState.ACTIVE);
	}

	/**
	 * Record a failed cycle other than NOT_FOUND; the not-found run starts over.
	 */
	public Cursor withFailure(ReachabilityState newState) {
		return new Cursor(repositoryId, lastCommitId, lastCommitTimestamp, defaultBranch, repositoryUrl, lastCheckedAt,
				consecutiveFailures + 1, 0, newState);
	}

	public Cursor withNotFound(ReachabilityState newState) {
		return new Cursor(repositoryId, lastCommitId, lastCommitTimestamp, defaultBranch, repositoryUrl, lastCheckedAt,
				consecutiveFailures + 1, consecutiveNotFound + 1, newState);
	}

	public Cursor withState(ReachabilityState newState) {
		boolean active = newState == ReachabilityState.ACTIVE;
		return new Cursor(repositoryId, lastCommitId, lastCommitTimestamp, defaultBranch, repositoryUrl, lastCheckedAt,
				active ? 0 : consecutiveFailures, active ? 0 : consecutiveNotFound, newState);
	}

}
