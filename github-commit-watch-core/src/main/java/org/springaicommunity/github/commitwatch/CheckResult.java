package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one check cycle for a single repository. Not persisted; used for logging,
 * backoff decisions and command replies.
 */
public sealed interface CheckResult {

	RepositoryId repositoryId();

	/**
	 * Nothing to notify. Also returned when a baseline was established silently.
	 */
	record NoChange(RepositoryId repositoryId, boolean baseline) implements CheckResult {
	}

	/**
	 * New commits were detected and dispatched.
	 *
	 * @param commits the new commits, oldest first
	 * @param newCursor id of the newest commit, now stored as the cursor
	 */
	record NewCommits(RepositoryId repositoryId, List<CommitRef> commits, String newCursor) implements CheckResult {

		public NewCommits {
			commits = List.copyOf(commits);
		}

	}

	/**
	 * The stored cursor is no longer an ancestor of the branch tip; the cursor was reset
	 * to the new tip and subscribers were told once.
	 */
	record HistoryRewritten(RepositoryId repositoryId, @Nullable String previousCommitId,
			CommitRef newTip) implements CheckResult {
	}

	/**
	 * The cycle failed.
	 *
	 * @param kind classification of the failure
	 * @param detail human readable reason
	 * @param retryAt earliest time the scheduler should check this repository again, or
	 * null for the next tick
	 * @param accountWide whether the retry time applies to every repository
	 */
	record Failure(RepositoryId repositoryId, FailureKind kind, String detail, @Nullable Instant retryAt,
			boolean accountWide) implements CheckResult {
	}

	/**
	 * The cycle did not run.
	 */
	record Skipped(RepositoryId repositoryId, SkipReason reason) implements CheckResult {
	}

	/**
	 * Why a cycle was not run.
	 */
	enum SkipReason {

		/** Another cycle for the same repository is in flight. */
		BUSY,

		/** The repository is inside a backoff window. */
		BACKING_OFF,

		/** Checks for the whole account are suspended by a rate limit. */
		RATE_LIMITED,

		/** The repository is marked unreachable. */
		UNREACHABLE,

		/** Another writer updated the cursor during the cycle; re-checked next tick. */
		CONCURRENT_UPDATE,

		/** The last subscriber left before the cycle started; the cursor stays dormant. */
		UNSUBSCRIBED,

		/** The scheduler is stopped or halted. */
		STOPPED

	}

}
