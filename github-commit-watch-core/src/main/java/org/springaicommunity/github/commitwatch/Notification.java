package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A message for the chat transport. Formatting and localization are up to the
 * {@link NotificationSink}.
 */
public sealed interface Notification {

	/**
	 * One new commit on a watched branch.
	 *
	 * @param repositoryId the repository
	 * @param repositoryUrl browsable repository URL
	 * @param branch the watched branch
	 * @param commit the commit payload (id, author, timestamp, message, file counts, URL)
	 */
	record CommitNotification(RepositoryId repositoryId, String repositoryUrl, String branch,
			CommitRef commit) implements Notification {
	}

	/**
	 * Sent after the individual commit notifications when a batch was larger than the
	 * per-batch message limit.
	 *
	 * @param totalCommits commits in the batch
	 * @param omittedCommits commits without an individual notification
	 */
	record CommitSummaryNotice(RepositoryId repositoryId, String repositoryUrl, int totalCommits,
			int omittedCommits) implements Notification {
	}

	/**
	 * The branch history was rewritten (for example by a force-push). The watch resumed
	 * from the new tip without trying to reconstruct the delta.
	 */
	record HistoryRewrittenNotice(RepositoryId repositoryId, String repositoryUrl, String branch,
			@Nullable String previousCommitId, CommitRef newTip) implements Notification {
	}

	/**
	 * The repository could not be found several times in a row and is no longer checked
	 * on schedule.
	 */
	record RepositoryUnreachableNotice(RepositoryId repositoryId, int consecutiveFailures) implements Notification {
	}

	/**
	 * Diagnostic for administrators (credential failures, persistent storage errors).
	 */
	record AdminAlert(FailureKind kind, @Nullable RepositoryId repositoryId, String message,
			Instant raisedAt) implements Notification {
	}

}
