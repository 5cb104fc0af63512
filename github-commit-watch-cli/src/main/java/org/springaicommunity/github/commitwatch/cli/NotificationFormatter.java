package org.springaicommunity.github.commitwatch.cli;

import org.springaicommunity.github.commitwatch.CommitRef;
import org.springaicommunity.github.commitwatch.Notification;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders {@link Notification}s as plain text for the console.
 */
public class NotificationFormatter {

	static final int MAX_MESSAGE_LENGTH = 300;

	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy/MM/dd - HH:mm:ss");

	private final ZoneId zone;

	public NotificationFormatter() {
		this(ZoneId.systemDefault());
	}

	public NotificationFormatter(ZoneId zone) {
		this.zone = zone;
	}

	public String format(Notification notification) {
		if (notification instanceof Notification.CommitNotification commit) {
			return formatCommit(commit);
		}
		if (notification instanceof Notification.CommitSummaryNotice summary) {
			return String.format("%s: %d new commits, %d more not shown. See %s/commits", summary.repositoryId(),
					summary.totalCommits(), summary.omittedCommits(), summary.repositoryUrl());
		}
		if (notification instanceof Notification.HistoryRewrittenNotice rewrite) {
			return String.format("%s: history of %s was rewritten, new tip is %s (%s)%n%s", rewrite.repositoryId(),
					rewrite.branch(), rewrite.newTip().shortId(), truncate(rewrite.newTip().summary()),
					rewrite.newTip().url());
		}
		if (notification instanceof Notification.RepositoryUnreachableNotice unreachable) {
			return String.format(
					"%s could not be found %d times in a row and is no longer checked. Use /add %s to resume.",
					unreachable.repositoryId(), unreachable.consecutiveFailures(), unreachable.repositoryId());
		}
		Notification.AdminAlert alert = (Notification.AdminAlert) notification;
		return String.format("[admin] %s: %s", alert.kind(), alert.message());
	}

	private String formatCommit(Notification.CommitNotification notification) {
		CommitRef commit = notification.commit();
		StringBuilder message = new StringBuilder();
		message.append("New commit in ")
			.append(notification.repositoryId())
			.append(" (")
			.append(notification.branch())
			.append(")\n");
		message.append(truncate(commit.summary())).append('\n');
		message.append("Author: ").append(commit.authorName()).append('\n');
		message.append("Time: ").append(TIMESTAMP.format(commit.timestamp().atZone(zone))).append('\n');
		message.append("Commit: ").append(commit.shortId()).append('\n');

		StringBuilder changes = new StringBuilder();
		if (commit.added() > 0) {
			changes.append("  + ").append(commit.added()).append(" new files\n");
		}
		if (commit.removed() > 0) {
			changes.append("  - ").append(commit.removed()).append(" files removed\n");
		}
		if (commit.modified() > 0) {
			changes.append("  ~ ").append(commit.modified()).append(" files modified\n");
		}
		if (changes.length() > 0) {
			message.append("Changes:\n").append(changes);
		}

		message.append("View commit: ").append(commit.url()).append('\n');
		message.append("View repository: ").append(notification.repositoryUrl());
		return message.toString();
	}

	static String truncate(String text) {
		if (text.length() <= MAX_MESSAGE_LENGTH) {
			return text;
		}
		return text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
	}

}
