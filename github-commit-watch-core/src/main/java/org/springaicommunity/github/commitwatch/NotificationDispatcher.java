package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Fans notifications out to every subscriber of a repository.
 *
 * <p>
 * Delivery is best-effort: a failure for one subscriber is logged and counted, then the
 * remaining subscribers are served. Messages to one subscriber keep chronological order.
 */
public class NotificationDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

	private final SubscriptionIndex subscriptions;

	private final NotificationSink sink;

	private final WatchStatistics statistics;

	private final Set<String> adminIds;

	private final int maxCommitMessages;

	public NotificationDispatcher(SubscriptionIndex subscriptions, NotificationSink sink, WatchStatistics statistics,
			Set<String> adminIds, int maxCommitMessages) {
		if (maxCommitMessages < 1) {
			throw new IllegalArgumentException("maxCommitMessages must be positive");
		}
		this.subscriptions = subscriptions;
		this.sink = sink;
		this.statistics = statistics;
		this.adminIds = Set.copyOf(adminIds);
		this.maxCommitMessages = maxCommitMessages;
	}

	/**
	 * Deliver a batch of new commits to all subscribers.
	 * @param cursor the repository's cursor after the cycle (branch and URL)
	 * @param oldestFirst the new commits in chronological order
	 * @return delivery counts
	 */
	public DeliveryReport dispatchCommits(Cursor cursor, List<CommitRef> oldestFirst) {
		RepositoryId repositoryId = cursor.repositoryId();
		String repositoryUrl = repositoryUrl(cursor);
		String branch = String.valueOf(cursor.defaultBranch());
		int shown = Math.min(oldestFirst.size(), maxCommitMessages);

		DeliveryReport report = DeliveryReport.EMPTY;
		Set<String> recipients = subscriptions.subscribersOf(repositoryId);
		logger.info("Sending {} commit(s) of {} to {} subscriber(s)", oldestFirst.size(), repositoryId,
				recipients.size());
		for (String subscriberId : recipients) {
			for (CommitRef commit : oldestFirst.subList(0, shown)) {
				report = report.plus(deliver(subscriberId,
						new Notification.CommitNotification(repositoryId, repositoryUrl, branch, commit)));
			}
			if (oldestFirst.size() > shown) {
				report = report.plus(deliver(subscriberId, new Notification.CommitSummaryNotice(repositoryId,
						repositoryUrl, oldestFirst.size(), oldestFirst.size() - shown)));
			}
		}
		return report;
	}

	public DeliveryReport dispatchHistoryRewritten(Cursor cursor, CommitRef newTip,
			@Nullable String previousCommitId) {
		Notification notice = new Notification.HistoryRewrittenNotice(cursor.repositoryId(), repositoryUrl(cursor),
				String.valueOf(cursor.defaultBranch()), previousCommitId, newTip);
		return broadcast(cursor.repositoryId(), notice);
	}

	public DeliveryReport dispatchUnreachable(RepositoryId repositoryId, int consecutiveFailures) {
		return broadcast(repositoryId, new Notification.RepositoryUnreachableNotice(repositoryId, consecutiveFailures));
	}

	/**
	 * Send a diagnostic to the configured administrators. Without administrators the
	 * alert is only logged.
	 */
	public DeliveryReport alertAdmins(Notification.AdminAlert alert) {
		logger.error("Admin alert [{}]: {}", alert.kind(), alert.message());
		DeliveryReport report = DeliveryReport.EMPTY;
		for (String adminId : adminIds) {
			report = report.plus(deliver(adminId, alert));
		}
		return report;
	}

	private DeliveryReport broadcast(RepositoryId repositoryId, Notification notification) {
		DeliveryReport report = DeliveryReport.EMPTY;
		for (String subscriberId : subscriptions.subscribersOf(repositoryId)) {
			report = report.plus(deliver(subscriberId, notification));
		}
		return report;
	}

	private DeliveryReport deliver(String subscriberId, Notification notification) {
		try {
			sink.send(subscriberId, notification);
			statistics.recordDelivery(true);
			return DeliveryReport.DELIVERED;
		}
		catch (RuntimeException e) {
			logger.warn("Failed to deliver {} to {}: {}", notification.getClass().getSimpleName(), subscriberId,
					e.getMessage());
			statistics.recordDelivery(false);
			return DeliveryReport.FAILED;
		}
	}

	private static String repositoryUrl(Cursor cursor) {
		return cursor.repositoryUrl() != null ? cursor.repositoryUrl() : cursor.repositoryId().htmlUrl();
	}

	/**
	 * Delivery counts of one dispatch.
	 */
	public record DeliveryReport(int delivered, int failed) {

		static final DeliveryReport EMPTY = new DeliveryReport(0, 0);

		static final DeliveryReport DELIVERED = new DeliveryReport(1, 0);

		static final DeliveryReport FAILED = new DeliveryReport(0, 1);

		DeliveryReport plus(DeliveryReport other) {
			return new DeliveryReport(delivered + other.delivered, failed + other.failed);
		}

	}

}
