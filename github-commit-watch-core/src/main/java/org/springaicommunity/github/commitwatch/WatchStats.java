package org.springaicommunity.github.commitwatch;

import java.time.Duration;

/**
 * Reply to the {@code stats} command.
 *
 * @param repositoriesTracked repositories with at least one subscriber
 * @param subscriberRepositories repositories the asking subscriber follows
 * @param counters process-wide counters since startup
 * @param checkInterval the poll interval
 */
public record WatchStats(int repositoriesTracked, int subscriberRepositories, WatchStatistics.Snapshot counters,
		Duration checkInterval) {

}
