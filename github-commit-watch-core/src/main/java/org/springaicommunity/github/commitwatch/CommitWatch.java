package org.springaicommunity.github.commitwatch;

/**
 * A wired watch engine as returned by {@link CommitWatchBuilder#build()}. Closing it
 * stops the scheduler.
 */
public record CommitWatch(CommitWatchService service, CommitWatchScheduler scheduler,
		WatchStatistics statistics) implements AutoCloseable {

	@Override
	public void close() {
		scheduler.stop();
	}

}
