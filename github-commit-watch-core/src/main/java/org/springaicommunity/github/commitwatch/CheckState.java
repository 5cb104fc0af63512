package org.springaicommunity.github.commitwatch;

/**
 * Scheduling state of a repository as seen by {@link CommitWatchScheduler}.
 */
public enum CheckState {

	IDLE, CHECKING, BACKOFF

}
