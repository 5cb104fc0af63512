package org.springaicommunity.github.commitwatch;

/**
 * Classification of a failed check cycle, used by {@link FailurePolicy}.
 */
public enum FailureKind {

	/**
	 * Repository missing or inaccessible with the current credentials.
	 */
	NOT_FOUND,

	/**
	 * Credentials rejected. Fatal for the whole process until reconfigured.
	 */
	AUTH,

	/**
	 * Upstream throttling; retried once the rate limit window resets.
	 */
	RATE_LIMITED,

	/**
	 * Network errors, timeouts and 5xx responses.
	 */
	TRANSIENT,

	/**
	 * The cursor or subscription store failed to read or write.
	 */
	STORAGE

}
