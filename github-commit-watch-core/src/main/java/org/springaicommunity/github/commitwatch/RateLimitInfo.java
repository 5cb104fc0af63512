package org.springaicommunity.github.commitwatch;

import java.time.Duration;
import java.time.Instant;

/**
 * Request budget reported by the {@code X-RateLimit-*} headers of the last response.
 *
 * @param limit requests allowed in the current window, or -1 when not reported
 * @param remaining requests left before GitHub starts answering 403
 * @param resetAt when the window starts over
 */
public record RateLimitInfo(int limit, int remaining, Instant resetAt) {

	static RateLimitInfo fromHeaders(int limit, int remaining, long resetEpochSeconds) {
		return new RateLimitInfo(limit, remaining, Instant.ofEpochSecond(Math.max(resetEpochSeconds, 0)));
	}

	public boolean isExhausted() {
		return remaining <= 0;
	}

	/**
	 * Time left in the window, never negative.
	 */
	public Duration untilReset(Instant now) {
		Duration left = Duration.between(now, resetAt);
		return left.isNegative() ? Duration.ZERO : left;
	}

}
