package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Upstream connection state reported by the {@code status} command.
 *
 * @param connected whether the API accepted the credentials
 * @param login the authenticated account
 * @param rateLimit requests allowed per window
 * @param rateRemaining requests left in the current window
 * @param rateResetAt when the window resets
 * @param error why the connection check failed
 */
public record ConnectionStatus(boolean connected, @Nullable String login, int rateLimit, int rateRemaining,
		@Nullable Instant rateResetAt, @Nullable String error) {

	public static ConnectionStatus connected(String login, int rateLimit, int rateRemaining, Instant rateResetAt) {
		return new ConnectionStatus(true, login, rateLimit, rateRemaining, rateResetAt, null);
	}

	public static ConnectionStatus failed(String error) {
		return new ConnectionStatus(false, null, 0, 0, null, error);
	}

}
