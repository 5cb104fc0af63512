package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Decorator that retries transient failures of a {@link GitHubClient} within a single
 * request.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, network, timeouts)</li>
 * <li>Rate limit errors and other 4xx responses are rethrown immediately: a check cycle
 * must not sleep on a rate limit while holding its repository, so waiting for the reset
 * is left to the {@link FailurePolicy}</li>
 * <li>Proactive pacing: injects delays when remaining rate limit is low to avoid hitting
 * the wall</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofMillis(500))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_PACING_MS = 10_000;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int pacingThreshold;

	private final Clock clock;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String executeWithRetry(RequestSupplier supplier, String description) {
		RuntimeException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				String result = supplier.get();
				paceIfNeeded(description);
				return result;
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!e.isTransient()) {
					throw e;
				}
				lastException = e;
			}
			catch (RuntimeException e) {
				lastException = e;
			}

			if (attempt < maxRetries) {
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, lastException.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}

		logger.warn("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	// spreads the remaining budget evenly over the rest of the window
	private void paceIfNeeded(String description) {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || info.isExhausted() || info.remaining() >= pacingThreshold) {
			return;
		}

		long msUntilReset = info.untilReset(clock.instant()).toMillis();
		if (msUntilReset > 0) {
			long paceMs = msUntilReset / info.remaining();
			paceMs = Math.min(paceMs, MAX_PACING_MS);
			paceMs = Math.max(paceMs, 100);

			logger.debug("Pacing: {}/{} remaining, sleeping {}ms ({})", info.remaining(), info.limit(), paceMs,
					description);
			sleep(paceMs);
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults to two retries starting at 500ms,
	 * and pacing once fewer than 100 requests remain.
	 */
	public static class Builder {

		@Nullable
		private GitHubClient delegate;

		private int maxRetries = 2;

		private long initialDelayMs = 500;

		private int pacingThreshold = 100;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Retries after the first attempt; zero disables retrying.
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Delay before the first retry, doubled for each further one.
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * @throws IllegalStateException if no client is wrapped or a setting is out of
		 * range
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
