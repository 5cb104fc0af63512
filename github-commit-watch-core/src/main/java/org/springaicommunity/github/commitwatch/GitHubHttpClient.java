package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Simple HTTP client wrapper for GitHub API calls using Java 11+ HttpClient.
 *
 * <p>
 * Every request carries a timeout so that a hung upstream call fails as a transient error
 * instead of holding a repository's check slot forever. Rate limit headers are extracted
 * from all responses and made available via {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com";

	static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final String token;

	private final String baseUrl;

	private final Duration requestTimeout;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, DEFAULT_TIMEOUT);
	}

	public GitHubHttpClient(String token, String baseUrl, Duration requestTimeout) {
		this.token = token;
		this.baseUrl = baseUrl;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-commit-watch")
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = baseUrl + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			long retryAfter = parseLongHeader(response, "Retry-After", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = RateLimitInfo.fromHeaders(limit, remaining, reset);
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset, retryAfter);
				}
				throw new GitHubApiException("Forbidden: " + request.uri(), statusCode, response.body(), remaining,
						reset, retryAfter);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset, retryAfter);
			}
			else if (statusCode == 409) {
				throw new GitHubApiException("Conflict (repository is empty?): " + request.uri(), statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset, retryAfter);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset, retryAfter);
			}
		}
		catch (HttpTimeoutException e) {
			logger.warn("HTTP request timed out after {}: {}", requestTimeout, request.uri());
			throw new GitHubApiException("HTTP request timed out: " + request.uri(), e);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries the status code and rate limit headers so that
	 * {@link GitHubRepositoryClient} can classify the failure.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		private final long retryAfterSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds, long retryAfterSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
			this.retryAfterSeconds = retryAfterSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
			this.retryAfterSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public long getRetryAfterSeconds() {
			return retryAfterSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true for failures worth retrying within the same request: network
		 * errors (no status code) and 5xx responses.
		 */
		public boolean isTransient() {
			return statusCode < 0 || statusCode >= 500;
		}

	}

}
