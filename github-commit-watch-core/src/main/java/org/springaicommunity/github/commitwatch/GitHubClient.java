package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Keeps the {@link GitHubRepositoryClient} independent of the transport so that it can be
 * tested against canned responses and wrapped by decorators such as
 * {@link RetryingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
