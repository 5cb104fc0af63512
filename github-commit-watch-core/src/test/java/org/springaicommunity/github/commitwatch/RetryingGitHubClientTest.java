package org.springaicommunity.github.commitwatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGitHubClient}.
 *
 * Tests retry logic for transient failures and the immediate rethrow of client errors
 * and rate limits.
 */
@DisplayName("RetryingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGitHubClientTest {

	@Mock
	private GitHubClient mockDelegate;

	private RetryingGitHubClient retryingClient;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingClient = RetryingGitHubClient.builder().wrapping(mockDelegate).maxRetries(3).initialDelayMs(1).build();
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate get() to wrapped client")
		void shouldDelegateGet() {
			when(mockDelegate.get("/repos/octo/hello")).thenReturn("{\"name\":\"hello\"}");

			String result = retryingClient.get("/repos/octo/hello");

			assertThat(result).isEqualTo("{\"name\":\"hello\"}");
			verify(mockDelegate, times(1)).get("/repos/octo/hello");
		}

		@Test
		@DisplayName("Should delegate getWithQuery() to wrapped client")
		void shouldDelegateGetWithQuery() {
			when(mockDelegate.getWithQuery("/repos/octo/hello/compare/a...main", "per_page=20"))
				.thenReturn("{\"status\":\"identical\"}");

			String result = retryingClient.getWithQuery("/repos/octo/hello/compare/a...main", "per_page=20");

			assertThat(result).isEqualTo("{\"status\":\"identical\"}");
		}

		@Test
		@DisplayName("Should expose the delegate's rate limit info")
		void shouldExposeRateLimitInfo() {
			RateLimitInfo info = new RateLimitInfo(5000, 4999, Instant.now().plusSeconds(3600));
			when(mockDelegate.getLastRateLimitInfo()).thenReturn(info);

			assertThat(retryingClient.getLastRateLimitInfo()).isEqualTo(info);
		}

	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should retry on server error (5xx)")
		void shouldRetryOnServerError() {
			GitHubHttpClient.GitHubApiException serverError = new GitHubHttpClient.GitHubApiException("Server Error",
					502, "Bad Gateway");

			when(mockDelegate.get("/path")).thenThrow(serverError).thenThrow(serverError).thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(3)).get("/path");
		}

		@Test
		@DisplayName("Should retry on network failure")
		void shouldRetryOnNetworkFailure() {
			when(mockDelegate.get("/path"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("HTTP request timed out", new RuntimeException()))
				.thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on rate limit, the failure policy waits for the reset")
		void shouldNotRetryOnRateLimit() {
			GitHubHttpClient.GitHubApiException rateLimited = new GitHubHttpClient.GitHubApiException("Rate limited",
					403, "rate limit", 0, Instant.now().getEpochSecond() + 60, -1);

			when(mockDelegate.get("/path")).thenThrow(rateLimited);

			assertThatThrownBy(() -> retryingClient.get("/path")).isSameAs(rateLimited);
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on 404 Not Found")
		void shouldNotRetryOnNotFound() {
			GitHubHttpClient.GitHubApiException notFound = new GitHubHttpClient.GitHubApiException("Not Found", 404,
					"Not Found");

			when(mockDelegate.get("/path")).thenThrow(notFound);

			assertThatThrownBy(() -> retryingClient.get("/path"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.hasMessageContaining("Not Found");
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should NOT retry on 401 Unauthorized")
		void shouldNotRetryOnUnauthorized() {
			when(mockDelegate.get("/path"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Unauthorized", 401, "Unauthorized"));

			assertThatThrownBy(() -> retryingClient.get("/path"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).get("/path");
		}

	}

	@Nested
	@DisplayName("Max Retries Tests")
	class MaxRetriesTest {

		@Test
		@DisplayName("Should stop after max retries and throw the last exception")
		void shouldStopAfterMaxRetries() {
			GitHubHttpClient.GitHubApiException serverError = new GitHubHttpClient.GitHubApiException("Server Error",
					500, "Internal Server Error");

			when(mockDelegate.get("/path")).thenThrow(serverError);

			assertThatThrownBy(() -> retryingClient.get("/path")).isSameAs(serverError);

			// Initial attempt + 3 retries = 4 total attempts
			verify(mockDelegate, times(4)).get("/path");
		}

		@Test
		@DisplayName("Should succeed on last retry attempt")
		void shouldSucceedOnLastRetry() {
			GitHubHttpClient.GitHubApiException serverError = new GitHubHttpClient.GitHubApiException("Server Error",
					500, "Error");

			when(mockDelegate.get("/path")).thenThrow(serverError)
				.thenThrow(serverError)
				.thenThrow(serverError)
				.thenReturn("success");

			assertThat(retryingClient.get("/path")).isEqualTo("success");
			verify(mockDelegate, times(4)).get("/path");
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should default to two retries")
		void shouldBuildWithDefaults() {
			RetryingGitHubClient defaultClient = RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.initialDelay(Duration.ofMillis(1))
				.build();
			when(mockDelegate.get("/path")).thenThrow(new GitHubHttpClient.GitHubApiException("Error", 500, "Error"));

			assertThatThrownBy(() -> defaultClient.get("/path"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);

			verify(mockDelegate, times(3)).get("/path");
		}

		@Test
		@DisplayName("Should work with zero retries")
		void shouldWorkWithZeroRetries() {
			RetryingGitHubClient noRetryClient = RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.maxRetries(0)
				.initialDelayMs(1)
				.build();
			when(mockDelegate.get("/path")).thenThrow(new GitHubHttpClient.GitHubApiException("Error", 500, "Error"));

			assertThatThrownBy(() -> noRetryClient.get("/path"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should reject missing delegate")
		void shouldRejectMissingDelegate() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping");
		}

		@Test
		@DisplayName("Should reject negative max retries")
		void shouldRejectNegativeMaxRetries() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("non-negative");
		}

		@Test
		@DisplayName("Should reject non-positive initial delay")
		void shouldRejectNonPositiveInitialDelay() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().wrapping(mockDelegate).initialDelayMs(0).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("positive");
		}

	}

}
