package org.springaicommunity.github.commitwatch;

import org.kohsuke.github.GHMyself;
import org.kohsuke.github.GHRateLimit;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * {@link ConnectionService} backed by the kohsuke GitHub API client: authenticates as the
 * token owner and reads the core rate limit.
 */
public class GitHubConnectionService implements ConnectionService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubConnectionService.class);

	private final GitHub gitHub;

	public GitHubConnectionService(GitHub gitHub) {
		this.gitHub = gitHub;
	}

	/**
	 * Create a service authenticating with a personal access token.
	 * @param token GitHub token
	 * @return the service
	 * @throws IllegalStateException if the client cannot be created
	 */
	public static GitHubConnectionService forToken(String token) {
		try {
			return new GitHubConnectionService(new GitHubBuilder().withOAuthToken(token).build());
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to create GitHub client: " + e.getMessage(), e);
		}
	}

	@Override
	public ConnectionStatus check() {
		try {
			GHMyself myself = gitHub.getMyself();
			GHRateLimit.Record core = gitHub.getRateLimit().getCore();
			return ConnectionStatus.connected(myself.getLogin(), core.getLimit(), core.getRemaining(),
					Instant.ofEpochSecond(core.getResetEpochSeconds()));
		}
		catch (HttpException e) {
			logger.warn("GitHub connection check failed with HTTP {}", e.getResponseCode());
			if (e.getResponseCode() == 401) {
				return ConnectionStatus.failed("GitHub rejected the configured token");
			}
			return ConnectionStatus.failed("GitHub returned HTTP " + e.getResponseCode());
		}
		catch (IOException e) {
			logger.warn("GitHub connection check failed: {}", e.getMessage());
			return ConnectionStatus.failed(String.valueOf(e.getMessage()));
		}
	}

}
