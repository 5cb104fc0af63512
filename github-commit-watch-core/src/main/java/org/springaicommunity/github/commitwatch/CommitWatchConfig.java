package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration for the watch engine. The application supplies the
 * {@link NotificationSink} bean for its chat transport.
 */
@Configuration
public class CommitWatchConfig {

	@Value("${GITHUB_TOKEN}")
	private String githubToken;

	@Value("${STATE_DIR:.commit-watch}")
	private String stateDir;

	@Value("${CHECK_INTERVAL:60}")
	private String checkInterval;

	@Value("${ADMIN_CHAT_IDS:}")
	private String adminChatIds;

	@Value("${BOT_TOKEN:}")
	private String botToken;

	@Value("${NOT_FOUND_THRESHOLD:3}")
	private String notFoundThreshold;

	@Value("${MAX_CONCURRENT_CHECKS:4}")
	private String maxConcurrentChecks;

	@Value("${TRANSIENT_ALERT_THRESHOLD:5}")
	private String transientAlertThreshold;

	@Bean
	public WatchProperties watchProperties() {
		WatchProperties properties = new WatchProperties();
		properties.setGithubToken(githubToken);
		properties.setBotToken(botToken.isBlank() ? null : botToken.trim());
		properties.setStateDir(stateDir);
		properties.setCheckInterval(WatchProperties.parseInterval(checkInterval));
		properties.setAdminIds(WatchProperties.parseAdminIds(adminChatIds));
		properties.setNotFoundThreshold(WatchProperties.parsePositive("NOT_FOUND_THRESHOLD", notFoundThreshold));
		properties
			.setMaxConcurrentChecks(WatchProperties.parsePositive("MAX_CONCURRENT_CHECKS", maxConcurrentChecks));
		properties.setTransientAlertThreshold(
				WatchProperties.parsePositive("TRANSIENT_ALERT_THRESHOLD", transientAlertThreshold));
		return properties;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitHub gitHub() throws IOException {
		return new GitHubBuilder().withOAuthToken(githubToken).build();
	}

	@Bean
	public GitHubClient gitHubClient(WatchProperties properties) {
		return RetryingGitHubClient.builder()
			.wrapping(new GitHubHttpClient(githubToken, GitHubHttpClient.GITHUB_API_BASE,
					properties.getRequestTimeout()))
			.build();
	}

	@Bean
	public RepositoryClient repositoryClient(GitHubClient gitHubClient, ObjectMapper objectMapper,
			WatchProperties properties, Clock clock) {
		return new GitHubRepositoryClient(gitHubClient, objectMapper, properties.getMaxCommitsPerCheck(), clock);
	}

	@Bean
	public ConnectionService connectionService(GitHub gitHub) {
		return new GitHubConnectionService(gitHub);
	}

	@Bean
	public CursorStore cursorStore(WatchProperties properties, ObjectMapper objectMapper) {
		return new FileSystemCursorStore(Path.of(properties.getStateDir()), objectMapper);
	}

	@Bean
	public SubscriptionIndex subscriptionIndex(WatchProperties properties, ObjectMapper objectMapper) {
		return new FileSystemSubscriptionIndex(Path.of(properties.getStateDir()), objectMapper);
	}

	@Bean
	public WatchStatistics watchStatistics(Clock clock) {
		return new WatchStatistics(clock);
	}

	@Bean
	public NotificationDispatcher notificationDispatcher(SubscriptionIndex subscriptionIndex, NotificationSink sink,
			WatchStatistics statistics, WatchProperties properties) {
		return new NotificationDispatcher(subscriptionIndex, sink, statistics, properties.getAdminIds(),
				properties.getMaxCommitMessages());
	}

	@Bean
	public RepositoryChecker repositoryChecker(CursorStore cursorStore, RepositoryClient repositoryClient,
			NotificationDispatcher dispatcher, WatchStatistics statistics, WatchProperties properties, Clock clock) {
		return new RepositoryChecker(cursorStore, repositoryClient, new ChangeDetector(), dispatcher,
				new FailurePolicy(properties, clock), statistics, clock);
	}

	@Bean(destroyMethod = "stop")
	public CommitWatchScheduler commitWatchScheduler(SubscriptionIndex subscriptionIndex, CursorStore cursorStore,
			RepositoryChecker checker, WatchProperties properties, Clock clock) {
		return new CommitWatchScheduler(subscriptionIndex, cursorStore, checker, properties, clock);
	}

	@Bean
	public CommitWatchService commitWatchService(WatchProperties properties, SubscriptionIndex subscriptionIndex,
			CursorStore cursorStore, RepositoryClient repositoryClient, CommitWatchScheduler scheduler,
			WatchStatistics statistics, ConnectionService connectionService) {
		return new CommitWatchService(properties, subscriptionIndex, cursorStore, repositoryClient, scheduler,
				statistics, connectionService);
	}

}
