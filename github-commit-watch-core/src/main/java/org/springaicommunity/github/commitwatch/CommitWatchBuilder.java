package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builder for the watch engine without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // GitHub token and settings from the environment, state in STATE_DIR
 * CommitWatch watch = CommitWatchBuilder.create()
 *     .propertiesFromEnv()
 *     .notificationSink((subscriber, notification) -> chat.send(subscriber, notification))
 *     .build();
 * watch.scheduler().start();
 *
 * // In-memory state and a mocked upstream for tests
 * CommitWatch testWatch = CommitWatchBuilder.create()
 *     .repositoryClient(mockClient)
 *     .cursorStore(new InMemoryCursorStore())
 *     .subscriptionIndex(new InMemorySubscriptionIndex())
 *     .notificationSink(recordingSink)
 *     .build();
 * }
 * </pre>
 */
public class CommitWatchBuilder {

	private WatchProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	@Nullable
	private RepositoryClient repositoryClient;

	@Nullable
	private CursorStore cursorStore;

	@Nullable
	private SubscriptionIndex subscriptionIndex;

	@Nullable
	private NotificationSink notificationSink;

	@Nullable
	private ConnectionService connectionService;

	private Clock clock = Clock.systemUTC();

	private CommitWatchBuilder() {
		this.properties = new WatchProperties();
	}

	public static CommitWatchBuilder create() {
		return new CommitWatchBuilder();
	}

	/**
	 * Set watch properties.
	 * @param properties configuration (null to use defaults)
	 * @return this builder
	 */
	public CommitWatchBuilder properties(@Nullable WatchProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Read watch properties from {@code .env} files and the process environment.
	 * @return this builder
	 * @see WatchProperties#fromEnvironment()
	 */
	public CommitWatchBuilder propertiesFromEnv() {
		this.properties = WatchProperties.fromEnvironment();
		return this;
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public CommitWatchBuilder token(String token) {
		this.properties.setGithubToken(token);
		return this;
	}

	public CommitWatchBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom {@link GitHubClient}, for example a mock or an additional decorator.
	 * When set, the token is only needed for the connection check.
	 * @param httpClient the client (null to use the default retrying HTTP client)
	 * @return this builder
	 */
	public CommitWatchBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Replace the upstream adapter entirely. Takes precedence over
	 * {@link #httpClient(GitHubClient)}.
	 * @param repositoryClient the adapter (null to use {@link GitHubRepositoryClient})
	 * @return this builder
	 */
	public CommitWatchBuilder repositoryClient(@Nullable RepositoryClient repositoryClient) {
		this.repositoryClient = repositoryClient;
		return this;
	}

	/**
	 * Set a custom cursor store.
	 * @param cursorStore the store (null to use {@link FileSystemCursorStore} in the
	 * state directory)
	 * @return this builder
	 */
	public CommitWatchBuilder cursorStore(@Nullable CursorStore cursorStore) {
		this.cursorStore = cursorStore;
		return this;
	}

	/**
	 * Set a custom subscription index.
	 * @param subscriptionIndex the index (null to use {@link FileSystemSubscriptionIndex}
	 * in the state directory)
	 * @return this builder
	 */
	public CommitWatchBuilder subscriptionIndex(@Nullable SubscriptionIndex subscriptionIndex) {
		this.subscriptionIndex = subscriptionIndex;
		return this;
	}

	public CommitWatchBuilder notificationSink(NotificationSink notificationSink) {
		this.notificationSink = notificationSink;
		return this;
	}

	public CommitWatchBuilder connectionService(@Nullable ConnectionService connectionService) {
		this.connectionService = connectionService;
		return this;
	}

	public CommitWatchBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the engine. The scheduler is returned unstarted.
	 * @return the wired engine
	 * @throws IllegalStateException if no notification sink is set, or no GitHub token
	 * is available where the default GitHub client is needed
	 * @throws StorageException if the state directory cannot be loaded
	 */
	public CommitWatch build() {
		if (notificationSink == null) {
			throw new IllegalStateException("A NotificationSink is required");
		}
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		Path stateDirectory = Path.of(properties.getStateDir());

		CursorStore cursors = cursorStore != null ? cursorStore : new FileSystemCursorStore(stateDirectory, mapper);
		SubscriptionIndex subscriptions = subscriptionIndex != null ? subscriptionIndex
				: new FileSystemSubscriptionIndex(stateDirectory, mapper);
		RepositoryClient client = repositoryClient != null ? repositoryClient : buildRepositoryClient(mapper);
		ConnectionService connection = connectionService != null ? connectionService : buildConnectionService();

		WatchStatistics statistics = new WatchStatistics(clock);
		NotificationDispatcher dispatcher = new NotificationDispatcher(subscriptions, notificationSink, statistics,
				properties.getAdminIds(), properties.getMaxCommitMessages());
		FailurePolicy failurePolicy = new FailurePolicy(properties, clock);
		RepositoryChecker checker = new RepositoryChecker(cursors, client, new ChangeDetector(), dispatcher,
				failurePolicy, statistics, clock);
		CommitWatchScheduler scheduler = new CommitWatchScheduler(subscriptions, cursors, checker, properties, clock);
		CommitWatchService service = new CommitWatchService(properties, subscriptions, cursors, client, scheduler,
				statistics, connection);
		return new CommitWatch(service, scheduler, statistics);
	}

	private RepositoryClient buildRepositoryClient(ObjectMapper mapper) {
		GitHubClient client = httpClient;
		if (client == null) {
			client = RetryingGitHubClient.builder()
				.wrapping(new GitHubHttpClient(properties.requireGithubToken(), GitHubHttpClient.GITHUB_API_BASE,
						properties.getRequestTimeout()))
				.build();
		}
		return new GitHubRepositoryClient(client, mapper, properties.getMaxCommitsPerCheck(), clock);
	}

	private ConnectionService buildConnectionService() {
		String token = properties.getGithubToken();
		if (token == null) {
			return () -> ConnectionStatus.failed("No GitHub token configured");
		}
		return GitHubConnectionService.forToken(token);
	}

}
