package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration for the watch engine.
 *
 * <p>
 * Defaults suit a small bot instance. Values can be set directly via setters, passed to
 * {@link CommitWatchBuilder}, or read from the environment with {@link #fromEnvironment()}.
 */
public class WatchProperties {

	private static final Logger logger = LoggerFactory.getLogger(WatchProperties.class);

	/**
	 * Lower bound applied to {@code CHECK_INTERVAL}.
	 */
	public static final Duration MIN_CHECK_INTERVAL = Duration.ofSeconds(30);

	@Nullable
	private String githubToken;

	@Nullable
	private String botToken;

	/**
	 * Subscribers allowed to run commands. Empty means everyone.
	 */
	private Set<String> adminIds = Set.of();

	private Duration checkInterval = Duration.ofSeconds(60);

	/**
	 * Directory holding {@code cursors.json} and {@code subscriptions.json}.
	 */
	private String stateDir = ".commit-watch";

	/**
	 * Consecutive NOT_FOUND failures before a repository is marked unreachable.
	 */
	private int notFoundThreshold = 3;

	private int maxConcurrentChecks = 4;

	/**
	 * Oldest new commits fetched per cycle; the rest follow on the next cycle.
	 */
	private int maxCommitsPerCheck = 20;

	/**
	 * Individual commit messages per batch and subscriber before a summary is sent.
	 */
	private int maxCommitMessages = 5;

	private Duration initialBackoff = Duration.ofSeconds(60);

	private Duration maxBackoff = Duration.ofMinutes(30);

	/**
	 * Consecutive storage failures of one repository before admins are alerted.
	 */
	private int storageAlertThreshold = 3;

	/**
	 * Consecutive transient failures of one repository before admins are alerted.
	 */
	private int transientAlertThreshold = 5;

	private Duration requestTimeout = Duration.ofSeconds(30);

	private Duration shutdownGracePeriod = Duration.ofSeconds(10);

	/**
	 * Read configuration from {@code .env} files and the process environment.
	 * @return properties with environment overrides applied
	 * @see EnvironmentSupport
	 */
	public static WatchProperties fromEnvironment() {
		return fromEnvironment(EnvironmentSupport::get);
	}

	/**
	 * Read configuration through the given variable lookup.
	 * @param environment resolves a variable name to its value or null
	 * @return properties with overrides applied
	 * @throws IllegalArgumentException if a numeric variable is malformed
	 */
	public static WatchProperties fromEnvironment(Function<String, @Nullable String> environment) {
		WatchProperties properties = new WatchProperties();
		properties.setGithubToken(trimToNull(environment.apply("GITHUB_TOKEN")));
		properties.setBotToken(trimToNull(environment.apply("BOT_TOKEN")));
		properties.setAdminIds(parseAdminIds(environment.apply("ADMIN_CHAT_IDS")));

		String interval = trimToNull(environment.apply("CHECK_INTERVAL"));
		if (interval != null) {
			properties.setCheckInterval(parseInterval(interval));
		}
		String stateDir = trimToNull(environment.apply("STATE_DIR"));
		if (stateDir != null) {
			properties.setStateDir(stateDir);
		}
		String threshold = trimToNull(environment.apply("NOT_FOUND_THRESHOLD"));
		if (threshold != null) {
			properties.setNotFoundThreshold(parsePositive("NOT_FOUND_THRESHOLD", threshold));
		}
		String concurrency = trimToNull(environment.apply("MAX_CONCURRENT_CHECKS"));
		if (concurrency != null) {
			properties.setMaxConcurrentChecks(parsePositive("MAX_CONCURRENT_CHECKS", concurrency));
		}
		String transientAlert = trimToNull(environment.apply("TRANSIENT_ALERT_THRESHOLD"));
		if (transientAlert != null) {
			properties.setTransientAlertThreshold(parsePositive("TRANSIENT_ALERT_THRESHOLD", transientAlert));
		}
		return properties;
	}

	/**
	 * Parse a comma separated admin list. Surrounding brackets, quotes and blanks are
	 * ignored, so both {@code 1,2} and {@code [1, 2]} are accepted.
	 * @param raw the variable value, may be null
	 * @return the admin ids in declaration order
	 */
	static Set<String> parseAdminIds(@Nullable String raw) {
		if (raw == null) {
			return Set.of();
		}
		String stripped = raw.trim();
		if (stripped.startsWith("[")) {
			stripped = stripped.substring(1);
		}
		if (stripped.endsWith("]")) {
			stripped = stripped.substring(0, stripped.length() - 1);
		}
		Set<String> ids = new LinkedHashSet<>();
		for (String part : stripped.split(",")) {
			String id = part.trim().replace("\"", "").replace("'", "");
			if (!id.isEmpty()) {
				ids.add(id);
			}
		}
		return ids;
	}

	static Duration parseInterval(String raw) {
		long seconds = parsePositive("CHECK_INTERVAL", raw);
		Duration interval = Duration.ofSeconds(seconds);
		if (interval.compareTo(MIN_CHECK_INTERVAL) < 0) {
			logger.warn("CHECK_INTERVAL {}s is below the minimum, using {}s", seconds, MIN_CHECK_INTERVAL.toSeconds());
			return MIN_CHECK_INTERVAL;
		}
		return interval;
	}

	static int parsePositive(String name, String raw) {
		int value;
		try {
			value = Integer.parseInt(raw.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " must be a number: " + raw, e);
		}
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive: " + raw);
		}
		return value;
	}

	@Nullable
	private static String trimToNull(@Nullable String value) {
		if (value == null || value.trim().isEmpty()) {
			return null;
		}
		return value.trim();
	}

	/**
	 * Returns the GitHub token, failing when it is missing.
	 * @return the token
	 * @throws IllegalStateException if no token is configured
	 */
	public String requireGithubToken() {
		if (githubToken == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return githubToken;
	}

	/**
	 * Returns true when the subscriber may run commands.
	 * @param subscriberId the subscriber
	 * @return true if no admin list is configured or the subscriber is on it
	 */
	public boolean isAuthorized(String subscriberId) {
		return adminIds.isEmpty() || adminIds.contains(subscriberId);
	}

	@Nullable
	public String getGithubToken() {
		return githubToken;
	}

	public void setGithubToken(@Nullable String githubToken) {
		this.githubToken = githubToken;
	}

	@Nullable
	public String getBotToken() {
		return botToken;
	}

	public void setBotToken(@Nullable String botToken) {
		this.botToken = botToken;
	}

	public Set<String> getAdminIds() {
		return adminIds;
	}

	public void setAdminIds(Set<String> adminIds) {
		this.adminIds = Set.copyOf(adminIds);
	}

	public Duration getCheckInterval() {
		return checkInterval;
	}

	/**
	 * Sets the poll interval. The {@link #MIN_CHECK_INTERVAL} floor is applied only to
	 * values read from the environment.
	 * @param checkInterval a positive interval
	 */
	public void setCheckInterval(Duration checkInterval) {
		requirePositive("checkInterval", checkInterval);
		this.checkInterval = checkInterval;
	}

	public String getStateDir() {
		return stateDir;
	}

	public void setStateDir(String stateDir) {
		this.stateDir = stateDir;
	}

	public int getNotFoundThreshold() {
		return notFoundThreshold;
	}

	public void setNotFoundThreshold(int notFoundThreshold) {
		this.notFoundThreshold = notFoundThreshold;
	}

	public int getMaxConcurrentChecks() {
		return maxConcurrentChecks;
	}

	public void setMaxConcurrentChecks(int maxConcurrentChecks) {
		this.maxConcurrentChecks = maxConcurrentChecks;
	}

	public int getMaxCommitsPerCheck() {
		return maxCommitsPerCheck;
	}

	public void setMaxCommitsPerCheck(int maxCommitsPerCheck) {
		this.maxCommitsPerCheck = maxCommitsPerCheck;
	}

	public int getMaxCommitMessages() {
		return maxCommitMessages;
	}

	public void setMaxCommitMessages(int maxCommitMessages) {
		this.maxCommitMessages = maxCommitMessages;
	}

	public Duration getInitialBackoff() {
		return initialBackoff;
	}

	public void setInitialBackoff(Duration initialBackoff) {
		requirePositive("initialBackoff", initialBackoff);
		this.initialBackoff = initialBackoff;
	}

	public Duration getMaxBackoff() {
		return maxBackoff;
	}

	public void setMaxBackoff(Duration maxBackoff) {
		requirePositive("maxBackoff", maxBackoff);
		this.maxBackoff = maxBackoff;
	}

	public int getStorageAlertThreshold() {
		return storageAlertThreshold;
	}

	public void setStorageAlertThreshold(int storageAlertThreshold) {
		this.storageAlertThreshold = storageAlertThreshold;
	}

	public int getTransientAlertThreshold() {
		return transientAlertThreshold;
	}

	public void setTransientAlertThreshold(int transientAlertThreshold) {
		this.transientAlertThreshold = transientAlertThreshold;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		requirePositive("requestTimeout", requestTimeout);
		this.requestTimeout = requestTimeout;
	}

	public Duration getShutdownGracePeriod() {
		return shutdownGracePeriod;
	}

	public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
		this.shutdownGracePeriod = shutdownGracePeriod;
	}

	private static void requirePositive(String name, Duration value) {
		if (value.isNegative() || value.isZero()) {
			throw new IllegalArgumentException(name + " must be positive: " + value);
		}
	}

}
