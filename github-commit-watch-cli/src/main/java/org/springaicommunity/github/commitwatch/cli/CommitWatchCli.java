package org.springaicommunity.github.commitwatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.commitwatch.CommitWatch;
import org.springaicommunity.github.commitwatch.CommitWatchBuilder;
import org.springaicommunity.github.commitwatch.WatchProperties;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * GitHub Commit Watch CLI
 *
 * Polls the watched repositories and prints notifications to standard output. Commands
 * are read from standard input on behalf of a single console subscriber. No Spring
 * dependencies - uses CommitWatchBuilder for wiring.
 *
 * Usage: java -jar github-commit-watch-cli.jar [--subscriber ID]
 *
 * Environment Variables: GITHUB_TOKEN (required), ADMIN_CHAT_IDS, CHECK_INTERVAL,
 * STATE_DIR, NOT_FOUND_THRESHOLD, MAX_CONCURRENT_CHECKS
 *
 * Exit codes: 0 after /quit, 1 on configuration or startup errors, 2 when GitHub rejected
 * the credentials.
 */
public class CommitWatchCli {

	private static final Logger logger = LoggerFactory.getLogger(CommitWatchCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_HALTED = 2;

	static final String DEFAULT_SUBSCRIBER = "console";

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.in, System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Commit watch failed: {}", e.getMessage());
			System.exit(EXIT_ERROR);
		}
	}

	public static int run(String[] args, InputStream in, PrintStream out) throws InterruptedException {
		CliOptions options = CliOptions.parse(args);
		if (options.help()) {
			out.println(usage());
			return EXIT_OK;
		}

		WatchProperties properties = WatchProperties.fromEnvironment();
		properties.requireGithubToken();
		logger.info("State directory: {}", properties.getStateDir());
		logger.info("Check interval: {}s", properties.getCheckInterval().toSeconds());
		logger.info("Admins: {}", properties.getAdminIds().isEmpty() ? "everyone" : properties.getAdminIds());

		CommitWatch watch = CommitWatchBuilder.create()
			.properties(properties)
			.notificationSink(new ConsoleTransport(out, new NotificationFormatter()))
			.build();
		Thread shutdownHook = new Thread(watch::close, "commit-watch-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			watch.scheduler().start();
			CountDownLatch quit = new CountDownLatch(1);
			ConsoleCommandHandler handler = new ConsoleCommandHandler(watch.service(), options.subscriberId(), out);
			Thread reader = new Thread(() -> readCommands(in, handler, quit), "commit-watch-console");
			reader.setDaemon(true);
			reader.start();
			out.println("Watching as " + options.subscriberId() + ". Type /help for commands.");

			while (!quit.await(1, TimeUnit.SECONDS)) {
				if (watch.scheduler().awaitHalt(Duration.ZERO)) {
					logger.error("Stopped: {}", watch.scheduler().getHaltReason().orElse("unknown"));
					return EXIT_HALTED;
				}
			}
			return EXIT_OK;
		}
		finally {
			watch.close();
			removeShutdownHook(shutdownHook);
		}
	}

	private static void readCommands(InputStream in, ConsoleCommandHandler handler, CountDownLatch quit) {
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (!handler.handle(line)) {
					quit.countDown();
					return;
				}
			}
			// no more input: keep polling until the process is stopped
			logger.info("Console input closed, commands are no longer read");
		}
		catch (IOException e) {
			logger.warn("Failed to read console input: {}", e.getMessage());
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM already shutting down");
		}
	}

	static String usage() {
		return String.join("\n", "Usage: github-commit-watch [--subscriber ID] [--help]", "",
				"Options:", "  --subscriber ID   console subscriber id (default: " + DEFAULT_SUBSCRIBER + ")",
				"  --help            show this help", "", "Environment:",
				"  GITHUB_TOKEN           GitHub personal access token (required)",
				"  ADMIN_CHAT_IDS         comma separated subscriber ids allowed to use commands",
				"  CHECK_INTERVAL         seconds between checks (default 60, minimum 30)",
				"  STATE_DIR              state directory (default .commit-watch)",
				"  NOT_FOUND_THRESHOLD    failed lookups before a repository is paused (default 3)",
				"  MAX_CONCURRENT_CHECKS  parallel repository checks (default 4)", "",
				ConsoleCommandHandler.HELP_TEXT);
	}

	/**
	 * Parsed command line options.
	 */
	record CliOptions(String subscriberId, boolean help) {

		static CliOptions parse(String[] args) {
			String subscriberId = DEFAULT_SUBSCRIBER;
			boolean help = false;
			for (int i = 0; i < args.length; i++) {
				switch (args[i]) {
					case "-h", "--help" -> help = true;
					case "--subscriber" -> {
						if (i + 1 >= args.length || args[i + 1].isBlank()) {
							throw new IllegalArgumentException("--subscriber requires a value");
						}
						subscriberId = args[++i].trim();
					}
					default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
				}
			}
			return new CliOptions(subscriberId, help);
		}

	}

}
