package org.springaicommunity.github.commitwatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.commitwatch.AddResult;
import org.springaicommunity.github.commitwatch.CheckResult;
import org.springaicommunity.github.commitwatch.CommitWatchService;
import org.springaicommunity.github.commitwatch.ConnectionStatus;
import org.springaicommunity.github.commitwatch.RepositoryStatus;
import org.springaicommunity.github.commitwatch.UnauthorizedSubscriberException;
import org.springaicommunity.github.commitwatch.WatchStatistics;
import org.springaicommunity.github.commitwatch.WatchStats;

import java.io.PrintStream;
import java.util.List;

/**
 * Interprets slash commands typed on the console and prints the replies.
 */
public class ConsoleCommandHandler {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleCommandHandler.class);

	static final String HELP_TEXT = """
			Commands:
			  /add owner/name     start watching a repository
			  /remove owner/name  stop watching a repository
			  /list               show watched repositories
			  /check              check all watched repositories now
			  /stats              show watch statistics
			  /status             show GitHub connection status
			  /help               show this help
			  /quit               stop the watcher""";

	private final CommitWatchService service;

	private final String subscriberId;

	private final PrintStream out;

	public ConsoleCommandHandler(CommitWatchService service, String subscriberId, PrintStream out) {
		this.service = service;
		this.subscriberId = subscriberId;
		this.out = out;
	}

	/**
	 * Handle one input line.
	 * @param line the raw line
	 * @return false when the user asked to quit
	 */
	public boolean handle(String line) {
		String trimmed = line.trim();
		if (trimmed.isEmpty()) {
			return true;
		}
		String[] parts = trimmed.split("\\s+", 2);
		String command = parts[0].toLowerCase();
		String argument = parts.length > 1 ? parts[1].trim() : "";

		try {
			switch (command) {
				case "/quit", "/exit" -> {
					return false;
				}
				case "/start", "/help" -> reply(HELP_TEXT);
				case "/add" -> add(argument);
				case "/remove" -> remove(argument);
				case "/list" -> list();
				case "/check" -> check();
				case "/stats" -> stats();
				case "/status" -> status();
				default -> reply("Unknown command " + command + ". Type /help for the list of commands.");
			}
		}
		catch (UnauthorizedSubscriberException e) {
			reply("You are not allowed to use this bot.");
		}
		catch (IllegalArgumentException e) {
			reply(e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("Command {} failed", command, e);
			reply("Command failed: " + e.getMessage());
		}
		return true;
	}

	private void add(String repository) {
		if (repository.isEmpty()) {
			reply("Please enter a repository name: /add owner/name");
			return;
		}
		reply("Checking repository " + repository + "...");
		AddResult result = service.add(subscriberId, repository);
		switch (result.status()) {
			case ADDED -> reply("Now watching " + result.repositoryId() + " (branch " + result.defaultBranch() + ")"
					+ (result.reactivated() ? ", checks resumed" : ""));
			case ALREADY_SUBSCRIBED -> reply("You are already watching " + result.repositoryId()
					+ (result.reactivated() ? ", checks resumed" : ""));
			case NOT_FOUND -> reply("Repository " + result.repositoryId() + " was not found or is not accessible");
			case FAILED -> reply("Could not add " + result.repositoryId() + ": " + result.detail());
		}
	}

	private void remove(String repository) {
		if (repository.isEmpty()) {
			reply("Please enter a repository name: /remove owner/name");
			return;
		}
		if (service.remove(subscriberId, repository)) {
			reply("Stopped watching " + repository.toLowerCase());
		}
		else {
			reply("You are not watching " + repository.toLowerCase());
		}
	}

	private void list() {
		List<RepositoryStatus> rows = service.list(subscriberId);
		if (rows.isEmpty()) {
			reply("You are not watching any repositories. Use /add owner/name to start.");
			return;
		}
		StringBuilder text = new StringBuilder("Watched repositories:\n");
		int index = 1;
		for (RepositoryStatus row : rows) {
			text.append(index++).append(". ").append(row.repositoryId()).append('\n');
			text.append("   Branch: ").append(row.defaultBranch() != null ? row.defaultBranch() : "unknown").append('\n');
			text.append("   Last check: ").append(row.lastCheckedAt() != null ? row.lastCheckedAt() : "never").append('\n');
			if (row.lastCommitId() != null) {
				text.append("   Last commit: ").append(row.lastCommitId(), 0, Math.min(7, row.lastCommitId().length()))
					.append('\n');
			}
			text.append("   State: ").append(row.reachability()).append(", ").append(row.checkState()).append('\n');
			text.append("   ").append(row.repositoryId().htmlUrl()).append('\n');
		}
		reply(text.toString().stripTrailing());
	}

	private void check() {
		reply("Checking your repositories...");
		List<CheckResult> results = service.check(subscriberId);
		if (results.isEmpty()) {
			reply("You are not watching any repositories.");
			return;
		}
		StringBuilder text = new StringBuilder("Check complete:\n");
		for (CheckResult result : results) {
			text.append("  ").append(result.repositoryId()).append(": ").append(describe(result)).append('\n');
		}
		reply(text.toString().stripTrailing());
	}

	static String describe(CheckResult result) {
		if (result instanceof CheckResult.NoChange noChange) {
			return noChange.baseline() ? "baseline recorded" : "no new commits";
		}
		if (result instanceof CheckResult.NewCommits newCommits) {
			return newCommits.commits().size() + " new commit(s)";
		}
		if (result instanceof CheckResult.HistoryRewritten rewritten) {
			return "history rewritten, now at " + rewritten.newTip().shortId();
		}
		if (result instanceof CheckResult.Failure failure) {
			return "failed (" + failure.kind() + "): " + failure.detail();
		}
		CheckResult.Skipped skipped = (CheckResult.Skipped) result;
		return "skipped (" + skipped.reason().name().toLowerCase().replace('_', ' ') + ")";
	}

	private void stats() {
		WatchStats stats = service.stats(subscriberId);
		WatchStatistics.Snapshot counters = stats.counters();
		reply(String.join("\n", "Statistics:", "  Repositories tracked: " + stats.repositoriesTracked(),
				"  Your repositories: " + stats.subscriberRepositories(),
				"  Checks performed: " + counters.checksPerformed(), "  Check failures: " + counters.checkFailures(),
				"  Commits detected: " + counters.commitsDetected(),
				"  Notifications sent: " + counters.notificationsSent(),
				"  Delivery failures: " + counters.deliveryFailures(),
				"  Check interval: " + stats.checkInterval().toSeconds() + "s",
				"  Running since: " + counters.startedAt()));
	}

	private void status() {
		ConnectionStatus status = service.status(subscriberId);
		if (status.connected()) {
			reply("GitHub: connected as " + status.login() + "\nRate limit: " + status.rateRemaining() + "/"
					+ status.rateLimit() + ", resets at " + status.rateResetAt());
		}
		else {
			reply("GitHub: not connected (" + status.error() + ")");
		}
	}

	private void reply(String text) {
		synchronized (out) {
			out.println(text);
		}
	}

}
