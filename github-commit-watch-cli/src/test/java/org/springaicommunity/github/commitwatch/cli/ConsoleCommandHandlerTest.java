package org.springaicommunity.github.commitwatch.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.commitwatch.AddResult;
import org.springaicommunity.github.commitwatch.CheckResult;
import org.springaicommunity.github.commitwatch.CheckState;
import org.springaicommunity.github.commitwatch.CommitRef;
import org.springaicommunity.github.commitwatch.CommitWatchService;
import org.springaicommunity.github.commitwatch.ConnectionStatus;
import org.springaicommunity.github.commitwatch.FailureKind;
import org.springaicommunity.github.commitwatch.ReachabilityState;
import org.springaicommunity.github.commitwatch.RepositoryId;
import org.springaicommunity.github.commitwatch.RepositoryStatus;
import org.springaicommunity.github.commitwatch.UnauthorizedSubscriberException;
import org.springaicommunity.github.commitwatch.WatchStatistics;
import org.springaicommunity.github.commitwatch.WatchStats;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ConsoleCommandHandler Tests")
@ExtendWith(MockitoExtension.class)
class ConsoleCommandHandlerTest {

	private static final RepositoryId REPO = RepositoryId.parse("octo/hello");

	@Mock
	private CommitWatchService service;

	private ByteArrayOutputStream buffer;

	private ConsoleCommandHandler handler;

	@BeforeEach
	void setUp() {
		buffer = new ByteArrayOutputStream();
		handler = new ConsoleCommandHandler(service, "42", new PrintStream(buffer, true, StandardCharsets.UTF_8));
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Nested
	@DisplayName("/add")
	class AddTest {

		@Test
		@DisplayName("Should confirm a new subscription")
		void shouldConfirmNewSubscription() {
			when(service.add("42", "octo/hello"))
				.thenReturn(new AddResult(AddResult.Status.ADDED, REPO, "main", false, null));

			assertThat(handler.handle("/add octo/hello")).isTrue();

			assertThat(output()).contains("Checking repository octo/hello...").contains("Now watching octo/hello (branch main)");
		}

		@Test
		@DisplayName("Should mention resumed checks")
		void shouldMentionReactivation() {
			when(service.add("42", "octo/hello"))
				.thenReturn(new AddResult(AddResult.Status.ALREADY_SUBSCRIBED, REPO, "main", true, null));

			handler.handle("/add octo/hello");

			assertThat(output()).contains("You are already watching octo/hello, checks resumed");
		}

		@Test
		@DisplayName("Should report a missing repository")
		void shouldReportMissingRepository() {
			when(service.add("42", "octo/hello"))
				.thenReturn(new AddResult(AddResult.Status.NOT_FOUND, REPO, null, false, "Not Found"));

			handler.handle("/add octo/hello");

			assertThat(output()).contains("Repository octo/hello was not found or is not accessible");
		}

		@Test
		@DisplayName("Should ask for a repository name")
		void shouldAskForName() {
			handler.handle("/add");

			assertThat(output()).contains("Please enter a repository name: /add owner/name");
			verifyNoInteractions(service);
		}

		@Test
		@DisplayName("Should echo validation errors")
		void shouldEchoValidationErrors() {
			when(service.add("42", "nope"))
				.thenThrow(new IllegalArgumentException("Invalid repository 'nope'. Expected format: owner/repository-name"));

			handler.handle("/add nope");

			assertThat(output()).contains("Expected format: owner/repository-name");
		}

	}

	@Test
	@DisplayName("Should confirm removal and report unknown subscriptions")
	void shouldHandleRemove() {
		when(service.remove("42", "Octo/Hello")).thenReturn(true);
		when(service.remove("42", "octo/other")).thenReturn(false);

		handler.handle("/remove Octo/Hello");
		handler.handle("/remove octo/other");

		assertThat(output()).contains("Stopped watching octo/hello").contains("You are not watching octo/other");
	}

	@Test
	@DisplayName("Should list repositories with their state")
	void shouldListRepositories() {
		Instant checkedAt = Instant.parse("2024-05-01T10:00:00Z");
		when(service.list("42")).thenReturn(List.of(new RepositoryStatus(REPO, "main", checkedAt,
				"0123456789abcdef", checkedAt, ReachabilityState.ACTIVE, CheckState.IDLE, 0)));

		handler.handle("/list");

		assertThat(output()).contains("1. octo/hello")
			.contains("Branch: main")
			.contains("Last commit: 0123456")
			.contains("State: ACTIVE, IDLE")
			.contains("https://github.com/octo/hello");
	}

	@Test
	@DisplayName("Should explain how to start when nothing is watched")
	void shouldListNothing() {
		when(service.list("42")).thenReturn(List.of());

		handler.handle("/list");

		assertThat(output()).contains("You are not watching any repositories");
	}

	@Test
	@DisplayName("Should summarize a manual check")
	void shouldSummarizeCheck() {
		RepositoryId other = RepositoryId.parse("octo/world");
		CommitRef tip = new CommitRef("abcdef0123", "Ada", "", Instant.EPOCH, "Tip", 0, 0, 0, "url");
		when(service.check("42")).thenReturn(List.of(new CheckResult.NewCommits(REPO, List.of(tip, tip), "abcdef0123"),
				new CheckResult.Skipped(other, CheckResult.SkipReason.CONCURRENT_UPDATE)));

		handler.handle("/check");

		assertThat(output()).contains("octo/hello: 2 new commit(s)").contains("octo/world: skipped (concurrent update)");
	}

	@Test
	@DisplayName("Should describe every kind of check result")
	void shouldDescribeResults() {
		CommitRef tip = new CommitRef("abcdef0123", "Ada", "", Instant.EPOCH, "Tip", 0, 0, 0, "url");

		assertThat(ConsoleCommandHandler.describe(new CheckResult.NoChange(REPO, true))).isEqualTo("baseline recorded");
		assertThat(ConsoleCommandHandler.describe(new CheckResult.NoChange(REPO, false))).isEqualTo("no new commits");
		assertThat(ConsoleCommandHandler.describe(new CheckResult.HistoryRewritten(REPO, "c1", tip)))
			.isEqualTo("history rewritten, now at abcdef0");
		assertThat(ConsoleCommandHandler
			.describe(new CheckResult.Failure(REPO, FailureKind.NOT_FOUND, "Not Found", null, false)))
			.isEqualTo("failed (NOT_FOUND): Not Found");
	}

	@Test
	@DisplayName("Should print statistics and connection status")
	void shouldPrintStatsAndStatus() {
		WatchStatistics.Snapshot counters = new WatchStatistics.Snapshot(Instant.EPOCH, 10, 1, 4, 8, 0);
		when(service.stats("42")).thenReturn(new WatchStats(3, 2, counters, Duration.ofSeconds(60)));
		when(service.status("42")).thenReturn(ConnectionStatus.failed("GitHub rejected the configured token"));

		handler.handle("/stats");
		handler.handle("/status");

		assertThat(output()).contains("Repositories tracked: 3")
			.contains("Checks performed: 10")
			.contains("Check interval: 60s")
			.contains("GitHub: not connected (GitHub rejected the configured token)");
	}

	@Test
	@DisplayName("Should refuse unauthorized subscribers")
	void shouldRefuseUnauthorized() {
		when(service.list("42")).thenThrow(new UnauthorizedSubscriberException("42"));

		handler.handle("/list");

		assertThat(output()).contains("You are not allowed to use this bot.");
	}

	@Test
	@DisplayName("Should keep running after an unexpected failure")
	void shouldSurviveFailures() {
		when(service.check("42")).thenThrow(new IllegalStateException("boom"));

		assertThat(handler.handle("/check")).isTrue();
		assertThat(output()).contains("Command failed: boom");
	}

	@Test
	@DisplayName("Should show help, reject unknown commands and stop on quit")
	void shouldHandleMetaCommands() {
		assertThat(handler.handle("/help")).isTrue();
		assertThat(handler.handle("/frobnicate")).isTrue();
		assertThat(handler.handle("   ")).isTrue();
		assertThat(handler.handle("/QUIT")).isFalse();

		assertThat(output()).contains("/add owner/name").contains("Unknown command /frobnicate");
		verifyNoInteractions(service);
	}

}
