package org.springaicommunity.github.commitwatch.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springaicommunity.github.commitwatch.CommitRef;
import org.springaicommunity.github.commitwatch.FailureKind;
import org.springaicommunity.github.commitwatch.Notification;
import org.springaicommunity.github.commitwatch.RepositoryId;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NotificationFormatter Tests")
class NotificationFormatterTest {

	private static final RepositoryId REPO = RepositoryId.parse("octo/hello");

	private static final String REPO_URL = "https://github.com/octo/hello";

	private final NotificationFormatter formatter = new NotificationFormatter(ZoneOffset.UTC);

	private static CommitRef commit(String message, int added, int removed, int modified) {
		return new CommitRef("0123456789abcdef", "Ada Lovelace", "ada@example.com",
				Instant.parse("2024-05-01T10:15:30Z"), message, added, removed, modified, REPO_URL + "/commit/0123456");
	}

	@Nested
	@DisplayName("Commit notifications")
	class CommitTest {

		@Test
		@DisplayName("Should render the commit with changes and links")
		void shouldRenderCommit() {
			String text = formatter.format(new Notification.CommitNotification(REPO, REPO_URL, "main",
					commit("Fix parser\n\nLonger body", 2, 0, 3)));

			assertThat(text).isEqualTo("""
					New commit in octo/hello (main)
					Fix parser
					Author: Ada Lovelace
					Time: 2024/05/01 - 10:15:30
					Commit: 0123456
					Changes:
					  + 2 new files
					  ~ 3 files modified
					View commit: https://github.com/octo/hello/commit/0123456
					View repository: https://github.com/octo/hello""");
		}

		@Test
		@DisplayName("Should omit the changes block when no file counts are known")
		void shouldOmitEmptyChanges() {
			String text = formatter
				.format(new Notification.CommitNotification(REPO, REPO_URL, "main", commit("Docs", 0, 0, 0)));

			assertThat(text).doesNotContain("Changes:");
		}

		@Test
		@DisplayName("Should truncate long commit messages")
		void shouldTruncateLongMessages() {
			String longMessage = "x".repeat(400);

			String text = formatter
				.format(new Notification.CommitNotification(REPO, REPO_URL, "main", commit(longMessage, 0, 1, 0)));

			assertThat(text).contains("x".repeat(297) + "...\n");
			assertThat(text).doesNotContain("x".repeat(298));
			assertThat(text).contains("  - 1 files removed");
		}

	}

	@Test
	@DisplayName("Should keep short text unchanged")
	void shouldKeepShortText() {
		assertThat(NotificationFormatter.truncate("short")).isEqualTo("short");
		assertThat(NotificationFormatter.truncate("y".repeat(300))).hasSize(300).doesNotEndWith("...");
		assertThat(NotificationFormatter.truncate("y".repeat(301))).hasSize(300).endsWith("...");
	}

	@Test
	@DisplayName("Should point to the commit list for omitted commits")
	void shouldRenderSummary() {
		String text = formatter.format(new Notification.CommitSummaryNotice(REPO, REPO_URL, 12, 7));

		assertThat(text).isEqualTo("octo/hello: 12 new commits, 7 more not shown. See https://github.com/octo/hello/commits");
	}

	@Test
	@DisplayName("Should render a history rewrite with the new tip")
	void shouldRenderRewrite() {
		String text = formatter.format(new Notification.HistoryRewrittenNotice(REPO, REPO_URL, "main", "fffffff",
				commit("Squash everything", 0, 0, 0)));

		assertThat(text).startsWith("octo/hello: history of main was rewritten, new tip is 0123456")
			.contains("Squash everything");
	}

	@Test
	@DisplayName("Should explain how to resume an unreachable repository")
	void shouldRenderUnreachable() {
		String text = formatter.format(new Notification.RepositoryUnreachableNotice(REPO, 3));

		assertThat(text).contains("3 times").contains("/add octo/hello");
	}

	@Test
	@DisplayName("Should tag admin alerts")
	void shouldRenderAdminAlert() {
		String text = formatter.format(
				new Notification.AdminAlert(FailureKind.AUTH, null, "Bad credentials", Instant.EPOCH));

		assertThat(text).isEqualTo("[admin] AUTH: Bad credentials");
	}

	@Nested
	@DisplayName("Console transport")
	class ConsoleTransportTest {

		@Test
		@DisplayName("Should print the recipient before the message")
		void shouldPrintRecipient() {
			ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			ConsoleTransport transport = new ConsoleTransport(new PrintStream(buffer, true, StandardCharsets.UTF_8),
					formatter);

			transport.send("42", new Notification.RepositoryUnreachableNotice(REPO, 3));

			assertThat(buffer.toString(StandardCharsets.UTF_8)).startsWith("-> 42" + System.lineSeparator())
				.contains("octo/hello could not be found");
		}

		@Test
		@DisplayName("Should fail when the output is broken")
		void shouldFailOnBrokenOutput() {
			OutputStream broken = new OutputStream() {
				@Override
				public void write(int b) throws IOException {
					throw new IOException("closed");
				}
			};
			ConsoleTransport transport = new ConsoleTransport(new PrintStream(broken), formatter);

			assertThatThrownBy(() -> transport.send("42", new Notification.RepositoryUnreachableNotice(REPO, 3)))
				.isInstanceOf(IllegalStateException.class);
		}

	}

}
