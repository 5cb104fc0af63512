package org.springaicommunity.github.commitwatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.commitwatch.TestCommits.*;

/**
 * Unit tests for {@link ChangeDetector}.
 */
@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

	private final ChangeDetector detector = new ChangeDetector();

	@Nested
	@DisplayName("Baseline")
	class BaselineTest {

		@Test
		@DisplayName("Should set the tip as cursor without notifying on first check")
		void shouldBaselineSilently() {
			Detection detection = detector.detect(null, CommitListing.of(newestFirst("c3", "c2", "c1")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.BASELINE);
			assertThat(detection.newCommits()).isEmpty();
			assertThat(detection.cursorCommit().id()).isEqualTo("c3");
		}

		@Test
		@DisplayName("Should baseline when the cursor exists but has no commit yet")
		void shouldBaselineCursorWithoutCommit() {
			Cursor withoutCommit = Cursor.initial(REPO);

			Detection detection = detector.detect(withoutCommit, CommitListing.of(List.of(commit("tip"))));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.BASELINE);
			assertThat(detection.cursorCommit().id()).isEqualTo("tip");
		}

		@Test
		@DisplayName("Should keep the cursor empty for an empty repository")
		void shouldKeepEmptyCursorForEmptyRepository() {
			Detection detection = detector.detect(null, CommitListing.empty());

			assertThat(detection.kind()).isEqualTo(Detection.Kind.NO_CHANGE);
			assertThat(detection.cursorCommit()).isNull();
		}

	}

	@Nested
	@DisplayName("New commits")
	class NewCommitsTest {

		@Test
		@DisplayName("Should report every new commit oldest first and advance to the newest")
		void shouldReportAllNewCommitsInOrder() {
			Detection detection = detector.detect(cursorAt("c0"), CommitListing.of(newestFirst("c3", "c2", "c1")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.NEW_COMMITS);
			assertThat(detection.newCommits()).extracting(CommitRef::id).containsExactly("c1", "c2", "c3");
			assertThat(detection.cursorCommit().id()).isEqualTo("c3");
		}

		@Test
		@DisplayName("Should report nothing for an empty listing")
		void shouldReportNothingForEmptyListing() {
			Detection detection = detector.detect(cursorAt("c0"), CommitListing.empty());

			assertThat(detection.kind()).isEqualTo(Detection.Kind.NO_CHANGE);
			assertThat(detection.newCommits()).isEmpty();
			assertThat(detection.cursorCommit()).isNull();
		}

		@Test
		@DisplayName("Should stop at the cursor when the listing includes it")
		void shouldNotRepeatCursorCommit() {
			Detection detection = detector.detect(cursorAt("c1"),
					CommitListing.of(newestFirst("c3", "c2", "c1", "c0")));

			assertThat(detection.newCommits()).extracting(CommitRef::id).containsExactly("c2", "c3");
		}

		@Test
		@DisplayName("Should report nothing when the listing starts with the cursor")
		void shouldReportNothingWhenListingStartsAtCursor() {
			Detection detection = detector.detect(cursorAt("c3"), CommitListing.of(newestFirst("c3", "c2")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.NO_CHANGE);
		}

	}

	@Nested
	@DisplayName("Rewritten history")
	class RewrittenHistoryTest {

		@Test
		@DisplayName("Should move the cursor to the new tip without listing commits")
		void shouldRebaselineOnRewrite() {
			Detection detection = detector.detect(cursorAt("old"), CommitListing.rewritten(commit("new")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.HISTORY_REWRITTEN);
			assertThat(detection.newCommits()).isEmpty();
			assertThat(detection.cursorCommit().id()).isEqualTo("new");
		}

		@Test
		@DisplayName("Should ignore a rewrite flag pointing at the stored cursor")
		void shouldIgnoreRewriteToSameCommit() {
			Detection detection = detector.detect(cursorAt("same"), CommitListing.rewritten(commit("same")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.NO_CHANGE);
		}

		@Test
		@DisplayName("Should baseline instead of reporting a rewrite when there is no cursor")
		void shouldBaselineRewriteWithoutCursor() {
			Detection detection = detector.detect(null, CommitListing.rewritten(commit("tip")));

			assertThat(detection.kind()).isEqualTo(Detection.Kind.BASELINE);
		}

		@Test
		@DisplayName("Should not accept a rewritten listing without a tip")
		void shouldRejectRewriteWithoutTip() {
			assertThatThrownBy(() -> new CommitListing(List.of(), true)).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("new tip");
		}

	}

}
