package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of {@link ChangeDetector#detect}.
 *
 * @param kind what the detector concluded
 * @param newCommits commits to notify, oldest first (empty unless {@code NEW_COMMITS})
 * @param cursorCommit commit the cursor should advance to, or null to leave it unchanged
 */
public record Detection(Kind kind, List<CommitRef> newCommits, @Nullable CommitRef cursorCommit) {

	public Detection {
		newCommits = List.copyOf(newCommits);
	}

	static Detection noChange() {
		return new Detection(Kind.NO_CHANGE, List.of(), null);
	}

	public enum Kind {

		NO_CHANGE, BASELINE, NEW_COMMITS, HISTORY_REWRITTEN

	}

}
