package org.springaicommunity.github.commitwatch;

import java.util.List;

/**
 * Commits fetched for one check cycle.
 *
 * @param commits commits newest first; only the tip for a baseline or rewritten history
 * @param historyRewritten true if the stored cursor is no longer an ancestor of the
 * branch tip
 */
public record CommitListing(List<CommitRef> commits, boolean historyRewritten) {

	public CommitListing {
		commits = List.copyOf(commits);
		if (historyRewritten && commits.isEmpty()) {
			throw new IllegalArgumentException("A rewritten history listing must carry the new tip");
		}
	}

	public static CommitListing of(List<CommitRef> commits) {
		return new CommitListing(commits, false);
	}

	public static CommitListing empty() {
		return new CommitListing(List.of(), false);
	}

	public static CommitListing rewritten(CommitRef tip) {
		return new CommitListing(List.of(tip), true);
	}

	public boolean isEmpty() {
		return commits.isEmpty();
	}

}
