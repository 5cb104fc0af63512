package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a stored cursor and a fresh {@link CommitListing} into the commits to notify and
 * the next cursor value. Stateless and free of I/O.
 *
 * <ul>
 * <li>No baseline yet: the tip becomes the cursor and nothing is notified.</li>
 * <li>Rewritten history: the tip becomes the cursor and a single rewrite notice is
 * due.</li>
 * <li>Otherwise every listed commit newer than the cursor is new; they are returned
 * oldest first and the newest becomes the cursor.</li>
 * </ul>
 */
public class ChangeDetector {

	public Detection detect(@Nullable Cursor stored, CommitListing listing) {
		if (stored == null || !stored.hasBaseline()) {
			if (listing.isEmpty()) {
				return Detection.noChange();
			}
			return new Detection(Detection.Kind.BASELINE, List.of(), listing.commits().get(0));
		}

		if (listing.historyRewritten()) {
			CommitRef tip = listing.commits().get(0);
			if (tip.id().equals(stored.lastCommitId())) {
				return Detection.noChange();
			}
			return new Detection(Detection.Kind.HISTORY_REWRITTEN, List.of(), tip);
		}

		// The listing should already exclude the cursor and its ancestors; stop at the
		// cursor anyway so a sloppy listing cannot produce duplicates.
		List<CommitRef> newestFirst = new ArrayList<>();
		for (CommitRef commit : listing.commits()) {
			if (commit.id().equals(stored.lastCommitId())) {
				break;
			}
			newestFirst.add(commit);
		}
		if (newestFirst.isEmpty()) {
			return Detection.noChange();
		}

		CommitRef newest = newestFirst.get(0);
		Collections.reverse(newestFirst);
		return new Detection(Detection.Kind.NEW_COMMITS, newestFirst, newest);
	}

}
