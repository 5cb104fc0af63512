package org.springaicommunity.github.commitwatch;

import java.time.Instant;

/**
 * A commit on a watched branch as reported by the {@link RepositoryClient}.
 *
 * <p>
 * Apart from {@link #id()}, the fields are payload for notifications only; change
 * detection never looks at them.
 *
 * @param id the full commit SHA
 * @param authorName the commit author's display name
 * @param authorEmail the commit author's email (empty if unknown)
 * @param timestamp the author timestamp
 * @param message the full commit message
 * @param added number of files added
 * @param removed number of files removed
 * @param modified number of files modified
 * @param url the browsable commit URL
 */
public record CommitRef(String id, String authorName, String authorEmail, Instant timestamp, String message, int added,
		int removed, int modified, String url) {

	static final int SHORT_ID_LENGTH = 7;

	/**
	 * Returns the abbreviated commit id used for display.
	 * @return the first seven characters of the id
	 */
	public String shortId() {
		return id.length() <= SHORT_ID_LENGTH ? id : id.substring(0, SHORT_ID_LENGTH);
	}

	/**
	 * Returns the first line of the commit message.
	 * @return the message summary
	 */
	public String summary() {
		int newline = message.indexOf('\n');
		return (newline >= 0 ? message.substring(0, newline) : message).strip();
	}

	/**
	 * Returns a copy of this commit with the given file change counts.
	 * @param added files added
	 * @param removed files removed
	 * @param modified files modified
	 * @return the updated commit
	 */
	public CommitRef withFileCounts(int added, int removed, int modified) {
		return new CommitRef(id, authorName, authorEmail, timestamp, message, added, removed, modified, url);
	}

}
