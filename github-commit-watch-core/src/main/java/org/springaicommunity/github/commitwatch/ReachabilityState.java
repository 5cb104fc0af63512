package org.springaicommunity.github.commitwatch;

/**
 * Whether scheduled checks are performed for a repository.
 */
public enum ReachabilityState {

	/**
	 * Checked on every scheduler tick.
	 */
	ACTIVE,

	/**
	 * Repeatedly not found upstream. Skipped by the scheduler until a subscriber re-adds
	 * the repository or triggers a manual check.
	 */
	UNREACHABLE

}
