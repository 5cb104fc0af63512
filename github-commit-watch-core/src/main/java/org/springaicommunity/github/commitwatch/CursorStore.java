package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Optional;

/**
 * Durable mapping from repository to its {@link Cursor}.
 *
 * <p>
 * {@link #compareAndSet} is the only write path, so concurrent manual and scheduled checks
 * of the same repository can never regress a cursor: a writer holding a stale value
 * simply loses.
 */
public interface CursorStore {

	/**
	 * Get the stored cursor of a repository.
	 * @param repositoryId the repository
	 * @return the cursor, or empty if the repository was never tracked
	 * @throws StorageException if the store cannot be read
	 */
	Optional<Cursor> get(RepositoryId repositoryId);

	/**
	 * Replace the stored cursor only if it still equals {@code expected}.
	 * @param repositoryId the repository
	 * @param expected the value the caller read, or null if it read nothing
	 * @param next the new value
	 * @return true if the value was replaced, false if another writer got there first
	 * @throws StorageException if the new value cannot be persisted; the stored value is
	 * then unchanged
	 */
	boolean compareAndSet(RepositoryId repositoryId, @Nullable Cursor expected, Cursor next);

	/**
	 * Returns all stored cursors, including dormant repositories.
	 * @return snapshot of all cursors
	 */
	Collection<Cursor> all();

}
