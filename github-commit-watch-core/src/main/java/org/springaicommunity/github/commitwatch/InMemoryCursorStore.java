package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-durable {@link CursorStore} backed by a {@link ConcurrentHashMap}. Used in tests and
 * for throwaway runs; state is lost on restart.
 */
public class InMemoryCursorStore implements CursorStore {

	private final ConcurrentMap<RepositoryId, Cursor> cursors = new ConcurrentHashMap<>();

	@Override
	public Optional<Cursor> get(RepositoryId repositoryId) {
		return Optional.ofNullable(cursors.get(repositoryId));
	}

	@Override
	public boolean compareAndSet(RepositoryId repositoryId, @Nullable Cursor expected, Cursor next) {
		requireSameRepository(repositoryId, next);
		if (expected == null) {
			return cursors.putIfAbsent(repositoryId, next) == null;
		}
		return cursors.replace(repositoryId, expected, next);
	}

	@Override
	public Collection<Cursor> all() {
		return List.copyOf(cursors.values());
	}

	static void requireSameRepository(RepositoryId repositoryId, Cursor next) {
		if (!repositoryId.equals(next.repositoryId())) {
			throw new IllegalArgumentException(
					"Cursor for " + next.repositoryId() + " cannot be stored under " + repositoryId);
		}
	}

}
