package org.springaicommunity.github.commitwatch;

import java.util.Set;

/**
 * Durable many-to-many index between subscribers and repositories.
 *
 * <p>
 * Both directions are queryable. Subscribing twice and unsubscribing a missing edge are
 * no-ops rather than errors.
 */
public interface SubscriptionIndex {

	/**
	 * Add the edge (subscriber, repository).
	 * @param subscriberId the subscriber
	 * @param repositoryId the repository
	 * @return true if a new edge was created
	 * @throws StorageException if the edge cannot be persisted
	 */
	boolean subscribe(String subscriberId, RepositoryId repositoryId);

	/**
	 * Remove the edge (subscriber, repository).
	 * @param subscriberId the subscriber
	 * @param repositoryId the repository
	 * @return true if an edge was removed
	 * @throws StorageException if the removal cannot be persisted
	 */
	boolean unsubscribe(String subscriberId, RepositoryId repositoryId);

	Set<String> subscribersOf(RepositoryId repositoryId);

	Set<RepositoryId> repositoriesOf(String subscriberId);

	/**
	 * Returns every repository with at least one subscriber. This is the set of
	 * repositories the scheduler visits on each tick.
	 * @return snapshot of subscribed repositories
	 */
	Set<RepositoryId> allActiveRepositories();

}
