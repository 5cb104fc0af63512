package org.springaicommunity.github.commitwatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link SubscriptionIndex} keeping both directions of the index in
 * concurrent maps. Mutations are serialized so both directions stay consistent; reads are
 * lock-free snapshots.
 */
public class InMemorySubscriptionIndex implements SubscriptionIndex {

	private final Map<RepositoryId, Set<String>> subscribersByRepository = new ConcurrentHashMap<>();

	private final Map<String, Set<RepositoryId>> repositoriesBySubscriber = new ConcurrentHashMap<>();

	@Override
	public synchronized boolean subscribe(String subscriberId, RepositoryId repositoryId) {
		boolean created = subscribersByRepository.computeIfAbsent(repositoryId, k -> ConcurrentHashMap.newKeySet())
			.add(subscriberId);
		repositoriesBySubscriber.computeIfAbsent(subscriberId, k -> ConcurrentHashMap.newKeySet()).add(repositoryId);
		return created;
	}

	@Override
	public synchronized boolean unsubscribe(String subscriberId, RepositoryId repositoryId) {
		boolean removed = removeEdge(subscribersByRepository, repositoryId, subscriberId);
		removeEdge(repositoriesBySubscriber, subscriberId, repositoryId);
		return removed;
	}

	@Override
	public Set<String> subscribersOf(RepositoryId repositoryId) {
		return Set.copyOf(subscribersByRepository.getOrDefault(repositoryId, Set.of()));
	}

	@Override
	public Set<RepositoryId> repositoriesOf(String subscriberId) {
		return Set.copyOf(repositoriesBySubscriber.getOrDefault(subscriberId, Set.of()));
	}

	@Override
	public Set<RepositoryId> allActiveRepositories() {
		return Set.copyOf(subscribersByRepository.keySet());
	}

	/**
	 * Check whether an edge exists without modifying the index.
	 * @param subscriberId the subscriber
	 * @param repositoryId the repository
	 * @return true if the subscriber is subscribed to the repository
	 */
	boolean contains(String subscriberId, RepositoryId repositoryId) {
		return subscribersByRepository.getOrDefault(repositoryId, Set.of()).contains(subscriberId);
	}

	/**
	 * Returns all edges, for persistence.
	 * @return snapshot of all subscriptions
	 */
	synchronized List<Subscription> edges() {
		List<Subscription> edges = new ArrayList<>();
		subscribersByRepository.forEach((repository, subscribers) -> subscribers
			.forEach(subscriber -> edges.add(new Subscription(subscriber, repository))));
		return edges;
	}

	private static <K, V> boolean removeEdge(Map<K, Set<V>> index, K key, V value) {
		Set<V> values = index.get(key);
		if (values == null || !values.remove(value)) {
			return false;
		}
		if (values.isEmpty()) {
			index.remove(key);
		}
		return true;
	}

}
