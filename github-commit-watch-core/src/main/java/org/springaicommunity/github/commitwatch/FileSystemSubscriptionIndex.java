package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * File system implementation of {@link SubscriptionIndex}.
 *
 * <p>
 * Edges are persisted as a list of unique {@code (subscriber_id, repository_id)} pairs in
 * {@code subscriptions.json}. The file is rewritten before the in-memory index changes.
 */
public class FileSystemSubscriptionIndex implements SubscriptionIndex {

	static final String FILE_NAME = "subscriptions.json";

	private static final Comparator<Subscription> ORDER = Comparator
		.comparing((Subscription s) -> s.repositoryId().fullName())
		.thenComparing(Subscription::subscriberId);

	private final JsonStateFile<Subscription> stateFile;

	private final InMemorySubscriptionIndex index = new InMemorySubscriptionIndex();

	/**
	 * Open the index, loading existing subscriptions.
	 * @param stateDirectory directory containing {@code subscriptions.json}
	 * @param objectMapper mapper used for (de)serialization
	 * @throws StorageException if an existing file cannot be read
	 */
	public FileSystemSubscriptionIndex(Path stateDirectory, ObjectMapper objectMapper) {
		this.stateFile = new JsonStateFile<>(stateDirectory.resolve(FILE_NAME), objectMapper,
				new TypeReference<List<Subscription>>() {
				});
		for (Subscription subscription : stateFile.read()) {
			index.subscribe(subscription.subscriberId(), subscription.repositoryId());
		}
	}

	@Override
	public synchronized boolean subscribe(String subscriberId, RepositoryId repositoryId) {
		if (index.contains(subscriberId, repositoryId)) {
			return false;
		}
		List<Subscription> edges = index.edges();
		edges.add(new Subscription(subscriberId, repositoryId));
		persist(edges);
		return index.subscribe(subscriberId, repositoryId);
	}

	@Override
	public synchronized boolean unsubscribe(String subscriberId, RepositoryId repositoryId) {
		if (!index.contains(subscriberId, repositoryId)) {
			return false;
		}
		List<Subscription> edges = index.edges();
		edges.remove(new Subscription(subscriberId, repositoryId));
		persist(edges);
		return index.unsubscribe(subscriberId, repositoryId);
	}

	@Override
	public Set<String> subscribersOf(RepositoryId repositoryId) {
		return index.subscribersOf(repositoryId);
	}

	@Override
	public Set<RepositoryId> repositoriesOf(String subscriberId) {
		return index.repositoriesOf(subscriberId);
	}

	@Override
	public Set<RepositoryId> allActiveRepositories() {
		return index.allActiveRepositories();
	}

	private void persist(List<Subscription> edges) {
		edges.sort(ORDER);
		stateFile.write(edges);
	}

}
