package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Inbound command facade used by chat transports: {@code add}, {@code remove},
 * {@code list}, {@code check}, {@code stats} and {@code status}.
 *
 * <p>
 * When an admin list is configured every command first checks that the subscriber is on
 * it and throws {@link UnauthorizedSubscriberException} otherwise. Malformed repository
 * names raise {@link IllegalArgumentException}.
 */
public class CommitWatchService {

	private static final Logger logger = LoggerFactory.getLogger(CommitWatchService.class);

	private final WatchProperties properties;

	private final SubscriptionIndex subscriptions;

	private final CursorStore cursorStore;

	private final RepositoryClient repositoryClient;

	private final CommitWatchScheduler scheduler;

	private final WatchStatistics statistics;

	private final ConnectionService connectionService;

	public CommitWatchService(WatchProperties properties, SubscriptionIndex subscriptions, CursorStore cursorStore,
			RepositoryClient repositoryClient, CommitWatchScheduler scheduler, WatchStatistics statistics,
			ConnectionService connectionService) {
		this.properties = properties;
		this.subscriptions = subscriptions;
		this.cursorStore = cursorStore;
		this.repositoryClient = repositoryClient;
		this.scheduler = scheduler;
		this.statistics = statistics;
		this.connectionService = connectionService;
	}

	/**
	 * Start watching a repository for a subscriber.
	 *
	 * <p>
	 * The repository is looked up first; an unknown repository is rejected without
	 * subscribing. A repository seen for the first time gets a silent baseline, a
	 * previously watched one resumes from its stored cursor, and an unreachable one is
	 * made active again.
	 * @param subscriberId the subscriber
	 * @param repository repository name in {@code owner/name} form
	 * @return the outcome
	 */
	public AddResult add(String subscriberId, String repository) {
		authorize(subscriberId);
		RepositoryId repositoryId = RepositoryId.parse(repository);

		RepositoryInfo info;
		try {
			info = repositoryClient.resolveDefaultBranch(repositoryId);
		}
		catch (RepositoryAccessException e) {
			AddResult.Status status = e.getKind() == FailureKind.NOT_FOUND ? AddResult.Status.NOT_FOUND
					: AddResult.Status.FAILED;
			logger.info("Rejected {} for {}: {}", repositoryId, subscriberId, e.getMessage());
			return AddResult.rejected(status, repositoryId, String.valueOf(e.getMessage()));
		}

		try {
			boolean created = subscriptions.subscribe(subscriberId, repositoryId);
			boolean reactivated = activate(repositoryId, info);
			logger.info("{} {} {}", subscriberId, created ? "subscribed to" : "already follows", repositoryId);
			AddResult.Status status = created ? AddResult.Status.ADDED : AddResult.Status.ALREADY_SUBSCRIBED;
			return new AddResult(status, repositoryId, info.defaultBranch(), reactivated, null);
		}
		catch (StorageException e) {
			logger.error("Could not store subscription of {} to {}", subscriberId, repositoryId, e);
			return AddResult.rejected(AddResult.Status.FAILED, repositoryId, String.valueOf(e.getMessage()));
		}
	}

	/**
	 * Store the resolved repository info, clear the unreachable state, and baseline a
	 * repository that has no cursor commit yet.
	 * @return true if the repository was unreachable
	 */
	private boolean activate(RepositoryId repositoryId, RepositoryInfo info) {
		Cursor stored = cursorStore.get(repositoryId).orElse(null);
		Cursor base = stored != null ? stored : Cursor.initial(repositoryId);
		boolean reactivated = base.state() == ReachabilityState.UNREACHABLE;
		Cursor next = base.withRepositoryInfo(info).withState(ReachabilityState.ACTIVE);
		if (!next.equals(stored) && !cursorStore.compareAndSet(repositoryId, stored, next)) {
			logger.debug("Cursor of {} changed concurrently, keeping the other writer's value", repositoryId);
		}
		if (!next.hasBaseline()) {
			CheckResult baseline = scheduler.checkNow(repositoryId);
			logger.debug("Baseline of {}: {}", repositoryId, baseline);
		}
		if (reactivated) {
			logger.info("{} reactivated", repositoryId);
		}
		return reactivated;
	}

	/**
	 * Stop watching a repository. The cursor is kept so a later {@code add} resumes from
	 * it.
	 * @return true if the subscription existed
	 */
	public boolean remove(String subscriberId, String repository) {
		authorize(subscriberId);
		RepositoryId repositoryId = RepositoryId.parse(repository);
		boolean removed = subscriptions.unsubscribe(subscriberId, repositoryId);
		if (removed) {
			logger.info("{} unsubscribed from {}", subscriberId, repositoryId);
		}
		return removed;
	}

	public List<RepositoryStatus> list(String subscriberId) {
		authorize(subscriberId);
		List<RepositoryStatus> rows = new ArrayList<>();
		for (RepositoryId repositoryId : subscriptions.repositoriesOf(subscriberId)) {
			Cursor cursor = cursorStore.get(repositoryId).orElseGet(() -> Cursor.initial(repositoryId));
			rows.add(RepositoryStatus.of(cursor, scheduler.stateOf(repositoryId)));
		}
		rows.sort(Comparator.comparing(row -> row.repositoryId().fullName()));
		return rows;
	}

	/**
	 * Check every repository of the subscriber now, one after another on the calling
	 * thread.
	 * @return one result per repository, in name order
	 */
	public List<CheckResult> check(String subscriberId) {
		authorize(subscriberId);
		List<RepositoryId> repositories = new ArrayList<>(subscriptions.repositoriesOf(subscriberId));
		repositories.sort(Comparator.comparing(RepositoryId::fullName));
		logger.info("Manual check of {} repositories for {}", repositories.size(), subscriberId);
		List<CheckResult> results = new ArrayList<>();
		for (RepositoryId repositoryId : repositories) {
			results.add(scheduler.checkNow(repositoryId));
		}
		return results;
	}

	public WatchStats stats(String subscriberId) {
		authorize(subscriberId);
		return new WatchStats(subscriptions.allActiveRepositories().size(),
				subscriptions.repositoriesOf(subscriberId).size(), statistics.snapshot(), scheduler.getInterval());
	}

	public ConnectionStatus status(String subscriberId) {
		authorize(subscriberId);
		return connectionService.check();
	}

	public boolean isAuthorized(@Nullable String subscriberId) {
		return subscriberId != null && properties.isAuthorized(subscriberId);
	}

	private void authorize(String subscriberId) {
		if (!isAuthorized(subscriberId)) {
			logger.warn("Rejected command from unauthorized subscriber {}", subscriberId);
			throw new UnauthorizedSubscriberException(subscriberId);
		}
	}

}
