package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one check cycle for a repository: resolve the branch if unknown, fetch, detect,
 * persist, dispatch.
 *
 * <p>
 * The cursor is written with {@link CursorStore#compareAndSet} before anything is
 * dispatched, so a crash between the two can lose a notification but never repeat one.
 * When the write loses against a concurrent writer the cycle is reported as skipped and
 * nothing is sent. Callers are responsible for serializing cycles of the same repository.
 */
public class RepositoryChecker {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryChecker.class);

	private final CursorStore cursorStore;

	private final RepositoryClient repositoryClient;

	private final ChangeDetector changeDetector;

	private final NotificationDispatcher dispatcher;

	private final FailurePolicy failurePolicy;

	private final WatchStatistics statistics;

	private final Clock clock;

	public RepositoryChecker(CursorStore cursorStore, RepositoryClient repositoryClient, ChangeDetector changeDetector,
			NotificationDispatcher dispatcher, FailurePolicy failurePolicy, WatchStatistics statistics, Clock clock) {
		this.cursorStore = cursorStore;
		this.repositoryClient = repositoryClient;
		this.changeDetector = changeDetector;
		this.dispatcher = dispatcher;
		this.failurePolicy = failurePolicy;
		this.statistics = statistics;
		this.clock = clock;
	}

	public CheckResult check(RepositoryId repositoryId) {
		statistics.recordCheck();

		Cursor stored;
		try {
			stored = cursorStore.get(repositoryId).orElse(null);
		}
		catch (StorageException e) {
			return fail(repositoryId, null, FailureKind.STORAGE, e.getMessage(), null, false);
		}

		try {
			return run(repositoryId, stored);
		}
		catch (RepositoryAccessException e) {
			return fail(repositoryId, stored, e.getKind(), e.getMessage(), e.getRetryAfter(), e.isAccountWide());
		}
		catch (StorageException e) {
			return fail(repositoryId, stored, FailureKind.STORAGE, e.getMessage(), null, false);
		}
	}

	private CheckResult run(RepositoryId repositoryId, @Nullable Cursor stored) {
		Cursor working = stored != null ? stored : Cursor.initial(repositoryId);
		if (working.defaultBranch() == null) {
			working = working.withRepositoryInfo(repositoryClient.resolveDefaultBranch(repositoryId));
		}

		CommitListing listing;
		try {
			listing = repositoryClient.listCommitsSince(repositoryId, working.defaultBranch(), working.lastCommitId());
		}
		catch (RepositoryAccessException e) {
			Cursor refreshed = refreshBranch(repositoryId, working, e);
			listing = repositoryClient.listCommitsSince(repositoryId, refreshed.defaultBranch(),
					refreshed.lastCommitId());
			working = refreshed;
		}

		Detection detection = changeDetector.detect(working, listing);
		Cursor next = detection.cursorCommit() != null ? working.withCommit(detection.cursorCommit()) : working;
		next = next.withSuccess(clock.instant());

		if (!cursorStore.compareAndSet(repositoryId, stored, next)) {
			logger.info("Cursor of {} changed during the cycle, leaving it to the other writer", repositoryId);
			return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.CONCURRENT_UPDATE);
		}
		failurePolicy.onSuccess(repositoryId);

		return switch (detection.kind()) {
			case NO_CHANGE -> new CheckResult.NoChange(repositoryId, false);
			case BASELINE -> {
				logger.info("Baseline for {} set to {}", repositoryId, next.lastCommitId());
				yield new CheckResult.NoChange(repositoryId, true);
			}
			case NEW_COMMITS -> {
				statistics.recordCommits(detection.newCommits().size());
				dispatcher.dispatchCommits(next, detection.newCommits());
				yield new CheckResult.NewCommits(repositoryId, detection.newCommits(), next.lastCommitId());
			}
			case HISTORY_REWRITTEN -> {
				String previous = stored != null ? stored.lastCommitId() : null;
				logger.warn("History of {} rewritten, cursor moved from {} to {}", repositoryId, previous,
						next.lastCommitId());
				dispatcher.dispatchHistoryRewritten(next, detection.cursorCommit(), previous);
				yield new CheckResult.HistoryRewritten(repositoryId, previous, detection.cursorCommit());
			}
		};
	}

	/**
	 * A cached branch can disappear when the default branch is renamed. On NOT_FOUND the
	 * branch is resolved again; the original failure is rethrown when it did not change.
	 */
	private Cursor refreshBranch(RepositoryId repositoryId, Cursor working, RepositoryAccessException failure) {
		if (failure.getKind() != FailureKind.NOT_FOUND) {
			throw failure;
		}
		RepositoryInfo info = repositoryClient.resolveDefaultBranch(repositoryId);
		if (info.defaultBranch().equals(working.defaultBranch())) {
			throw failure;
		}
		logger.info("Default branch of {} changed from {} to {}", repositoryId, working.defaultBranch(),
				info.defaultBranch());
		return working.withRepositoryInfo(info);
	}

	private CheckResult fail(RepositoryId repositoryId, @Nullable Cursor stored, FailureKind kind,
			@Nullable String detail, @Nullable Duration retryAfter, boolean accountWide) {
		statistics.recordFailure();
		String reason = detail != null ? detail : kind.name();
		logger.warn("Check of {} failed [{}]: {}", repositoryId, kind, reason);

		FailureDecision decision = failurePolicy.onFailure(repositoryId, stored, kind, retryAfter, accountWide);
		Cursor updated = decision.updatedCursor();
		boolean persisted = false;
		if (updated != null) {
			try {
				persisted = cursorStore.compareAndSet(repositoryId, stored, updated);
			}
			catch (StorageException e) {
				logger.warn("Could not record failure of {}: {}", repositoryId, e.getMessage());
			}
		}

		// Only the writer that persisted the transition announces it
		if (decision.becameUnreachable() && persisted) {
			dispatcher.dispatchUnreachable(repositoryId, updated.consecutiveNotFound());
		}
		// Alerts tied to a recorded failure count follow the same rule
		if (decision.alertAdmins() && (updated == null || persisted)) {
			dispatcher.alertAdmins(new Notification.AdminAlert(kind, repositoryId,
					alertMessage(repositoryId, kind, reason), clock.instant()));
		}
		return new CheckResult.Failure(repositoryId, kind, reason, decision.retryAt(), decision.accountWide());
	}

	private static String alertMessage(RepositoryId repositoryId, FailureKind kind, String reason) {
		if (kind == FailureKind.AUTH) {
			return "GitHub rejected the configured credentials, polling stopped: " + reason;
		}
		return "Repeated " + kind.name().toLowerCase() + " failures for " + repositoryId + ": " + reason;
	}

}
