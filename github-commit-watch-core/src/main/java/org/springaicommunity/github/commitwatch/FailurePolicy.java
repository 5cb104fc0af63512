package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Classifies failed cycles and decides on backoff, suspension and escalation.
 *
 * <ul>
 * <li>{@code NOT_FOUND}: counted; the repository becomes unreachable once the run of
 * uninterrupted NOT_FOUND results reaches the configured threshold.</li>
 * <li>{@code TRANSIENT}: counted; exponential backoff from the initial delay, capped.
 * Admins are alerted once when the failure run reaches its threshold.</li>
 * <li>{@code RATE_LIMITED}: suspension until the reset time, for the whole account when
 * the limit is account-wide. Not counted as a repository failure.</li>
 * <li>{@code STORAGE}: retried next tick; admins are alerted once the threshold of
 * consecutive storage failures is reached.</li>
 * <li>{@code AUTH}: fatal, admins are alerted once.</li>
 * </ul>
 *
 * <p>
 * Persistent counters live on the {@link Cursor}; storage failure counts are in memory
 * because the store is what failed.
 */
public class FailurePolicy {

	private static final Logger logger = LoggerFactory.getLogger(FailurePolicy.class);

	private static final int MAX_BACKOFF_EXPONENT = 20;

	private final int notFoundThreshold;

	private final Duration initialBackoff;

	private final Duration maxBackoff;

	private final Duration defaultRateLimitWait;

	private final int storageAlertThreshold;

	private final int transientAlertThreshold;

	private final Clock clock;

	private final ConcurrentMap<RepositoryId, Integer> storageFailures = new ConcurrentHashMap<>();

	private final AtomicBoolean authAlerted = new AtomicBoolean();

	public FailurePolicy(WatchProperties properties) {
		this(properties, Clock.systemUTC());
	}

	public FailurePolicy(WatchProperties properties, Clock clock) {
		this.notFoundThreshold = properties.getNotFoundThreshold();
		this.initialBackoff = properties.getInitialBackoff();
		this.maxBackoff = properties.getMaxBackoff();
		this.defaultRateLimitWait = properties.getCheckInterval();
		this.storageAlertThreshold = properties.getStorageAlertThreshold();
		this.transientAlertThreshold = properties.getTransientAlertThreshold();
		this.clock = clock;
	}

	/**
	 * Decide how to react to a failed cycle.
	 * @param repositoryId the repository
	 * @param stored the cursor read at the start of the cycle, null if none existed
	 * @param kind the failure classification
	 * @param retryAfter wait announced by the upstream API, if any
	 * @param accountWide whether a rate limit applies to every repository
	 * @return the decision
	 */
	public FailureDecision onFailure(RepositoryId repositoryId, @Nullable Cursor stored, FailureKind kind,
			@Nullable Duration retryAfter, boolean accountWide) {
		Cursor base = stored != null ? stored : Cursor.initial(repositoryId);
		Instant now = clock.instant();

		return switch (kind) {
			case NOT_FOUND -> notFound(repositoryId, base);
			case TRANSIENT -> backOff(repositoryId, base, now);
			case RATE_LIMITED -> {
				Duration wait = retryAfter != null ? retryAfter : defaultRateLimitWait;
				yield new FailureDecision(null, now.plus(wait), accountWide, false, false, false);
			}
			case STORAGE -> {
				int count = storageFailures.merge(repositoryId, 1, Integer::sum);
				yield new FailureDecision(null, null, false, false, count == storageAlertThreshold, false);
			}
			case AUTH -> new FailureDecision(null, null, false, false, authAlerted.compareAndSet(false, true), true);
		};
	}

	private FailureDecision notFound(RepositoryId repositoryId, Cursor base) {
		int notFound = base.consecutiveNotFound() + 1;
		ReachabilityState state = notFound >= notFoundThreshold ? ReachabilityState.UNREACHABLE : base.state();
		boolean transition = base.state() == ReachabilityState.ACTIVE && state == ReachabilityState.UNREACHABLE;
		if (transition) {
			logger.warn("{} not found {} times in a row, marking unreachable", repositoryId, notFound);
		}
		return new FailureDecision(base.withNotFound(state), null, false, transition, false, false);
	}

	private FailureDecision backOff(RepositoryId repositoryId, Cursor base, Instant now) {
		Cursor updated = base.withFailure(base.state());
		Duration backoff = backoffFor(updated.consecutiveFailures());
		logger.info("Backing off {} for {} after {} consecutive failure(s)", repositoryId, backoff,
				updated.consecutiveFailures());
		boolean alert = updated.consecutiveFailures() == transientAlertThreshold;
		return new FailureDecision(updated, now.plus(backoff), false, false, alert, false);
	}

	/**
	 * Clear the in-memory failure state of a repository after a successful cycle.
	 * @param repositoryId the repository
	 */
	public void onSuccess(RepositoryId repositoryId) {
		storageFailures.remove(repositoryId);
	}

	/**
	 * Backoff after the given number of consecutive transient failures:
	 * {@code initialBackoff * 2^(failures-1)}, capped at the maximum.
	 * @param consecutiveFailures failures so far, at least 1
	 * @return the wait before the next attempt
	 */
	Duration backoffFor(int consecutiveFailures) {
		int exponent = Math.min(Math.max(consecutiveFailures - 1, 0), MAX_BACKOFF_EXPONENT);
		Duration backoff = initialBackoff.multipliedBy(1L << exponent);
		return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
	}

}
