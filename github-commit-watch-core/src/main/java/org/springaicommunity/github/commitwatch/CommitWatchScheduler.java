package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives check cycles for every subscribed repository.
 *
 * <p>
 * A single timer thread calls {@link #tick()} once per interval. The tick never runs a
 * cycle itself: it submits one per eligible repository to a fixed worker pool and
 * returns. A repository is eligible when it is not being checked, not backing off, not
 * unreachable and the account is not suspended by a rate limit.
 *
 * <p>
 * Each repository owns a slot holding a {@link ReentrantLock} taken with
 * {@code tryLock}, so two cycles of the same repository never overlap, and its backoff
 * deadline. Slots are created on first use and kept for the lifetime of the scheduler.
 * There is no lock across repositories.
 *
 * <p>
 * An {@link FailureKind#AUTH} failure halts the scheduler: no further cycles start and
 * {@link #awaitHalt} returns.
 */
public class CommitWatchScheduler implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CommitWatchScheduler.class);

	private final SubscriptionIndex subscriptions;

	private final CursorStore cursorStore;

	private final RepositoryChecker checker;

	private final Duration interval;

	private final Duration gracePeriod;

	private final Clock clock;

	private final ScheduledExecutorService timer;

	private final ExecutorService workers;

	private final ConcurrentMap<RepositoryId, Slot> slots = new ConcurrentHashMap<>();

	private final AtomicBoolean started = new AtomicBoolean();

	private final AtomicBoolean stopped = new AtomicBoolean();

	private final CountDownLatch halted = new CountDownLatch(1);

	@Nullable
	private volatile Instant suspendedUntil;

	@Nullable
	private volatile String haltReason;

	public CommitWatchScheduler(SubscriptionIndex subscriptions, CursorStore cursorStore, RepositoryChecker checker,
			WatchProperties properties, Clock clock) {
		this.subscriptions = subscriptions;
		this.cursorStore = cursorStore;
		this.checker = checker;
		this.interval = properties.getCheckInterval();
		this.gracePeriod = properties.getShutdownGracePeriod();
		this.clock = clock;
		this.timer = Executors.newSingleThreadScheduledExecutor(new WorkerFactory("commit-watch-timer"));
		this.workers = Executors.newFixedThreadPool(properties.getMaxConcurrentChecks(),
				new WorkerFactory("commit-watch-check"));
	}

	/**
	 * Start periodic ticks. The first tick runs immediately.
	 * @throws IllegalStateException if the scheduler was already started or stopped
	 */
	public void start() {
		if (stopped.get() || !started.compareAndSet(false, true)) {
			throw new IllegalStateException("Scheduler already started or stopped");
		}
		logger.info("Checking subscribed repositories every {}s", interval.toSeconds());
		timer.scheduleWithFixedDelay(this::tickSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
	}

	private void tickSafely() {
		try {
			tick();
		}
		catch (RuntimeException e) {
			// an exception would cancel the periodic task
			logger.error("Tick failed: {}", e.getMessage(), e);
		}
	}

	/**
	 * Submit a cycle for every eligible repository without waiting for any of them.
	 * @return one future per submitted cycle
	 */
	public List<CompletableFuture<CheckResult>> tick() {
		if (isStopped()) {
			return List.of();
		}
		Instant now = clock.instant();
		Instant suspension = suspendedUntil;
		if (suspension != null && now.isBefore(suspension)) {
			logger.info("Rate limit suspension active until {}, skipping tick", suspension);
			return List.of();
		}

		Set<RepositoryId> repositories = subscriptions.allActiveRepositories();
		List<CompletableFuture<CheckResult>> submitted = new ArrayList<>();
		for (RepositoryId repositoryId : repositories) {
			Slot slot = slotFor(repositoryId);
			if (slot.lock.isLocked() || slot.isBackingOff(now) || isUnreachable(repositoryId)) {
				continue;
			}
			if (!slot.queued.compareAndSet(false, true)) {
				continue;
			}
			try {
				submitted.add(CompletableFuture.supplyAsync(() -> {
					slot.queued.set(false);
					return runCycle(repositoryId, slot);
				}, workers));
			}
			catch (RejectedExecutionException e) {
				slot.queued.set(false);
				logger.debug("Worker pool closed, not checking {}", repositoryId);
			}
		}
		logger.debug("Tick submitted {} of {} repositories", submitted.size(), repositories.size());
		return submitted;
	}

	/**
	 * Check a repository immediately on the calling thread, ignoring the interval, any
	 * backoff window and the unreachable state. Returns
	 * {@link CheckResult.SkipReason#BUSY} instead of waiting when a cycle is in flight.
	 * @param repositoryId the repository
	 * @return the cycle result
	 */
	public CheckResult checkNow(RepositoryId repositoryId) {
		if (isStopped()) {
			return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.STOPPED);
		}
		Instant suspension = suspendedUntil;
		if (suspension != null && clock.instant().isBefore(suspension)) {
			return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.RATE_LIMITED);
		}
		return runCycle(repositoryId, slotFor(repositoryId));
	}

	private CheckResult runCycle(RepositoryId repositoryId, Slot slot) {
		if (isStopped()) {
			return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.STOPPED);
		}
		if (!slot.lock.tryLock()) {
			return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.BUSY);
		}
		try {
			if (subscriptions.subscribersOf(repositoryId).isEmpty()) {
				return new CheckResult.Skipped(repositoryId, CheckResult.SkipReason.UNSUBSCRIBED);
			}
			CheckResult result = checker.check(repositoryId);
			apply(slot, result);
			return result;
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure checking {}", repositoryId, e);
			return new CheckResult.Failure(repositoryId, FailureKind.TRANSIENT, String.valueOf(e.getMessage()), null,
					false);
		}
		finally {
			slot.lock.unlock();
		}
	}

	private void apply(Slot slot, CheckResult result) {
		if (!(result instanceof CheckResult.Failure failure)) {
			if (!(result instanceof CheckResult.Skipped)) {
				slot.backoffUntil = null;
			}
			return;
		}
		if (failure.kind() == FailureKind.AUTH) {
			halt(failure.detail());
			return;
		}
		Instant retryAt = failure.retryAt();
		if (retryAt == null) {
			return;
		}
		if (failure.accountWide()) {
			suspendUntil(retryAt);
		}
		else {
			slot.backoffUntil = retryAt;
		}
	}

	private synchronized void suspendUntil(Instant retryAt) {
		Instant current = suspendedUntil;
		if (current == null || retryAt.isAfter(current)) {
			logger.warn("Account rate limit reached, suspending checks until {}", retryAt);
			suspendedUntil = retryAt;
		}
	}

	private boolean isUnreachable(RepositoryId repositoryId) {
		try {
			return cursorStore.get(repositoryId)
				.map(cursor -> cursor.state() == ReachabilityState.UNREACHABLE)
				.orElse(false);
		}
		catch (StorageException e) {
			// let the cycle run and report the storage failure
			return false;
		}
	}

	private Slot slotFor(RepositoryId repositoryId) {
		return slots.computeIfAbsent(repositoryId, id -> new Slot());
	}

	/**
	 * Returns the scheduling state of a repository.
	 * @param repositoryId the repository
	 * @return {@code CHECKING} while a cycle runs, {@code BACKOFF} inside a backoff or
	 * suspension window, {@code IDLE} otherwise
	 */
	public CheckState stateOf(RepositoryId repositoryId) {
		Slot slot = slots.get(repositoryId);
		if (slot != null && slot.lock.isLocked()) {
			return CheckState.CHECKING;
		}
		Instant now = clock.instant();
		Instant suspension = suspendedUntil;
		if ((slot != null && slot.isBackingOff(now)) || (suspension != null && now.isBefore(suspension))) {
			return CheckState.BACKOFF;
		}
		return CheckState.IDLE;
	}

	public Duration getInterval() {
		return interval;
	}

	/**
	 * Stop scheduling after a fatal failure. Cycles in flight complete; no new ones
	 * start.
	 * @param reason why the scheduler halted
	 */
	void halt(String reason) {
		if (halted.getCount() == 0) {
			return;
		}
		logger.error("Halting scheduler: {}", reason);
		haltReason = reason;
		stopped.set(true);
		timer.shutdown();
		halted.countDown();
	}

	public boolean isHalted() {
		return halted.getCount() == 0;
	}

	public Optional<String> getHaltReason() {
		return Optional.ofNullable(haltReason);
	}

	/**
	 * Block until the scheduler halts on a fatal failure.
	 * @param timeout maximum time to wait
	 * @return true if the scheduler halted within the timeout
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean awaitHalt(Duration timeout) throws InterruptedException {
		return halted.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private boolean isStopped() {
		return stopped.get();
	}

	/**
	 * Cancel the timer, let cycles in flight finish within the grace period, and start no
	 * new cycles.
	 */
	public void stop() {
		stopped.set(true);
		timer.shutdownNow();
		workers.shutdown();
		try {
			if (!workers.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.warn("Cycles still running after {}s, interrupting", gracePeriod.toSeconds());
				workers.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			workers.shutdownNow();
			Thread.currentThread().interrupt();
		}
		logger.info("Scheduler stopped");
	}

	@Override
	public void close() {
		stop();
	}

	private static final class Slot {

		private final ReentrantLock lock = new ReentrantLock();

		private final AtomicBoolean queued = new AtomicBoolean();

		@Nullable
		private volatile Instant backoffUntil;

		boolean isBackingOff(Instant now) {
			Instant until = backoffUntil;
			return until != null && now.isBefore(until);
		}

	}

	private static final class WorkerFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		private final String prefix;

		WorkerFactory(String prefix) {
			this.prefix = prefix;
		}

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			thread.setName(prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
