package org.springaicommunity.github.commitwatch;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters reported by the {@code stats} command. Created once at startup
 * and injected; values reset only when the process restarts.
 */
public class WatchStatistics {

	private final Instant startedAt;

	private final AtomicLong checksPerformed = new AtomicLong();

	private final AtomicLong checkFailures = new AtomicLong();

	private final AtomicLong commitsDetected = new AtomicLong();

	private final AtomicLong notificationsSent = new AtomicLong();

	private final AtomicLong deliveryFailures = new AtomicLong();

	public WatchStatistics() {
		this(Clock.systemUTC());
	}

	public WatchStatistics(Clock clock) {
		this.startedAt = clock.instant();
	}

	void recordCheck() {
		checksPerformed.incrementAndGet();
	}

	void recordFailure() {
		checkFailures.incrementAndGet();
	}

	void recordCommits(int count) {
		commitsDetected.addAndGet(count);
	}

	void recordDelivery(boolean success) {
		if (success) {
			notificationsSent.incrementAndGet();
		}
		else {
			deliveryFailures.incrementAndGet();
		}
	}

	public Snapshot snapshot() {
		return new Snapshot(startedAt, checksPerformed.get(), checkFailures.get(), commitsDetected.get(),
				notificationsSent.get(), deliveryFailures.get());
	}

	/**
	 * Point-in-time copy of the counters.
	 */
	public record Snapshot(Instant startedAt, long checksPerformed, long checkFailures, long commitsDetected,
			long notificationsSent, long deliveryFailures) {
	}

}
