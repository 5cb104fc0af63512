package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * What {@link FailurePolicy} decided for one failed cycle.
 *
 * @param updatedCursor cursor to persist (failure count, reachability), or null when the
 * failure leaves the stored cursor untouched
 * @param retryAt end of the backoff or suspension window, or null to retry next tick
 * @param accountWide whether {@code retryAt} suspends every repository
 * @param becameUnreachable the repository just crossed the not-found threshold
 * @param alertAdmins a diagnostic should go to the administrators
 * @param fatal the scheduler must halt
 */
public record FailureDecision(@Nullable Cursor updatedCursor, @Nullable Instant retryAt, boolean accountWide,
		boolean becameUnreachable, boolean alertAdmins, boolean fatal) {

}
