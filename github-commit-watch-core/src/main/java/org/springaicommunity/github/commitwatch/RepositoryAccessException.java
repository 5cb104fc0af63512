package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Raised by a {@link RepositoryClient} when the upstream API cannot serve a request.
 *
 * <p>
 * Carries the {@link FailureKind} and, for rate limits, how long to wait and whether the
 * limit applies to the whole account rather than a single repository.
 */
public class RepositoryAccessException extends RuntimeException {

	private final FailureKind kind;

	@Nullable
	private final Duration retryAfter;

	private final boolean accountWide;

	public RepositoryAccessException(FailureKind kind, String message) {
		this(kind, message, null, false, null);
	}

	public RepositoryAccessException(FailureKind kind, String message, @Nullable Throwable cause) {
		this(kind, message, null, false, cause);
	}

	public RepositoryAccessException(FailureKind kind, String message, @Nullable Duration retryAfter,
			boolean accountWide, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.retryAfter = retryAfter;
		this.accountWide = accountWide;
	}

	public static RepositoryAccessException rateLimited(String message, @Nullable Duration retryAfter,
			boolean accountWide) {
		return new RepositoryAccessException(FailureKind.RATE_LIMITED, message, retryAfter, accountWide, null);
	}

	public FailureKind getKind() {
		return kind;
	}

	@Nullable
	public Duration getRetryAfter() {
		return retryAfter;
	}

	public boolean isAccountWide() {
		return accountWide;
	}

}
