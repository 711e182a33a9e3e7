package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Raised on 429, on 403 caused by an exhausted budget, and on GraphQL {@code RATE_LIMITED}
 * errors.
 *
 * <p>
 * Carries the server's hint about when to come back, when one was sent.
 */
public final class RateLimitedException extends GitHubApiException {

	@Nullable
	private final Duration retryAfter;

	@Nullable
	private final Instant resetAt;

	public RateLimitedException(String message, int statusCode, @Nullable String responseBody,
			@Nullable Duration retryAfter, @Nullable Instant resetAt) {
		super(message, statusCode, responseBody);
		this.retryAfter = retryAfter;
		this.resetAt = resetAt;
	}

	public RateLimitedException(String message) {
		this(message, -1, null, null, null);
	}

	@Override
	public FailureKind getKind() {
		return FailureKind.RATE_LIMITED;
	}

	/**
	 * Value of the {@code Retry-After} header, if present.
	 * @return server-requested delay, or null
	 */
	public @Nullable Duration getRetryAfter() {
		return retryAfter;
	}

	/**
	 * Reset time of the exhausted window, if known.
	 * @return reset time, or null
	 */
	public @Nullable Instant getResetAt() {
		return resetAt;
	}

}
