package org.springaicommunity.github.contributions;

import java.time.Instant;

/**
 * Rate limit snapshot observed on a GitHub GraphQL response.
 *
 * <p>
 * Populated from the {@code rateLimit} object requested alongside every query, or from the
 * {@code X-RateLimit-*} headers when the body carries none.
 *
 * @param limit the maximum number of points allowed per hour, or -1 when unknown
 * @param remaining the number of points remaining in the current window
 * @param resetAt the time when the rate limit window resets
 * @param used the number of points used in the current window, or -1 when unknown
 */
public record RateLimitInfo(int limit, int remaining, Instant resetAt, int used) {

	public RateLimitInfo {
		if (remaining < 0) {
			remaining = 0;
		}
	}

	/**
	 * Returns true if the rate limit has been exceeded.
	 * @return true if no points remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
