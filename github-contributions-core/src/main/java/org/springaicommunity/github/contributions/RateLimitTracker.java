package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Holds the most recently observed rate limit snapshot for one token and decides how long
 * the next call has to wait.
 *
 * <p>
 * One tracker is shared by every aggregation running against the same token, so all access
 * is synchronized. Snapshots are immutable records and are swapped as a whole.
 *
 * <p>
 * A call is permitted immediately when {@code remaining} is above the reserve floor or the
 * window has already reset. The floor is the larger of {@code minimumFloor} and
 * {@code reserveFraction} of the hourly limit.
 */
public class RateLimitTracker {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitTracker.class);

	private final Clock clock;

	private final int minimumFloor;

	private final double reserveFraction;

	private final Duration maxWait;

	@Nullable
	private RateLimitInfo snapshot;

	public RateLimitTracker(Clock clock, int minimumFloor, double reserveFraction, Duration maxWait) {
		if (minimumFloor < 0) {
			throw new IllegalArgumentException("minimumFloor must be non-negative");
		}
		if (reserveFraction < 0 || reserveFraction >= 1) {
			throw new IllegalArgumentException("reserveFraction must be in [0, 1)");
		}
		if (maxWait.isNegative() || maxWait.isZero()) {
			throw new IllegalArgumentException("maxWait must be positive");
		}
		this.clock = clock;
		this.minimumFloor = minimumFloor;
		this.reserveFraction = reserveFraction;
		this.maxWait = maxWait;
	}

	/**
	 * Create a tracker with the default policy: keep 10% of the hourly budget (at least 100
	 * points) in reserve and never wait longer than one hour.
	 * @param clock clock used to compare against the reset time
	 * @return new tracker
	 */
	public static RateLimitTracker withDefaults(Clock clock) {
		return new RateLimitTracker(clock, 100, 0.10, Duration.ofHours(1));
	}

	/**
	 * Record the latest snapshot. Always overwrites the previous one, including when
	 * {@code remaining} went up because the window reset.
	 * @param info snapshot taken from a response
	 */
	public synchronized void observe(RateLimitInfo info) {
		this.snapshot = info;
		if (info.remaining() <= reserveFloor(info)) {
			logger.info("Rate limit low: {}/{} remaining, resets at {}", info.remaining(), info.limit(),
					info.resetAt());
		}
		else {
			logger.debug("Rate limit: {}/{} remaining, resets at {}", info.remaining(), info.limit(), info.resetAt());
		}
	}

	/**
	 * Compute how long the caller should wait before issuing the next call.
	 * @return zero when the call is permitted now, otherwise the time until reset capped at
	 * {@link #getMaxWait()}
	 */
	public synchronized Duration waitTimeBeforeNextCall() {
		RateLimitInfo current = this.snapshot;
		if (current == null || current.remaining() > reserveFloor(current)) {
			return Duration.ZERO;
		}
		Instant now = clock.instant();
		if (!now.isBefore(current.resetAt())) {
			return Duration.ZERO;
		}
		Duration untilReset = Duration.between(now, current.resetAt());
		return untilReset.compareTo(maxWait) > 0 ? maxWait : untilReset;
	}

	/**
	 * Returns true when a wait computed by {@link #waitTimeBeforeNextCall()} hit the cap,
	 * meaning the budget cannot be recovered by sleeping.
	 * @param wait the computed wait
	 * @return true if the caller should give up instead of sleeping
	 */
	public boolean isExhausted(Duration wait) {
		return wait.compareTo(maxWait) >= 0;
	}

	/**
	 * Returns the most recent snapshot, or null if no response has been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	public synchronized @Nullable RateLimitInfo getSnapshot() {
		return snapshot;
	}

	public Duration getMaxWait() {
		return maxWait;
	}

	int reserveFloor(RateLimitInfo info) {
		int proportional = info.limit() > 0 ? (int) Math.ceil(info.limit() * reserveFraction) : 0;
		return Math.max(minimumFloor, proportional);
	}

}
