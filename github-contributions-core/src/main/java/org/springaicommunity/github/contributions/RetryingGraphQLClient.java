package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Decorator that adds rate limit pacing and automatic retries to a
 * {@link GraphQLTransport}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Budget-aware pacing: before every attempt, waits as long as the shared
 * {@link RateLimitTracker} asks, and gives up with {@link RateLimitedException} when the
 * wait would exceed the tracker's cap</li>
 * <li>Exponential backoff with jitter for {@link TransientNetworkException} and
 * {@link RateLimitedException}</li>
 * <li>Reset-aware backoff: honors {@code Retry-After} or the reset time of an exhausted
 * window instead of a blind exponential delay</li>
 * <li>No retry for authentication, malformed response and query errors</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GraphQLTransport client = RetryingGraphQLClient.builder()
 *     .wrapping(new GitHubGraphQLTransport(token, mapper, tracker, properties))
 *     .rateLimitTracker(tracker)
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGraphQLClient implements GraphQLTransport {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGraphQLClient.class);

	/**
	 * Maximum time to wait for a rate limit reset (1 hour). If the computed wait exceeds
	 * this, fall back to exponential backoff.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GraphQLTransport delegate;

	@Nullable
	private final RateLimitTracker rateLimitTracker;

	private final int maxRetries;

	private final long initialDelayMs;

	private final long maxDelayMs;

	private final Sleeper sleeper;

	private final Random random;

	private final Clock clock;

	private RetryingGraphQLClient(Builder builder) {
		this.delegate = builder.delegate;
		this.rateLimitTracker = builder.rateLimitTracker;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
		this.sleeper = builder.sleeper;
		this.random = builder.random;
		this.clock = builder.clock;
	}

	/**
	 * Create a new builder for RetryingGraphQLClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public JsonNode execute(String query, Map<String, ?> variables) {
		String description = describe(query);
		GitHubApiException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			awaitRateLimitBudget(description);
			try {
				return delegate.execute(query, variables);
			}
			catch (GitHubApiException e) {
				lastException = e;

				if (!e.isRetryable()) {
					throw e;
				}

				if (attempt < maxRetries) {
					long waitMs = computeWaitTime(e, delay);
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), waitMs);
					sleep(Duration.ofMillis(waitMs));
					delay = Math.min(delay * 2, maxDelayMs);
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	private void awaitRateLimitBudget(String description) {
		if (rateLimitTracker == null) {
			return;
		}
		Duration wait = rateLimitTracker.waitTimeBeforeNextCall();
		if (wait.isZero()) {
			return;
		}
		RateLimitInfo snapshot = rateLimitTracker.getSnapshot();
		if (rateLimitTracker.isExhausted(wait)) {
			throw new RateLimitedException("Rate limit budget exhausted; window resets at "
					+ (snapshot != null ? snapshot.resetAt() : "an unknown time") + ". Try again later.");
		}
		if (snapshot != null && snapshot.isExceeded()) {
			logger.warn("Rate limit spent before {}: waiting {}s until reset", description, wait.toSeconds());
		}
		else {
			logger.info("Rate limit reserve reached before {}: waiting {}s until reset", description,
					wait.toSeconds());
		}
		sleep(wait);
	}

	/**
	 * Compute how long to wait before retrying. Rate limit failures that name a
	 * {@code Retry-After} or reset time wait exactly that long (+1s buffer). Everything
	 * else uses the jittered exponential delay.
	 */
	private long computeWaitTime(GitHubApiException e, long delay) {
		if (e instanceof RateLimitedException rateLimited) {
			Duration retryAfter = rateLimited.getRetryAfter();
			if (retryAfter != null && retryAfter.toSeconds() <= MAX_RESET_WAIT_SECONDS) {
				return retryAfter.toMillis() + 1000;
			}
			Instant resetAt = rateLimited.getResetAt();
			if (resetAt != null) {
				long waitSeconds = resetAt.getEpochSecond() - clock.instant().getEpochSecond() + 1;
				if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
					logger.info("Rate limit exceeded. Waiting {} seconds until reset at {}", waitSeconds, resetAt);
					return waitSeconds * 1000;
				}
				else if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
					logger.warn("Rate limit reset is {} seconds away (> 1hr), using exponential backoff instead",
							waitSeconds);
				}
			}
		}
		return jitter(delay);
	}

	private long jitter(long delay) {
		long half = delay / 2;
		return half + random.nextLong(delay - half + 1);
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException("Retry wait interrupted");
			cancelled.initCause(e);
			throw cancelled;
		}
	}

	private static String describe(String query) {
		String trimmed = query.strip();
		int brace = trimmed.indexOf('(');
		int end = brace > 0 ? brace : Math.min(trimmed.length(), 40);
		return "GraphQL " + trimmed.substring(0, end).strip();
	}

	/**
	 * Builder for {@link RetryingGraphQLClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>initialDelay: 1 second</li>
	 * <li>maxDelay: 60 seconds</li>
	 * </ul>
	 */
	public static class Builder {

		private GraphQLTransport delegate;

		@Nullable
		private RateLimitTracker rateLimitTracker;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private long maxDelayMs = 60_000;

		private Sleeper sleeper = Sleeper.THREAD;

		private Random random = new Random();

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the transport to wrap with retry logic.
		 * @param transport the GraphQLTransport to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GraphQLTransport transport) {
			this.delegate = transport;
			return this;
		}

		/**
		 * Set the tracker consulted before every attempt.
		 * @param tracker shared rate limit tracker (null disables pacing)
		 * @return this builder
		 */
		public Builder rateLimitTracker(@Nullable RateLimitTracker tracker) {
			this.rateLimitTracker = tracker;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the upper bound of the exponential delay.
		 * @param delay maximum delay (default: 60 seconds)
		 * @return this builder
		 */
		public Builder maxDelay(Duration delay) {
			this.maxDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the sleeper used for backoff and pacing waits.
		 * @param sleeper sleeper (default: {@link Sleeper#THREAD})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the random source for jitter.
		 * @param random random source
		 * @return this builder
		 */
		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		/**
		 * Set the clock used to compute waits until a reset time.
		 * @param clock clock (default: system UTC)
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RetryingGraphQLClient.
		 * @return configured RetryingGraphQLClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGraphQLClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GraphQLTransport to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxDelayMs < initialDelayMs) {
				throw new IllegalStateException("maxDelay must not be shorter than initialDelay");
			}
			return new RetryingGraphQLClient(this);
		}

	}

}
