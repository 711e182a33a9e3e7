package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGraphQLClient}.
 *
 * Tests retry logic, exponential backoff, rate limit pacing and error classification.
 * Sleeps are recorded instead of performed.
 */
@DisplayName("RetryingGraphQLClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGraphQLClientTest {

	private static final String QUERY = "query($login: String!) { user(login: $login) { id } }";

	private static final Map<String, Object> VARIABLES = Map.of("login", "octocat");

	private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	@Mock
	private GraphQLTransport mockDelegate;

	private final List<Duration> sleeps = new ArrayList<>();

	private final JsonNode data = Json.parse("{\"user\": {\"id\": \"U_1\"}}");

	private RetryingGraphQLClient retryingClient;

	@BeforeEach
	void setUp() {
		retryingClient = client(null);
	}

	private RetryingGraphQLClient client(RateLimitTracker tracker) {
		return RetryingGraphQLClient.builder()
			.wrapping(mockDelegate)
			.rateLimitTracker(tracker)
			.maxRetries(3)
			.initialDelayMs(100)
			.maxDelay(Duration.ofMillis(250))
			.sleeper(sleeps::add)
			.random(new Random(42))
			.clock(Clock.fixed(NOW, ZoneOffset.UTC))
			.build();
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should succeed after fewer transient failures than the retry ceiling")
		void shouldRecoverFromTransientFailures() {
			TransientNetworkException serverError = new TransientNetworkException("GitHub API error: 502", 502, "");
			when(mockDelegate.execute(QUERY, VARIABLES)).thenThrow(serverError).thenThrow(serverError).thenReturn(data);

			JsonNode result = retryingClient.execute(QUERY, VARIABLES);

			assertThat(result).isSameAs(data);
			verify(mockDelegate, times(3)).execute(QUERY, VARIABLES);
			assertThat(sleeps).hasSize(2);
		}

		@Test
		@DisplayName("Should rethrow the last failure once retries are exhausted")
		void shouldRethrowAfterExhaustion() {
			when(mockDelegate.execute(QUERY, VARIABLES))
				.thenThrow(new TransientNetworkException("timeout", new IOException("timeout")));

			assertThatThrownBy(() -> retryingClient.execute(QUERY, VARIABLES))
				.isInstanceOf(TransientNetworkException.class);
			verify(mockDelegate, times(4)).execute(QUERY, VARIABLES);
		}

		@Test
		@DisplayName("Backoff should stay within [delay/2, delay] and respect the cap")
		void backoffShouldBeJitteredAndCapped() {
			when(mockDelegate.execute(QUERY, VARIABLES))
				.thenThrow(new TransientNetworkException("GitHub API error: 503", 503, ""));

			assertThatThrownBy(() -> retryingClient.execute(QUERY, VARIABLES))
				.isInstanceOf(TransientNetworkException.class);

			assertThat(sleeps).hasSize(3);
			assertThat(sleeps.get(0).toMillis()).isBetween(50L, 100L);
			assertThat(sleeps.get(1).toMillis()).isBetween(100L, 200L);
			assertThat(sleeps.get(2).toMillis()).isBetween(125L, 250L);
		}

		@Test
		@DisplayName("Should wait for Retry-After plus a second on rate limiting")
		void shouldHonorRetryAfter() {
			RateLimitedException limited = new RateLimitedException("Rate limit exceeded (HTTP 429)", 429, "",
					Duration.ofSeconds(7), null);
			when(mockDelegate.execute(QUERY, VARIABLES)).thenThrow(limited).thenReturn(data);

			retryingClient.execute(QUERY, VARIABLES);

			assertThat(sleeps).containsExactly(Duration.ofSeconds(8));
		}

		@Test
		@DisplayName("Should wait until the reset time when no Retry-After is sent")
		void shouldWaitForReset() {
			RateLimitedException limited = new RateLimitedException("GraphQL rate limit exceeded", 200, "", null,
					NOW.plusSeconds(30));
			when(mockDelegate.execute(QUERY, VARIABLES)).thenThrow(limited).thenReturn(data);

			retryingClient.execute(QUERY, VARIABLES);

			assertThat(sleeps).containsExactly(Duration.ofSeconds(31));
		}

	}

	@Nested
	@DisplayName("Non-Retryable Failure Tests")
	class NonRetryableTest {

		@Test
		@DisplayName("Should make exactly one request on authentication failure")
		void shouldNotRetryAuthenticationFailure() {
			when(mockDelegate.execute(QUERY, VARIABLES))
				.thenThrow(new AuthenticationFailureException("Bad credentials", 401, ""));

			assertThatThrownBy(() -> retryingClient.execute(QUERY, VARIABLES))
				.isInstanceOf(AuthenticationFailureException.class);
			verify(mockDelegate, times(1)).execute(QUERY, VARIABLES);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should not retry query errors")
		void shouldNotRetrySemanticErrors() {
			when(mockDelegate.execute(QUERY, VARIABLES)).thenThrow(new GraphQLSemanticException("GraphQL errors", 200,
					"", List.of(new GraphQLError("Could not resolve", GraphQLError.NOT_FOUND, List.of("user"))), null));

			assertThatThrownBy(() -> retryingClient.execute(QUERY, VARIABLES))
				.isInstanceOf(GraphQLSemanticException.class);
			verify(mockDelegate, times(1)).execute(QUERY, VARIABLES);
		}

		@Test
		@DisplayName("Should not retry malformed responses")
		void shouldNotRetryMalformedResponses() {
			when(mockDelegate.execute(QUERY, VARIABLES))
				.thenThrow(new MalformedResponseException("Response is not a JSON object", 200, "<html>"));

			assertThatThrownBy(() -> retryingClient.execute(QUERY, VARIABLES))
				.isInstanceOf(MalformedResponseException.class);
			verify(mockDelegate, times(1)).execute(QUERY, VARIABLES);
		}

	}

	@Nested
	@DisplayName("Rate Limit Pacing Tests")
	class PacingTest {

		@Test
		@DisplayName("Should sleep until reset when the budget is at the reserve floor")
		void shouldPaceBeforeCall() {
			RateLimitTracker tracker = RateLimitTracker.withDefaults(Clock.fixed(NOW, ZoneOffset.UTC));
			tracker.observe(new RateLimitInfo(5000, 20, NOW.plusSeconds(45), 4980));
			when(mockDelegate.execute(QUERY, VARIABLES)).thenReturn(data);

			client(tracker).execute(QUERY, VARIABLES);

			assertThat(sleeps).containsExactly(Duration.ofSeconds(45));
		}

		@Test
		@DisplayName("Should give up without calling when the reset is beyond the cap")
		void shouldGiveUpWhenExhausted() {
			RateLimitTracker tracker = RateLimitTracker.withDefaults(Clock.fixed(NOW, ZoneOffset.UTC));
			tracker.observe(new RateLimitInfo(5000, 0, NOW.plus(Duration.ofHours(2)), 5000));

			assertThatThrownBy(() -> client(tracker).execute(QUERY, VARIABLES))
				.isInstanceOf(RateLimitedException.class)
				.hasMessageContaining("Try again later");
			verifyNoInteractions(mockDelegate);
		}

	}

	@Test
	@DisplayName("Interrupted backoff should surface as cancellation")
	void interruptedSleepShouldCancel() {
		RetryingGraphQLClient interrupting = RetryingGraphQLClient.builder()
			.wrapping(mockDelegate)
			.initialDelayMs(10)
			.sleeper(duration -> {
				throw new InterruptedException("stop");
			})
			.build();
		when(mockDelegate.execute(anyString(), anyMap()))
			.thenThrow(new TransientNetworkException("GitHub API error: 500", 500, ""));

		try {
			assertThatThrownBy(() -> interrupting.execute(QUERY, VARIABLES))
				.isInstanceOf(CancellationException.class);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
		verify(mockDelegate, times(1)).execute(QUERY, VARIABLES);
	}

}
