package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * {@link GraphQLTransport} over the JDK {@link HttpClient}.
 *
 * <p>
 * Every response, successful or not, is inspected for rate limit state (the
 * {@code data.rateLimit} object first, the {@code X-RateLimit-*} headers otherwise) and the
 * snapshot is forwarded to the shared {@link RateLimitTracker}.
 */
public class GitHubGraphQLTransport implements GraphQLTransport {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLTransport.class);

	public static final String GITHUB_GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final RateLimitTracker rateLimitTracker;

	private final URI endpoint;

	private final String token;

	private final Duration requestTimeout;

	public GitHubGraphQLTransport(String token, ObjectMapper objectMapper, RateLimitTracker rateLimitTracker,
			ContributionProperties properties) {
		this(HttpClient.newBuilder()
			.connectTimeout(properties.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), token, objectMapper, rateLimitTracker, URI.create(properties.getEndpoint()),
				properties.getRequestTimeout());
	}

	public GitHubGraphQLTransport(HttpClient httpClient, String token, ObjectMapper objectMapper,
			RateLimitTracker rateLimitTracker, URI endpoint, Duration requestTimeout) {
		this.httpClient = httpClient;
		this.token = token;
		this.objectMapper = objectMapper;
		this.rateLimitTracker = rateLimitTracker;
		this.endpoint = endpoint;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public JsonNode execute(String query, Map<String, ?> variables) {
		String body = serializeRequest(query, variables);
		logger.debug("POST GraphQL ({} bytes)", body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("Accept", "application/vnd.github.v4+json")
			.header("User-Agent", "github-contributions")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		HttpResponse<String> response = send(request);
		logger.debug("POST GraphQL completed in {}ms with status {}", System.currentTimeMillis() - start,
				response.statusCode());
		return handleResponse(response);
	}

	private HttpResponse<String> send(HttpRequest request) {
		try {
			return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw new TransientNetworkException("GraphQL request timed out after " + requestTimeout, e);
		}
		catch (IOException e) {
			logger.warn("GraphQL request failed: {}", e.getMessage());
			throw new TransientNetworkException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException("GraphQL request interrupted");
			cancelled.initCause(e);
			throw cancelled;
		}
	}

	JsonNode handleResponse(HttpResponse<String> response) {
		int statusCode = response.statusCode();
		String body = response.body() != null ? response.body() : "";
		JsonNode envelope = tryParse(body);

		RateLimitInfo rateLimit = extractRateLimit(envelope, response);
		if (rateLimit != null) {
			rateLimitTracker.observe(rateLimit);
		}

		if (statusCode == 401) {
			throw new AuthenticationFailureException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.",
					statusCode, body);
		}
		if (statusCode == 403 || statusCode == 429) {
			if (statusCode == 429 || isRateLimitCause(response, body)) {
				throw new RateLimitedException("Rate limit exceeded (HTTP " + statusCode + ")", statusCode, body,
						parseRetryAfter(response), rateLimit != null ? rateLimit.resetAt() : null);
			}
			throw new AuthenticationFailureException("Forbidden: " + abbreviate(body), statusCode, body);
		}
		if (statusCode >= 500) {
			throw new TransientNetworkException("GitHub API error: " + statusCode, statusCode, body);
		}
		if (statusCode >= 400) {
			List<GraphQLError> errors = envelope != null ? parseErrors(envelope.path("errors")) : List.of();
			throw new GraphQLSemanticException("Query rejected (HTTP " + statusCode + "): " + abbreviate(body),
					statusCode, body, errors, null);
		}

		if (envelope == null || !envelope.isObject()) {
			throw new MalformedResponseException("Response is not a JSON object: " + abbreviate(body), statusCode,
					body);
		}

		JsonNode data = envelope.get("data");
		List<GraphQLError> errors = parseErrors(envelope.path("errors"));
		if (!errors.isEmpty()) {
			if (errors.stream().anyMatch(error -> error.hasType(GraphQLError.RATE_LIMITED))) {
				throw new RateLimitedException("GraphQL rate limit exceeded: " + errors.get(0).message(), statusCode,
						body, parseRetryAfter(response), rateLimit != null ? rateLimit.resetAt() : null);
			}
			throw new GraphQLSemanticException("GraphQL errors: " + joinMessages(errors), statusCode, body, errors,
					data);
		}
		if (data == null || !data.isObject()) {
			throw new MalformedResponseException("Response has neither data nor errors", statusCode, body);
		}
		return data;
	}

	private @Nullable JsonNode tryParse(String body) {
		if (body.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			logger.debug("Response body is not JSON: {}", e.getOriginalMessage());
			return null;
		}
	}

	private @Nullable RateLimitInfo extractRateLimit(@Nullable JsonNode envelope, HttpResponse<?> response) {
		if (envelope != null) {
			JsonNode node = envelope.path("data").path("rateLimit");
			if (node.isObject() && node.hasNonNull("remaining") && node.hasNonNull("resetAt")) {
				try {
					return new RateLimitInfo(node.path("limit").asInt(-1), node.path("remaining").asInt(),
							Instant.parse(node.path("resetAt").asText()), node.path("used").asInt(-1));
				}
				catch (DateTimeParseException e) {
					logger.warn("Failed to parse rateLimit.resetAt: {}", node.path("resetAt").asText());
				}
			}
		}
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		if (remaining < 0 || reset < 0) {
			return null;
		}
		return new RateLimitInfo(parseIntHeader(response, "X-RateLimit-Limit", -1), remaining,
				Instant.ofEpochSecond(reset), parseIntHeader(response, "X-RateLimit-Used", -1));
	}

	private boolean isRateLimitCause(HttpResponse<?> response, String body) {
		if (parseIntHeader(response, "X-RateLimit-Remaining", -1) == 0
				|| response.headers().firstValue("Retry-After").isPresent()) {
			return true;
		}
		return body.toLowerCase(Locale.ROOT).contains("rate limit");
	}

	private List<GraphQLError> parseErrors(JsonNode errorsNode) {
		List<GraphQLError> errors = new ArrayList<>();
		if (errorsNode.isArray()) {
			for (JsonNode node : errorsNode) {
				List<String> path = new ArrayList<>();
				node.path("path").forEach(segment -> path.add(segment.asText()));
				errors.add(new GraphQLError(node.path("message").asText("Unknown error"),
						node.hasNonNull("type") ? node.get("type").asText() : null, path));
			}
		}
		return errors;
	}

	private String serializeRequest(String query, Map<String, ?> variables) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("query", query);
		payload.put("variables", variables);
		try {
			return objectMapper.writeValueAsString(payload);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Query variables are not serializable: " + e.getOriginalMessage(), e);
		}
	}

	private static @Nullable Duration parseRetryAfter(HttpResponse<?> response) {
		return response.headers().firstValue("Retry-After").map(value -> {
			try {
				return Duration.ofSeconds(Long.parseLong(value.trim()));
			}
			catch (NumberFormatException e) {
				return null;
			}
		}).orElse(null);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static String joinMessages(List<GraphQLError> errors) {
		return String.join("; ", errors.stream().map(GraphQLError::message).toList());
	}

	private static String abbreviate(String body) {
		return body.length() > 200 ? body.substring(0, 200) + "..." : body;
	}

}
