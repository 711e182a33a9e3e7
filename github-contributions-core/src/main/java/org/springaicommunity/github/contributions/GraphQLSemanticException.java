package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Raised when a well-formed response carries {@code errors} unrelated to rate limiting, or
 * when the endpoint rejects the request with a client error.
 */
public final class GraphQLSemanticException extends GitHubApiException {

	private final List<GraphQLError> errors;

	private final JsonNode partialData;

	public GraphQLSemanticException(String message, int statusCode, @Nullable String responseBody,
			List<GraphQLError> errors, @Nullable JsonNode partialData) {
		super(message, statusCode, responseBody);
		this.errors = List.copyOf(errors);
		this.partialData = partialData != null ? partialData : MissingNode.getInstance();
	}

	@Override
	public FailureKind getKind() {
		return FailureKind.QUERY_REJECTED;
	}

	public List<GraphQLError> getErrors() {
		return errors;
	}

	/**
	 * The {@code data} object returned next to the errors, or a missing node.
	 * @return partial data
	 */
	public JsonNode getPartialData() {
		return partialData;
	}

	/**
	 * Returns true if any error has the given GitHub error type.
	 * @param type error type such as {@link GraphQLError#NOT_FOUND}
	 * @return true if present
	 */
	public boolean hasErrorType(String type) {
		return errors.stream().anyMatch(error -> error.hasType(type));
	}

}
