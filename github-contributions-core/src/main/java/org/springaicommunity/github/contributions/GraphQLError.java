package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One entry of a GraphQL {@code errors} array.
 *
 * @param message error message
 * @param type GitHub's error type (e.g. {@code NOT_FOUND}, {@code RATE_LIMITED}), or null
 * @param path response path the error applies to
 */
public record GraphQLError(String message, @Nullable String type, List<String> path) {

	public static final String NOT_FOUND = "NOT_FOUND";

	public static final String RATE_LIMITED = "RATE_LIMITED";

	public GraphQLError {
		path = List.copyOf(path);
	}

	public boolean hasType(String candidate) {
		return candidate.equals(type);
	}

}
