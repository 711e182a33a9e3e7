package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a cursor-paginated GraphQL connection.
 *
 * @param number 1-based page number
 * @param data the full {@code data} object of the response
 * @param nodes the connection's {@code nodes}
 * @param endCursor cursor to request the following page, or null
 * @param hasNextPage whether the server reported more pages
 * @param present false when the connection was absent from the response (for example an
 * inaccessible repository)
 */
public record Page(int number, JsonNode data, List<JsonNode> nodes, @Nullable String endCursor, boolean hasNextPage,
		boolean present) {

	public Page {
		nodes = List.copyOf(nodes);
	}

}
