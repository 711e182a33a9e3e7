package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Runs a GraphQL query repeatedly, following cursor-based pagination.
 *
 * <p>
 * The query must declare a {@code $cursor: String} variable and select
 * {@code pageInfo { hasNextPage endCursor }} and {@code nodes} on the connection found at
 * {@code connectionPath}. Pages are fetched lazily: nothing is requested until the consumer
 * advances, and a consumer that stops early causes no further calls. Streams are
 * forward-only and cannot be restarted.
 */
public class PaginatingQueryRunner {

	private static final Logger logger = LoggerFactory.getLogger(PaginatingQueryRunner.class);

	public static final String CURSOR_VARIABLE = "cursor";

	public static final int DEFAULT_MAX_PAGES = 100;

	private final GraphQLTransport transport;

	private final int defaultMaxPages;

	public PaginatingQueryRunner(GraphQLTransport transport) {
		this(transport, DEFAULT_MAX_PAGES);
	}

	public PaginatingQueryRunner(GraphQLTransport transport, int defaultMaxPages) {
		if (defaultMaxPages <= 0) {
			throw new IllegalArgumentException("maxPages must be positive");
		}
		this.transport = transport;
		this.defaultMaxPages = defaultMaxPages;
	}

	/**
	 * Stream the pages of a connection using the default page ceiling.
	 * @param query GraphQL query declaring {@code $cursor}
	 * @param variables query variables, excluding the cursor
	 * @param connectionPath field names leading from {@code data} to the connection
	 * @return lazy stream of pages
	 */
	public Stream<Page> pages(String query, Map<String, ?> variables, List<String> connectionPath) {
		return pages(query, variables, connectionPath, defaultMaxPages);
	}

	/**
	 * Stream the pages of a connection.
	 * @param query GraphQL query declaring {@code $cursor}
	 * @param variables query variables, excluding the cursor
	 * @param connectionPath field names leading from {@code data} to the connection
	 * @param maxPages ceiling on the number of pages requested
	 * @return lazy stream of pages
	 */
	public Stream<Page> pages(String query, Map<String, ?> variables, List<String> connectionPath, int maxPages) {
		if (maxPages <= 0) {
			throw new IllegalArgumentException("maxPages must be positive");
		}
		PageIterator iterator = new PageIterator(query, variables, connectionPath, maxPages);
		return StreamSupport
			.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	/**
	 * Convenience: collect every node of every page.
	 * @param query GraphQL query declaring {@code $cursor}
	 * @param variables query variables, excluding the cursor
	 * @param connectionPath field names leading from {@code data} to the connection
	 * @return all nodes in page order
	 */
	List<JsonNode> allNodes(String query, Map<String, ?> variables, List<String> connectionPath) {
		List<JsonNode> nodes = new ArrayList<>();
		pages(query, variables, connectionPath).forEach(page -> nodes.addAll(page.nodes()));
		return nodes;
	}

	private final class PageIterator implements Iterator<Page> {

		private final String query;

		private final Map<String, ?> variables;

		private final List<String> connectionPath;

		private final int maxPages;

		private int fetched = 0;

		private boolean more = true;

		@Nullable
		private String cursor;

		private PageIterator(String query, Map<String, ?> variables, List<String> connectionPath, int maxPages) {
			this.query = query;
			this.variables = variables;
			this.connectionPath = List.copyOf(connectionPath);
			this.maxPages = maxPages;
		}

		@Override
		public boolean hasNext() {
			return more && fetched < maxPages;
		}

		@Override
		public Page next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Map<String, Object> pageVariables = new LinkedHashMap<>(variables);
			pageVariables.put(CURSOR_VARIABLE, cursor);

			JsonNode data = transport.execute(query, pageVariables);
			fetched++;

			JsonNode connection = data;
			for (String field : connectionPath) {
				connection = connection.path(field);
			}

			if (!connection.isObject()) {
				more = false;
				logger.debug("Connection {} absent on page {}", connectionPath, fetched);
				return new Page(fetched, data, List.of(), null, false, false);
			}

			List<JsonNode> nodes = new ArrayList<>();
			connection.path("nodes").forEach(node -> {
				if (!node.isNull()) {
					nodes.add(node);
				}
			});

			JsonNode pageInfo = connection.path("pageInfo");
			boolean hasNextPage = pageInfo.path("hasNextPage").asBoolean(false);
			String endCursor = pageInfo.hasNonNull("endCursor") ? pageInfo.get("endCursor").asText() : null;

			if (hasNextPage && (endCursor == null || endCursor.equals(cursor))) {
				logger.warn("Connection {} reported another page without advancing its cursor; stopping at page {}",
						connectionPath, fetched);
				hasNextPage = false;
			}
			if (hasNextPage && fetched >= maxPages) {
				logger.warn("Connection {} still has pages after the {} page ceiling; stopping", connectionPath,
						maxPages);
			}

			more = hasNextPage;
			cursor = endCursor;
			logger.debug("Fetched page {} of {} ({} nodes), has next page: {}", fetched, connectionPath, nodes.size(),
					hasNextPage);
			return new Page(fetched, data, nodes, endCursor, hasNextPage, true);
		}

	}

}
