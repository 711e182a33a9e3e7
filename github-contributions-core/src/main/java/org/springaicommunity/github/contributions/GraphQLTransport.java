package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Interface for GitHub GraphQL API calls.
 *
 * <p>
 * Provides abstraction over the GraphQL endpoint, enabling testability and decorator
 * implementations such as {@link RetryingGraphQLClient}.
 */
public interface GraphQLTransport {

	/**
	 * Execute a single GraphQL query.
	 * @param query GraphQL query document
	 * @param variables query variables (values may be null)
	 * @return the {@code data} object of the response
	 * @throws AuthenticationFailureException on bad credentials
	 * @throws RateLimitedException when the budget is exhausted
	 * @throws TransientNetworkException on timeouts, I/O failures and 5xx responses
	 * @throws GraphQLSemanticException when the response carries query errors
	 * @throws MalformedResponseException when the response is not a GraphQL envelope
	 * @throws java.util.concurrent.CancellationException when the calling thread is
	 * interrupted
	 */
	JsonNode execute(String query, Map<String, ?> variables);

}
