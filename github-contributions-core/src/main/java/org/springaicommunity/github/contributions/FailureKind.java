package org.springaicommunity.github.contributions;

/**
 * Classification of a failed GitHub GraphQL call.
 */
public enum FailureKind {

	/** Bad or insufficiently scoped credentials. Fatal. */
	AUTHENTICATION(false),

	/** Primary or secondary rate limit hit. */
	RATE_LIMITED(true),

	/** Timeouts, connection failures and 5xx responses. */
	TRANSIENT_NETWORK(true),

	/** Well-formed response whose {@code errors} reject the query. */
	QUERY_REJECTED(false),

	/** Response that is not a GraphQL envelope. Fatal. */
	MALFORMED_RESPONSE(false);

	private final boolean retryable;

	FailureKind(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}

}
