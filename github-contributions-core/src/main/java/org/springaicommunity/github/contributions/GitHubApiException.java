package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

/**
 * Base class of the failures raised by a {@link GraphQLTransport}.
 *
 * <p>
 * Subclasses map one-to-one onto {@link FailureKind}; {@link RetryingGraphQLClient} only
 * retries the kinds that report {@link FailureKind#isRetryable()}.
 */
public abstract class GitHubApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	protected GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	protected GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	/**
	 * The failure classification.
	 * @return kind of this failure
	 */
	public abstract FailureKind getKind();

	public boolean isRetryable() {
		return getKind().isRetryable();
	}

	/**
	 * HTTP status of the failed response, or -1 when no response was received.
	 * @return status code
	 */
	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

}
