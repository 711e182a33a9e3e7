package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

/**
 * Raised when a response body is not a GraphQL envelope.
 */
public final class MalformedResponseException extends GitHubApiException {

	public MalformedResponseException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody);
	}

	@Override
	public FailureKind getKind() {
		return FailureKind.MALFORMED_RESPONSE;
	}

}
