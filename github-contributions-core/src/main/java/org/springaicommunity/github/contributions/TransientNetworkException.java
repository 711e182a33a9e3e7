package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

/**
 * Raised on I/O failures, request timeouts and 5xx responses.
 */
public final class TransientNetworkException extends GitHubApiException {

	public TransientNetworkException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody);
	}

	public TransientNetworkException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public FailureKind getKind() {
		return FailureKind.TRANSIENT_NETWORK;
	}

}
