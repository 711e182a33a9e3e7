package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

/**
 * Raised on 401, or 403 without a rate limit cause. Never retried.
 */
public final class AuthenticationFailureException extends GitHubApiException {

	public AuthenticationFailureException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody);
	}

	@Override
	public FailureKind getKind() {
		return FailureKind.AUTHENTICATION;
	}

}
