package org.springaicommunity.github.contributions;

/**
 * An analysis failed because GitHub could not be queried. The originating
 * {@link GitHubApiException} is the cause.
 */
public class UpstreamFailureException extends RuntimeException {

	private final FailureKind kind;

	public UpstreamFailureException(String message, GitHubApiException cause) {
		super(message + ": " + cause.getMessage(), cause);
		this.kind = cause.getKind();
	}

	public FailureKind getKind() {
		return kind;
	}

	/**
	 * Short explanation suitable for showing to an end user.
	 * @return user-facing message
	 */
	public String userMessage() {
		return switch (kind) {
			case AUTHENTICATION -> getCause().getMessage();
			case RATE_LIMITED -> "GitHub API rate limit reached. Please try again later.";
			case TRANSIENT_NETWORK -> "GitHub is temporarily unreachable. Please try again later.";
			case QUERY_REJECTED -> "GitHub rejected the query.";
			case MALFORMED_RESPONSE -> "GitHub returned an unexpected response.";
		};
	}

}
