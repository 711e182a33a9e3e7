package org.springaicommunity.github.contributions;

import java.time.Duration;

/**
 * An analysis did not finish before its deadline and was cancelled.
 */
public class AnalysisTimeoutException extends RuntimeException {

	private final Duration deadline;

	public AnalysisTimeoutException(Duration deadline, Throwable cause) {
		super("Analysis did not complete within " + deadline.toSeconds() + "s", cause);
		this.deadline = deadline;
	}

	public Duration getDeadline() {
		return deadline;
	}

}
