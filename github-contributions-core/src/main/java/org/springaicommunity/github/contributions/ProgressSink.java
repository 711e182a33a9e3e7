package org.springaicommunity.github.contributions;

/**
 * Receives human-readable progress notifications during an analysis.
 *
 * <p>
 * Implementations should return quickly; a sink that throws does not fail the analysis.
 */
@FunctionalInterface
public interface ProgressSink {

	/**
	 * Sink that discards every notification.
	 */
	ProgressSink NONE = message -> {
	};

	void report(String message);

}
