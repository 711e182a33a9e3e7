package org.springaicommunity.github.contributions;

import java.time.Duration;

/**
 * Blocking wait used for backoff and rate limit pauses. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
