package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Raised when a {@link ReportCache} or {@link SubjectRegistry} cannot be read or written.
 *
 * <p>
 * When a write-through fails after a successful aggregation, the freshly computed
 * statistics are attached so the caller can still present them.
 */
public class ReportCacheException extends RuntimeException {

	@Nullable
	private final ContributionStats computedStats;

	public ReportCacheException(String message, Throwable cause) {
		this(message, cause, null);
	}

	public ReportCacheException(String message, Throwable cause, @Nullable ContributionStats computedStats) {
		super(message, cause);
		this.computedStats = computedStats;
	}

	public Optional<ContributionStats> getComputedStats() {
		return Optional.ofNullable(computedStats);
	}

}
