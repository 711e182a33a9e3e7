package org.springaicommunity.github.contributions;

import java.util.Locale;
import java.util.Optional;

/**
 * Storage for computed {@link ContributionStats}, keyed by subject and range
 * discriminator.
 *
 * <p>
 * Subjects compare case-insensitively. A {@code put} for an existing key supersedes the
 * stored report; readers observe either the old or the new report, never a partial one.
 */
public interface ReportCache {

	/**
	 * Look up a stored report.
	 * @param subject GitHub login
	 * @param rangeKey range discriminator, see {@link DateRange#cacheKey()}
	 * @return the stored report, or empty on a miss
	 * @throws ReportCacheException if the store cannot be read
	 */
	Optional<CachedReport> get(String subject, String rangeKey);

	/**
	 * Store a report, superseding any report for the same key.
	 * @param subject GitHub login
	 * @param rangeKey range discriminator, see {@link DateRange#cacheKey()}
	 * @param stats statistics to store
	 * @return the stored report
	 * @throws ReportCacheException if the store cannot be written
	 */
	CachedReport put(String subject, String rangeKey, ContributionStats stats);

	static String normalizeSubject(String subject) {
		return subject.trim().toLowerCase(Locale.ROOT);
	}

}
