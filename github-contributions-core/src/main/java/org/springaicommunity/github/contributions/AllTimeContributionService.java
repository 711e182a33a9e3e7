package org.springaicommunity.github.contributions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds per-year statistics from {@link DateRange#EPOCH_YEAR} up to the current year.
 *
 * <p>
 * Past years are served from the cache when present. The current year is still changing
 * and is always refreshed. A year that fails upstream is skipped; an unknown subject or
 * rejected credentials abort the whole run.
 */
public class AllTimeContributionService {

	private static final Logger logger = LoggerFactory.getLogger(AllTimeContributionService.class);

	private final ContributionAggregator aggregator;

	private final Clock clock;

	public AllTimeContributionService(ContributionAggregator aggregator, Clock clock) {
		this.aggregator = aggregator;
		this.clock = clock;
	}

	public Optional<AllTimeStats> allTime(String subject) {
		return allTime(subject, ProgressSink.NONE);
	}

	public Optional<AllTimeStats> allTime(String subject, ProgressSink progress) {
		int currentYear = Year.now(clock.withZone(ZoneOffset.UTC)).getValue();
		List<ContributionStats> yearly = new ArrayList<>();

		for (int year = DateRange.EPOCH_YEAR; year <= currentYear; year++) {
			DateRange range = DateRange.calendarYear(year);
			reportYear(progress, year, currentYear);
			try {
				ContributionStats stats = year == currentYear ? aggregator.refresh(subject, range)
						: aggregator.contributions(subject, range);
				yearly.add(stats);
			}
			catch (ReportCacheException e) {
				logger.warn("Could not cache {} for {}: {}", year, subject, e.getMessage());
				e.getComputedStats().ifPresent(yearly::add);
			}
			catch (UpstreamFailureException e) {
				if (e.getKind() == FailureKind.AUTHENTICATION) {
					throw e;
				}
				logger.warn("Skipping {} for {}: {}", year, subject, e.getMessage());
			}
		}

		logger.info("Folded {} years of contributions for {}", yearly.size(), subject);
		return AllTimeStats.fold(subject, yearly);
	}

	private static void reportYear(ProgressSink progress, int year, int currentYear) {
		try {
			progress.report("Analyzing " + year + " (" + (year - DateRange.EPOCH_YEAR + 1) + "/"
					+ (currentYear - DateRange.EPOCH_YEAR + 1) + ")...");
		}
		catch (RuntimeException e) {
			logger.warn("Progress sink failed: {}", e.getMessage());
		}
	}

}
