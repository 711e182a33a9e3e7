package org.springaicommunity.github.contributions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes lines added and deleted from commit histories, estimating from merged pull
 * requests where a repository's history is not usable.
 *
 * <p>
 * Covered repositories contribute their commit totals. When any repository is not
 * covered, merged pull requests created within the range and targeting an uncovered
 * repository are added instead, and the result is {@link LineCountMethod#ESTIMATED}. If no
 * repository is covered at all, every in-range pull request counts.
 */
public class LineStatsCalculator {

	private static final Logger logger = LoggerFactory.getLogger(LineStatsCalculator.class);

	/**
	 * Whether {@link #calculate} will need pull requests for these histories.
	 * @param histories one entry per contributed repository
	 * @return true if any repository is not covered
	 */
	public boolean requiresEstimate(List<RepositoryHistory> histories) {
		return histories.stream().anyMatch(history -> !history.covered());
	}

	public LineStats calculate(List<RepositoryHistory> histories, List<PullRequest> pullRequests, DateRange range) {
		long added = 0;
		long deleted = 0;
		int sources = 0;

		for (RepositoryHistory history : histories) {
			if (!history.covered()) {
				continue;
			}
			for (Commit commit : history.commits()) {
				if (range.contains(commit.committedAt())) {
					added += commit.additions();
					deleted += commit.deletions();
					sources++;
				}
			}
		}

		if (!requiresEstimate(histories)) {
			logger.debug("Counted lines exactly from {} commits in {} repositories", sources, histories.size());
			return new LineStats(added, deleted, LineCountMethod.EXACT, sources);
		}

		Set<String> uncovered = histories.stream()
			.filter(history -> !history.covered())
			.map(history -> history.repository().toLowerCase(Locale.ROOT))
			.collect(Collectors.toSet());
		boolean noneCovered = uncovered.size() == histories.size();

		int estimated = 0;
		for (PullRequest pullRequest : pullRequests) {
			if (!range.contains(pullRequest.createdAt())) {
				continue;
			}
			if (noneCovered || uncovered.contains(pullRequest.baseRepository().toLowerCase(Locale.ROOT))) {
				added += pullRequest.additions();
				deleted += pullRequest.deletions();
				estimated++;
			}
		}

		logger.debug("Estimated lines from {} pull requests for {} uncovered repositories", estimated,
				uncovered.size());
		return new LineStats(added, deleted, LineCountMethod.ESTIMATED, sources + estimated);
	}

}
