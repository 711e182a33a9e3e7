package org.springaicommunity.github.contributions;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Statistics folded across every analyzed calendar year of one subject.
 *
 * <p>
 * Activity counts and line totals are summed. Account-level counts (repositories
 * contributed to, stars, followers, following, public repositories, discussions) are
 * snapshots and are taken from the most recent year. Language bytes are summed per name.
 */
public record AllTimeStats(String subject, int totalYears, int firstYear, int lastYear, long commits,
		long pullRequests, long issues, long reviews, long privateContributions, long linesAdded, long linesDeleted,
		Set<LineCountMethod> lineMethods, int discussions, int repositoriesContributed, int starredRepos,
		int followers, int following, int publicRepos, Map<String, Long> languages, Instant lastUpdated) {

	public AllTimeStats {
		lineMethods = Set.copyOf(lineMethods);
		languages = Map.copyOf(languages);
	}

	/**
	 * Fold yearly statistics.
	 * @param subject GitHub login
	 * @param yearly one entry per analyzed year, in any order
	 * @return the folded statistics, or empty when {@code yearly} is empty
	 */
	public static Optional<AllTimeStats> fold(String subject, List<ContributionStats> yearly) {
		if (yearly.isEmpty()) {
			return Optional.empty();
		}
		List<ContributionStats> ordered = yearly.stream()
			.sorted(Comparator.comparing(stats -> stats.range().start()))
			.toList();
		ContributionStats latest = ordered.get(ordered.size() - 1);

		long commits = 0;
		long pullRequests = 0;
		long issues = 0;
		long reviews = 0;
		long privateContributions = 0;
		long linesAdded = 0;
		long linesDeleted = 0;
		Set<LineCountMethod> methods = EnumSet.noneOf(LineCountMethod.class);
		Map<String, Long> languages = new LinkedHashMap<>();
		Instant lastUpdated = Instant.EPOCH;

		for (ContributionStats stats : ordered) {
			commits += stats.commits();
			pullRequests += stats.pullRequests();
			issues += stats.issues();
			reviews += stats.reviews();
			privateContributions += stats.privateContributions();
			linesAdded += stats.linesAdded();
			linesDeleted += stats.linesDeleted();
			methods.add(stats.lineMethod());
			stats.languages().forEach((language, bytes) -> languages.merge(language, bytes, Long::sum));
			if (stats.generatedAt().isAfter(lastUpdated)) {
				lastUpdated = stats.generatedAt();
			}
		}

		return Optional.of(new AllTimeStats(subject, ordered.size(), ordered.get(0).range().start().getYear(),
				latest.range().start().getYear(), commits, pullRequests, issues, reviews, privateContributions,
				linesAdded, linesDeleted, methods, latest.discussions(), latest.repositoriesContributed(),
				latest.starredRepos(), latest.followers(), latest.following(), latest.publicRepos(), languages,
				lastUpdated));
	}

}
