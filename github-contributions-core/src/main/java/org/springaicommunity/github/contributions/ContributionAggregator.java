package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Produces {@link ContributionStats} for a subject and date range.
 *
 * <p>
 * An analysis runs four phases against the GraphQL API:
 * <ol>
 * <li>profile (account-level counts and the user id)</li>
 * <li>contribution summary, one query per year-long window of the range</li>
 * <li>commit history for every repository the subject committed to</li>
 * <li>merged pull requests, only when some repository history is unusable</li>
 * </ol>
 * Results are written through the optional {@link ReportCache}.
 *
 * <pre>
 * {@code
 * ContributionAggregator aggregator = ContributionsBuilder.create()
 *     .tokenFromEnv()
 *     .buildAggregator();
 *
 * ContributionStats stats = aggregator.contributions("octocat", DateRange.calendarYear(2024));
 * }
 * </pre>
 */
public class ContributionAggregator {

	private static final Logger logger = LoggerFactory.getLogger(ContributionAggregator.class);

	private final GraphQLTransport client;

	private final PaginatingQueryRunner pages;

	@Nullable
	private final ReportCache cache;

	private final LineStatsCalculator lineStatsCalculator;

	private final Clock clock;

	public ContributionAggregator(GraphQLTransport client, @Nullable ReportCache cache) {
		this(client, new PaginatingQueryRunner(client), cache, new LineStatsCalculator(), Clock.systemUTC());
	}

	public ContributionAggregator(GraphQLTransport client, PaginatingQueryRunner pages, @Nullable ReportCache cache,
			LineStatsCalculator lineStatsCalculator, Clock clock) {
		this.client = client;
		this.pages = pages;
		this.cache = cache;
		this.lineStatsCalculator = lineStatsCalculator;
		this.clock = clock;
	}

	public ContributionStats contributions(String subject, DateRange range) {
		return contributions(subject, range, ProgressSink.NONE);
	}

	/**
	 * Statistics for {@code subject} over {@code range}, served from the cache when a report
	 * is stored, otherwise aggregated and written through.
	 * @param subject GitHub login
	 * @param range range to analyze
	 * @param progress receives progress notifications
	 * @return the statistics
	 * @throws SubjectNotFoundException if the user does not exist
	 * @throws UpstreamFailureException if GitHub could not be queried
	 * @throws ReportCacheException if the write-through failed (carries the statistics)
	 */
	public ContributionStats contributions(String subject, DateRange range, ProgressSink progress) {
		validateSubject(subject);
		if (cache != null) {
			try {
				Optional<CachedReport> hit = cache.get(subject, range.cacheKey());
				if (hit.isPresent()) {
					logger.info("Serving cached report {} for {} ({})", hit.get().id(), subject, range.cacheKey());
					return hit.get().stats();
				}
			}
			catch (ReportCacheException e) {
				logger.warn("Cache read failed for {} ({}), aggregating instead: {}", subject, range.cacheKey(),
						e.getMessage());
			}
		}
		return refresh(subject, range, progress);
	}

	public ContributionStats refresh(String subject, DateRange range) {
		return refresh(subject, range, ProgressSink.NONE);
	}

	/**
	 * Aggregate without consulting the cache, then write the result through.
	 * @param subject GitHub login
	 * @param range range to analyze
	 * @param progress receives progress notifications
	 * @return the fresh statistics
	 */
	public ContributionStats refresh(String subject, DateRange range, ProgressSink progress) {
		validateSubject(subject);
		ContributionStats stats = aggregate(subject, range, progress);
		if (cache != null) {
			try {
				cache.put(subject, range.cacheKey(), stats);
			}
			catch (ReportCacheException e) {
				logger.error("Failed to cache report for {} ({}): {}", subject, range.cacheKey(), e.getMessage());
				throw new ReportCacheException(e.getMessage(), e, stats);
			}
		}
		return stats;
	}

	/**
	 * Read a stored report without contacting GitHub.
	 * @param subject GitHub login
	 * @param range range of the report
	 * @return the stored report, or empty when none is stored or no cache is configured
	 */
	public Optional<CachedReport> cached(String subject, DateRange range) {
		validateSubject(subject);
		if (cache == null) {
			return Optional.empty();
		}
		return cache.get(subject, range.cacheKey());
	}

	private ContributionStats aggregate(String subject, DateRange range, ProgressSink progress) {
		logger.info("Analyzing contributions of {} for {}", subject, range.description());
		long start = System.currentTimeMillis();

		report(progress, "Fetching profile for " + subject + "...");
		Profile profile = fetchProfile(subject);

		report(progress, "Fetching contribution summary for " + range.description() + "...");
		ContributionStats.Builder builder = ContributionStats.builder(subject, range)
			.followers(profile.followers())
			.following(profile.following())
			.publicRepos(profile.publicRepos())
			.starredRepos(profile.starredRepos())
			.discussions(profile.discussions());
		Map<String, RepositoryRef> repositories = fetchSummary(subject, range, builder);

		report(progress, "Fetching commit history for " + repositories.size() + " repositories...");
		List<RepositoryHistory> histories = new ArrayList<>();
		for (RepositoryRef repository : repositories.values()) {
			histories.add(fetchHistory(repository, profile.id(), range));
		}

		List<PullRequest> pullRequests = List.of();
		if (lineStatsCalculator.requiresEstimate(histories)) {
			report(progress, "Estimating lines from merged pull requests...");
			pullRequests = fetchMergedPullRequests(subject, range);
		}

		LineStats lines = lineStatsCalculator.calculate(histories, pullRequests, range);
		report(progress, "Calculated lines: +" + lines.added() + " / -" + lines.deleted() + " ("
				+ lines.method().label() + ")");

		ContributionStats stats = builder.lines(lines).generatedAt(clock.instant()).build();
		logger.info("Analyzed {} for {} in {}ms: {} commits, {} repositories, lines {}", subject,
				range.description(), System.currentTimeMillis() - start, stats.commits(), repositories.size(),
				lines.method().label());
		return stats;
	}

	private Profile fetchProfile(String subject) {
		JsonNode data;
		try {
			data = client.execute(ContributionQueries.PROFILE, Map.of("login", subject));
		}
		catch (GraphQLSemanticException e) {
			if (e.hasErrorType(GraphQLError.NOT_FOUND)) {
				throw new SubjectNotFoundException(subject, e);
			}
			throw new UpstreamFailureException("Profile query failed for " + subject, e);
		}
		catch (GitHubApiException e) {
			throw new UpstreamFailureException("Profile query failed for " + subject, e);
		}

		JsonNode user = data.path("user");
		if (!user.isObject()) {
			throw new SubjectNotFoundException(subject);
		}
		return new Profile(JsonNodeUtils.getString(user, "id").orElse(""),
				JsonNodeUtils.getInt(user, "followers", "totalCount"),
				JsonNodeUtils.getInt(user, "following", "totalCount"),
				JsonNodeUtils.getInt(user, "repositories", "totalCount"),
				JsonNodeUtils.getInt(user, "starredRepositories", "totalCount"),
				JsonNodeUtils.getInt(user, "repositoryDiscussions", "totalCount"));
	}

	private Map<String, RepositoryRef> fetchSummary(String subject, DateRange range,
			ContributionStats.Builder builder) {
		int commits = 0;
		int issues = 0;
		int pullRequests = 0;
		int reviews = 0;
		int restricted = 0;
		int repositoriesContributed = 0;
		Map<String, RepositoryRef> repositories = new LinkedHashMap<>();

		for (DateRange window : range.windows()) {
			JsonNode data;
			try {
				data = client.execute(ContributionQueries.CONTRIBUTION_SUMMARY,
						Map.of("login", subject, "from", window.fromInstant().toString(), "to",
								window.toInstant().toString()));
			}
			catch (GitHubApiException e) {
				throw new UpstreamFailureException("Contribution summary failed for " + subject, e);
			}

			JsonNode collection = JsonNodeUtils.at(data, "user", "contributionsCollection");
			if (!collection.isObject()) {
				throw new SubjectNotFoundException(subject);
			}
			commits += JsonNodeUtils.getInt(collection, "totalCommitContributions");
			issues += JsonNodeUtils.getInt(collection, "totalIssueContributions");
			pullRequests += JsonNodeUtils.getInt(collection, "totalPullRequestContributions");
			reviews += JsonNodeUtils.getInt(collection, "totalPullRequestReviewContributions");
			restricted += JsonNodeUtils.getInt(collection, "restrictedContributionsCount");
			repositoriesContributed += JsonNodeUtils.getInt(collection, "totalRepositoriesWithContributedCommits")
					+ JsonNodeUtils.getInt(collection, "totalRepositoriesWithContributedPullRequests")
					+ JsonNodeUtils.getInt(collection, "totalRepositoriesWithContributedIssues");

			for (JsonNode contribution : JsonNodeUtils.getArray(collection, "commitContributionsByRepository")) {
				JsonNode repository = contribution.path("repository");
				Optional<String> nameWithOwner = JsonNodeUtils.getString(repository, "nameWithOwner");
				if (nameWithOwner.isEmpty()) {
					continue;
				}
				String key = nameWithOwner.get().toLowerCase(Locale.ROOT);
				if (repositories.containsKey(key)) {
					continue;
				}
				repositories.put(key,
						new RepositoryRef(JsonNodeUtils.getString(repository, "owner", "login").orElse(""),
								JsonNodeUtils.getString(repository, "name").orElse(""), nameWithOwner.get()));
				for (JsonNode edge : JsonNodeUtils.getArray(repository, "languages", "edges")) {
					JsonNodeUtils.getString(edge, "node", "name")
						.ifPresent(language -> builder.addLanguage(language, edge.path("size").asLong(0)));
				}
			}
		}

		builder.commits(commits)
			.issues(issues)
			.pullRequests(pullRequests)
			.reviews(reviews)
			.privateContributions(restricted)
			.repositoriesContributed(repositoriesContributed);
		logger.debug("Summary for {}: {} commits across {} repositories", subject, commits, repositories.size());
		return repositories;
	}

	private RepositoryHistory fetchHistory(RepositoryRef repository, String authorId, DateRange range) {
		Map<String, Object> variables = Map.of("owner", repository.owner(), "name", repository.name(), "authorId",
				authorId, "since", range.fromInstant().toString(), "until", range.toInstant().toString());
		List<Commit> commits = new ArrayList<>();
		boolean complete = true;
		try {
			Iterator<Page> iterator = pages
				.pages(ContributionQueries.COMMIT_HISTORY, variables, List.of("repository", "object", "history"))
				.iterator();
			Page last = null;
			while (iterator.hasNext()) {
				Page page = iterator.next();
				last = page;
				if (!page.present()) {
					logger.info("Commit history of {} is not reachable", repository.nameWithOwner());
					return RepositoryHistory.unavailable(repository.nameWithOwner());
				}
				for (JsonNode node : page.nodes()) {
					Optional<Commit> commit = toCommit(node, repository.nameWithOwner());
					if (commit.isPresent()) {
						commits.add(commit.get());
					}
					else {
						complete = false;
					}
				}
			}
			if (last != null && last.hasNextPage()) {
				logger.warn("Commit history of {} truncated at {} pages", repository.nameWithOwner(), last.number());
				complete = false;
			}
		}
		catch (GraphQLSemanticException | TransientNetworkException e) {
			logger.warn("Commit history of {} unavailable: {}", repository.nameWithOwner(), e.getMessage());
			return RepositoryHistory.unavailable(repository.nameWithOwner());
		}
		catch (GitHubApiException e) {
			throw new UpstreamFailureException("Commit history failed for " + repository.nameWithOwner(), e);
		}
		logger.debug("Found {} commits in {}", commits.size(), repository.nameWithOwner());
		return new RepositoryHistory(repository.nameWithOwner(), commits, complete);
	}

	private static Optional<Commit> toCommit(JsonNode node, String repository) {
		Optional<Integer> additions = JsonNodeUtils.getOptionalInt(node, "additions");
		Optional<Integer> deletions = JsonNodeUtils.getOptionalInt(node, "deletions");
		Optional<Instant> committedAt = JsonNodeUtils.getInstant(node, "committedDate");
		if (additions.isEmpty() || deletions.isEmpty() || committedAt.isEmpty() || additions.get() < 0
				|| deletions.get() < 0) {
			return Optional.empty();
		}
		return Optional.of(new Commit(JsonNodeUtils.getString(node, "oid").orElse(""), repository, committedAt.get(),
				additions.get(), deletions.get()));
	}

	/**
	 * Merged pull requests created within the range. Pages are ordered newest first, so
	 * paging stops at the first page reaching back before the range. Failures are logged
	 * and whatever was collected so far is returned.
	 */
	private List<PullRequest> fetchMergedPullRequests(String subject, DateRange range) {
		List<PullRequest> pullRequests = new ArrayList<>();
		Instant rangeStart = range.fromInstant();
		try {
			Iterator<Page> iterator = pages
				.pages(ContributionQueries.MERGED_PULL_REQUESTS, Map.of("login", subject),
						List.of("user", "pullRequests"))
				.iterator();
			boolean reachedStart = false;
			while (!reachedStart && iterator.hasNext()) {
				for (JsonNode node : iterator.next().nodes()) {
					Optional<Instant> createdAt = JsonNodeUtils.getInstant(node, "createdAt");
					if (createdAt.isEmpty()) {
						continue;
					}
					if (createdAt.get().isBefore(rangeStart)) {
						reachedStart = true;
					}
					else if (range.contains(createdAt.get())) {
						pullRequests.add(new PullRequest(JsonNodeUtils.getString(node, "id").orElse(""),
								JsonNodeUtils.getString(node, "baseRepository", "nameWithOwner").orElse(""),
								createdAt.get(), Math.max(0, JsonNodeUtils.getInt(node, "additions")),
								Math.max(0, JsonNodeUtils.getInt(node, "deletions"))));
					}
				}
			}
		}
		catch (GitHubApiException e) {
			logger.warn("Pull request estimate for {} incomplete after {} pull requests: {}", subject,
					pullRequests.size(), e.getMessage());
		}
		logger.debug("Found {} merged pull requests for {} in range", pullRequests.size(), subject);
		return pullRequests;
	}

	private static void report(ProgressSink progress, String message) {
		try {
			progress.report(message);
		}
		catch (RuntimeException e) {
			logger.warn("Progress sink failed: {}", e.getMessage());
		}
	}

	private static void validateSubject(String subject) {
		if (subject == null || subject.isBlank()) {
			throw new IllegalArgumentException("Subject must not be blank");
		}
	}

	private record Profile(String id, int followers, int following, int publicRepos, int starredRepos,
			int discussions) {
	}

	private record RepositoryRef(String owner, String name, String nameWithOwner) {
	}

}
