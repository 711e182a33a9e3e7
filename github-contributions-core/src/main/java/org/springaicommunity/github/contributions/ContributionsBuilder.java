package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builder wiring the analysis components together without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN, in-memory cache
 * ContributionAggregator aggregator = ContributionsBuilder.create()
 *     .tokenFromEnv()
 *     .buildAggregator();
 *
 * // Reports cached on disk, fewer retries
 * ContributionProperties props = new ContributionProperties();
 * props.setMaxRetries(1);
 * props.setCacheDirectory(Path.of(".contributions"));
 *
 * ContributionAggregator aggregator = ContributionsBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildAggregator();
 *
 * // For testing with a stubbed transport
 * GraphQLTransport transport = mock(GraphQLTransport.class);
 * ContributionAggregator testAggregator = ContributionsBuilder.create()
 *     .transport(transport)
 *     .noCache()
 *     .buildAggregator();
 * }
 * </pre>
 */
public class ContributionsBuilder {

	@Nullable
	private String token;

	private ContributionProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GraphQLTransport transport;

	@Nullable
	private ReportCache reportCache;

	private boolean cacheDisabled;

	private Clock clock = Clock.systemUTC();

	@Nullable
	private RateLimitTracker rateLimitTracker;

	private ContributionsBuilder() {
		this.properties = new ContributionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ContributionsBuilder
	 */
	public static ContributionsBuilder create() {
		return new ContributionsBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public ContributionsBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public ContributionsBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.require(EnvironmentSupport.GITHUB_TOKEN);
		return this;
	}

	/**
	 * Set analysis properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ContributionsBuilder properties(@Nullable ContributionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public ContributionsBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom transport. It is still wrapped with retries. When a custom transport is
	 * provided, the token is not required.
	 * @param transport custom transport (null to use the HTTP transport)
	 * @return this builder
	 */
	public ContributionsBuilder transport(@Nullable GraphQLTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Set a custom report cache. Overrides the cache directory property.
	 * @param reportCache cache implementation (null to use the default)
	 * @return this builder
	 */
	public ContributionsBuilder reportCache(@Nullable ReportCache reportCache) {
		this.reportCache = reportCache;
		return this;
	}

	/**
	 * Run every analysis against GitHub without reading or writing reports.
	 * @return this builder
	 */
	public ContributionsBuilder noCache() {
		this.cacheDisabled = true;
		return this;
	}

	public ContributionsBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Share a tracker between aggregators using the same token.
	 * @param rateLimitTracker tracker (null to create one)
	 * @return this builder
	 */
	public ContributionsBuilder rateLimitTracker(@Nullable RateLimitTracker rateLimitTracker) {
		this.rateLimitTracker = rateLimitTracker;
		return this;
	}

	public ContributionAggregator buildAggregator() {
		validateToken();
		return buildComponents().aggregator();
	}

	public AllTimeContributionService buildAllTimeService() {
		validateToken();
		return new AllTimeContributionService(buildComponents().aggregator(), clock);
	}

	/**
	 * Build the subject registry. File-backed when a cache directory is configured and the
	 * cache is not disabled, in memory otherwise.
	 * @return subject registry
	 */
	public SubjectRegistry buildSubjectRegistry() {
		Path directory = properties.getCacheDirectory();
		if (cacheDisabled || directory == null) {
			return new InMemorySubjectRegistry(clock);
		}
		return new FileSystemSubjectRegistry(directory, mapper(), clock);
	}

	/**
	 * Build the report cache on its own, for reading stored reports without a token.
	 * @return the cache, or {@code null} when caching is disabled
	 */
	public @Nullable ReportCache buildReportCache() {
		return resolveCache(mapper());
	}

	/**
	 * Build the retrying transport directly (for advanced usage).
	 * @return configured transport
	 */
	public GraphQLTransport buildTransport() {
		validateToken();
		return buildComponents().transport();
	}

	private void validateToken() {
		if (transport != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		RateLimitTracker tracker = this.rateLimitTracker != null ? this.rateLimitTracker
				: new RateLimitTracker(clock, properties.getRateLimitMinimumFloor(),
						properties.getRateLimitReserveFraction(), properties.getMaxRateLimitWait());
		GraphQLTransport base = this.transport != null ? this.transport
				: new GitHubGraphQLTransport(token, mapper, tracker, properties);

		GraphQLTransport retrying = RetryingGraphQLClient.builder()
			.wrapping(base)
			.rateLimitTracker(tracker)
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getInitialDelay())
			.maxDelay(properties.getMaxDelay())
			.clock(clock)
			.build();

		ContributionAggregator aggregator = new ContributionAggregator(retrying,
				new PaginatingQueryRunner(retrying, properties.getMaxPages()), resolveCache(mapper),
				new LineStatsCalculator(), clock);
		return new Components(retrying, aggregator);
	}

	private @Nullable ReportCache resolveCache(ObjectMapper mapper) {
		if (cacheDisabled) {
			return null;
		}
		if (reportCache != null) {
			return reportCache;
		}
		Path directory = properties.getCacheDirectory();
		return directory != null ? new FileSystemReportCache(directory, mapper, clock) : new InMemoryReportCache(clock);
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private record Components(GraphQLTransport transport, ContributionAggregator aggregator) {
	}

}
