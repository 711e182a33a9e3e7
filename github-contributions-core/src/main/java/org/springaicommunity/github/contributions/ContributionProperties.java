package org.springaicommunity.github.contributions;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for contribution analysis.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link ContributionsBuilder}.
 * Default values match GitHub's public GraphQL endpoint and its documented rate limits.
 * Command-line options override whatever is set here.
 */
public class ContributionProperties {

	/**
	 * GraphQL endpoint URL.
	 */
	private String endpoint = GitHubGraphQLTransport.GITHUB_GRAPHQL_ENDPOINT;

	/**
	 * Timeout for establishing an HTTP connection.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout for a single GraphQL request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(60);

	/**
	 * Maximum number of retry attempts for a failed request.
	 */
	private int maxRetries = 3;

	/**
	 * Backoff before the first retry.
	 */
	private Duration initialDelay = Duration.ofSeconds(1);

	/**
	 * Upper bound on a single backoff.
	 */
	private Duration maxDelay = Duration.ofSeconds(60);

	/**
	 * Smallest number of remaining requests kept in reserve.
	 */
	private int rateLimitMinimumFloor = 100;

	/**
	 * Share of the hourly limit kept in reserve.
	 */
	private double rateLimitReserveFraction = 0.10;

	/**
	 * Longest wait for a rate limit reset before giving up.
	 */
	private Duration maxRateLimitWait = Duration.ofHours(1);

	/**
	 * Ceiling on the number of pages fetched per connection.
	 */
	private int maxPages = PaginatingQueryRunner.DEFAULT_MAX_PAGES;

	/**
	 * Directory holding cached reports and the subject registry; null disables the
	 * file-system cache.
	 */
	@Nullable
	private Path cacheDirectory;

	/**
	 * Deadline for one complete analysis.
	 */
	private Duration analysisTimeout = Duration.ofMinutes(5);

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Returns the maximum number of retry attempts.
	 * @return the maximum retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum number of retry attempts.
	 * @param maxRetries the maximum retries, zero to disable retrying
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getInitialDelay() {
		return initialDelay;
	}

	public void setInitialDelay(Duration initialDelay) {
		this.initialDelay = initialDelay;
	}

	public Duration getMaxDelay() {
		return maxDelay;
	}

	public void setMaxDelay(Duration maxDelay) {
		this.maxDelay = maxDelay;
	}

	public int getRateLimitMinimumFloor() {
		return rateLimitMinimumFloor;
	}

	public void setRateLimitMinimumFloor(int rateLimitMinimumFloor) {
		this.rateLimitMinimumFloor = rateLimitMinimumFloor;
	}

	public double getRateLimitReserveFraction() {
		return rateLimitReserveFraction;
	}

	public void setRateLimitReserveFraction(double rateLimitReserveFraction) {
		this.rateLimitReserveFraction = rateLimitReserveFraction;
	}

	public Duration getMaxRateLimitWait() {
		return maxRateLimitWait;
	}

	public void setMaxRateLimitWait(Duration maxRateLimitWait) {
		this.maxRateLimitWait = maxRateLimitWait;
	}

	public int getMaxPages() {
		return maxPages;
	}

	public void setMaxPages(int maxPages) {
		this.maxPages = maxPages;
	}

	/**
	 * Returns the cache directory.
	 * @return the cache directory, or {@code null} when caching to disk is disabled
	 */
	public @Nullable Path getCacheDirectory() {
		return cacheDirectory;
	}

	public void setCacheDirectory(@Nullable Path cacheDirectory) {
		this.cacheDirectory = cacheDirectory;
	}

	public Duration getAnalysisTimeout() {
		return analysisTimeout;
	}

	public void setAnalysisTimeout(Duration analysisTimeout) {
		this.analysisTimeout = analysisTimeout;
	}

}
