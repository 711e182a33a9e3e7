package org.springaicommunity.github.contributions.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.contributions.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * GitHub Contributions CLI Application
 *
 * Plain Java command-line application that analyzes a GitHub user's contributions and
 * prints the statistics as JSON. Uses ContributionsBuilder for service wiring.
 *
 * Usage: java -jar github-contributions-cli.jar COMMAND [SUBJECT] [YEAR | START END]
 * [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication,
 * CONTRIBUTIONS_CACHE_DIR - directory for cached reports
 *
 * Examples: java -jar github-contributions-cli.jar analyze torvalds 2024 java -jar
 * github-contributions-cli.jar cached octocat 2024 java -jar github-contributions-cli.jar
 * alltime octocat --timeout 900
 */
public class GitHubContributionsCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubContributionsCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_NOT_FOUND = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.out, System.getProperty("user.name", "local"));
			if (exitCode != EXIT_OK) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Analysis failed: {}", e.getMessage());
			System.exit(EXIT_FAILURE);
		}
	}

	public static int run(String[] args, PrintStream out, String callerId) throws Exception {
		ContributionProperties properties = defaultProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		config.applyTo(properties);
		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config);

		ContributionsBuilder builder = ContributionsBuilder.create().properties(properties);
		if (config.noCache) {
			builder.noCache();
		}
		// stored reports can be read without credentials
		if (!ParsedConfiguration.CACHED.equals(config.command)) {
			argumentParser.validateEnvironment();
			builder.tokenFromEnv();
		}
		return execute(config, builder, out, callerId);
	}

	static int execute(ParsedConfiguration config, ContributionsBuilder builder, PrintStream out, String callerId)
			throws Exception {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		SubjectRegistry registry = builder.buildSubjectRegistry();

		Optional<String> subject = resolveSubject(config, registry, callerId);
		if (subject.isEmpty()) {
			logger.error("No subject given and none remembered for {}. Pass a GitHub username.", callerId);
			return EXIT_FAILURE;
		}

		ProgressSink progress = logger::info;
		try (DeadlineRunner deadline = new DeadlineRunner()) {
			switch (config.command) {
				case ParsedConfiguration.CACHED:
					return printCached(builder, subject.get(), config.range, objectMapper, out);
				case ParsedConfiguration.ALL_TIME:
					remember(registry, callerId, subject.get());
					AllTimeContributionService service = builder.buildAllTimeService();
					Optional<AllTimeStats> allTime = deadline.call(config.timeout,
							() -> service.allTime(subject.get(), progress));
					if (allTime.isEmpty()) {
						logger.warn("No contributions found for {}", subject.get());
						return EXIT_NOT_FOUND;
					}
					out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(allTime.get()));
					return EXIT_OK;
				default:
					remember(registry, callerId, subject.get());
					ContributionAggregator aggregator = builder.buildAggregator();
					DateRange range = config.range;
					ContributionStats stats = deadline.call(config.timeout,
							() -> config.refresh ? aggregator.refresh(subject.get(), range, progress)
									: aggregator.contributions(subject.get(), range, progress));
					out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(stats));
					return EXIT_OK;
			}
		}
		catch (SubjectNotFoundException e) {
			logger.error("User '{}' not found on GitHub", e.getSubject());
			return EXIT_NOT_FOUND;
		}
		catch (UpstreamFailureException e) {
			logger.error("{} ({})", e.userMessage(), e.getMessage());
			return EXIT_FAILURE;
		}
		catch (AnalysisTimeoutException e) {
			logger.error("{}. Try again later or raise --timeout.", e.getMessage());
			return EXIT_FAILURE;
		}
		catch (ReportCacheException e) {
			if (e.getComputedStats().isPresent()) {
				logger.warn("Report computed but not cached: {}", e.getMessage());
				out.println(objectMapper.writerWithDefaultPrettyPrinter()
					.writeValueAsString(e.getComputedStats().get()));
				return EXIT_OK;
			}
			logger.error("Cache failure: {}", e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static int printCached(ContributionsBuilder builder, String subject, DateRange range,
			ObjectMapper objectMapper, PrintStream out) throws Exception {
		ReportCache cache = builder.buildReportCache();
		if (cache == null) {
			logger.error("Caching is disabled; nothing to show");
			return EXIT_FAILURE;
		}
		Optional<CachedReport> report = cache.get(subject, range.cacheKey());
		if (report.isEmpty()) {
			logger.warn("No cached report for {} ({}). Run 'analyze' first.", subject, range.description());
			return EXIT_NOT_FOUND;
		}
		logger.info("Cached report {} from {}", report.get().id(), report.get().createdAt());
		out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report.get().stats()));
		return EXIT_OK;
	}

	private static Optional<String> resolveSubject(ParsedConfiguration config, SubjectRegistry registry,
			String callerId) {
		if (config.subject != null) {
			return Optional.of(config.subject);
		}
		Optional<String> remembered = registry.lookup(callerId).map(RememberedSubject::subject);
		remembered.ifPresent(subject -> logger.info("Using remembered subject {}", subject));
		return remembered;
	}

	private static void remember(SubjectRegistry registry, String callerId, String subject) {
		try {
			registry.remember(callerId, subject);
		}
		catch (ReportCacheException e) {
			logger.warn("Could not remember subject {}: {}", subject, e.getMessage());
		}
	}

	static ContributionProperties defaultProperties() {
		ContributionProperties properties = new ContributionProperties();
		String cacheDir = EnvironmentSupport.get(EnvironmentSupport.CACHE_DIR);
		if (cacheDir != null) {
			properties.setCacheDirectory(Path.of(cacheDir));
		}
		else {
			properties.setCacheDirectory(Path.of(System.getProperty("user.home"), ".github-contributions"));
		}
		return properties;
	}

	private static void enableDebugLogging() {
		org.slf4j.Logger root = LoggerFactory.getLogger("org.springaicommunity.github.contributions");
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Subject: {}", config.subject != null ? config.subject : "(remembered)");
		logger.info("  Range: {}", config.range != null ? config.range.description() : "(all years)");
		logger.info("  Refresh: {}", config.refresh);
		logger.info("  Cache: {}", config.noCache ? "disabled" : config.cacheDirectory);
		logger.info("  Timeout: {}s", config.timeout.toSeconds());
		logger.info("  Max retries: {}", config.maxRetries);
	}

}
