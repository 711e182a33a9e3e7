package org.springaicommunity.github.contributions;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the contributions analyzer.
 *
 * <p>
 * Grammar: {@code COMMAND [SUBJECT] [YEAR | START END] [OPTIONS]}. A positional argument
 * that looks like a year or an ISO date starts the range, so the subject may be omitted.
 */
public class ArgumentParser {

	private static final List<String> COMMANDS = List.of(ParsedConfiguration.ANALYZE, ParsedConfiguration.CACHED,
			ParsedConfiguration.ALL_TIME);

	private static final String LOGIN_PATTERN = "^[A-Za-z0-9](?:[A-Za-z0-9-]{0,38})$";

	private static final String RANGE_PATTERN = "^\\d{4}(-\\d{2}-\\d{2})?$";

	private final ContributionProperties defaultProperties;

	private final Clock clock;

	public ArgumentParser(ContributionProperties defaultProperties) {
		this(defaultProperties, Clock.systemUTC());
	}

	public ArgumentParser(ContributionProperties defaultProperties, Clock clock) {
		this.defaultProperties = defaultProperties;
		this.clock = clock;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--refresh":
					config.refresh = true;
					break;

				case "--no-cache":
					config.noCache = true;
					break;

				case "--cache-dir":
					config.cacheDirectory = Path.of(getRequiredValue(args, i, "cache-dir"));
					i++; // Skip next argument since we consumed it
					break;

				case "--timeout":
					String timeoutStr = getRequiredValue(args, i, "timeout");
					config.timeout = Duration.ofSeconds(parsePositive(timeoutStr, "timeout"));
					i++;
					break;

				case "--max-retries":
					String retriesStr = getRequiredValue(args, i, "max-retries");
					try {
						config.maxRetries = Integer.parseInt(retriesStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max retries '" + retriesStr + "': must be a non-negative integer");
					}
					if (config.maxRetries < 0) {
						throw new IllegalArgumentException("Max retries must not be negative: " + config.maxRetries);
					}
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (config.helpRequested) {
			return config;
		}

		assignPositional(config, positional);
		validateConfiguration(config);
		return config;
	}

	private void assignPositional(ParsedConfiguration config, List<String> positional) {
		if (positional.isEmpty()) {
			throw new IllegalArgumentException("Missing command: expected one of " + COMMANDS);
		}
		config.command = positional.get(0).toLowerCase();
		List<String> rest = positional.subList(1, positional.size());
		if (!rest.isEmpty() && !rest.get(0).matches(RANGE_PATTERN)) {
			config.subject = rest.get(0);
			rest = rest.subList(1, rest.size());
		}
		config.rangeArguments = new ArrayList<>(rest);
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-contributions COMMAND [SUBJECT] [YEAR | START END] [OPTIONS]\n");
		help.append("\n");
		help.append("Analyze a GitHub user's contributions over a date range.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    analyze                Compute statistics (served from the cache when available)\n");
		help.append("    cached                 Show a stored report without contacting GitHub\n");
		help.append("    alltime                Fold every year since ")
			.append(DateRange.EPOCH_YEAR)
			.append(" into one summary\n");
		help.append("\n");
		help.append("RANGE:\n");
		help.append("    (none)                 The last 12 months\n");
		help.append("    YEAR                   A calendar year, ")
			.append(DateRange.EPOCH_YEAR)
			.append(" to the current year\n");
		help.append("    START END              Explicit dates in YYYY-MM-DD format\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help             Show this help message\n");
		help.append("    -v, --verbose          Enable verbose logging\n");
		help.append("    --refresh              Ignore any cached report and query GitHub again\n");
		help.append("    --no-cache             Neither read nor write cached reports\n");
		help.append("    --cache-dir DIR        Directory for cached reports (default: ")
			.append(defaultProperties.getCacheDirectory() != null ? defaultProperties.getCacheDirectory() : "in memory")
			.append(")\n");
		help.append("    --timeout SECONDS      Deadline for one analysis (default: ")
			.append(defaultProperties.getAnalysisTimeout().toSeconds())
			.append(")\n");
		help.append("    --max-retries N        Retries per failed request (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("\n");
		help.append("If SUBJECT is omitted, the subject of your previous query is used.\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub personal access token (required)\n");
		help.append("    CONTRIBUTIONS_CACHE_DIR   Default cache directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-contributions analyze torvalds 2024\n");
		help.append("    github-contributions analyze octocat 2023-03-01 2024-02-29 --refresh\n");
		help.append("    github-contributions cached octocat 2024\n");
		help.append("    github-contributions alltime octocat --timeout 900\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private long parsePositive(String value, String optionName) {
		try {
			long parsed = Long.parseLong(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException(optionName + " must be positive: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + COMMANDS + ")");
		}

		if (config.subject != null && !config.subject.matches(LOGIN_PATTERN)) {
			errors.add("Invalid GitHub username: " + config.subject);
		}

		if (ParsedConfiguration.ALL_TIME.equals(config.command)) {
			if (!config.rangeArguments.isEmpty()) {
				errors.add("The alltime command does not take a date range");
			}
		}
		else if (errors.isEmpty()) {
			try {
				config.range = DateRange.fromArguments(config.rangeArguments, clock);
				validateYear(config.range, errors);
			}
			catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
			}
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private void validateYear(DateRange range, List<String> errors) {
		if (range.kind() != RangeKind.CALENDAR_YEAR) {
			return;
		}
		int year = range.start().getYear();
		int currentYear = Year.now(clock.withZone(ZoneOffset.UTC)).getValue();
		if (year < DateRange.EPOCH_YEAR || year > currentYear) {
			errors.add("Year must be between " + DateRange.EPOCH_YEAR + " and " + currentYear + " (got: " + year
					+ ")");
		}
	}

}
