package org.springaicommunity.github.contributions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ArgumentParser}.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-15T00:00:00Z"), ZoneOffset.UTC);

	private ContributionProperties properties;

	private ArgumentParser parser;

	@BeforeEach
	void setUp() {
		properties = new ContributionProperties();
		parser = new ArgumentParser(properties, CLOCK);
	}

	@Nested
	@DisplayName("Positional Argument Tests")
	class PositionalTest {

		@Test
		@DisplayName("Should parse command, subject and year")
		void shouldParseYear() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "analyze", "torvalds", "2023" });

			assertThat(config.command).isEqualTo(ParsedConfiguration.ANALYZE);
			assertThat(config.subject).isEqualTo("torvalds");
			assertThat(config.range).isEqualTo(DateRange.calendarYear(2023));
		}

		@Test
		@DisplayName("Should parse an explicit date range")
		void shouldParseDates() {
			ParsedConfiguration config = parser
				.parseAndValidate(new String[] { "analyze", "octocat", "2024-01-01", "2024-03-31" });

			assertThat(config.range)
				.isEqualTo(DateRange.custom(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31)));
		}

		@Test
		@DisplayName("Should default to the trailing twelve months")
		void shouldDefaultToTrailingYear() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "analyze", "octocat" });

			assertThat(config.range.kind()).isEqualTo(RangeKind.TRAILING_YEAR);
			assertThat(config.range.end()).isEqualTo(LocalDate.of(2024, 5, 15));
		}

		@Test
		@DisplayName("A year right after the command should leave the subject unset")
		void shouldAllowMissingSubject() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "cached", "2024" });

			assertThat(config.subject).isNull();
			assertThat(config.range).isEqualTo(DateRange.calendarYear(2024));
		}

		@Test
		@DisplayName("Commands should be case-insensitive")
		void commandShouldIgnoreCase() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "AllTime", "octocat" });

			assertThat(config.command).isEqualTo(ParsedConfiguration.ALL_TIME);
			assertThat(config.range).isNull();
		}

	}

	@Nested
	@DisplayName("Option Tests")
	class OptionTest {

		@Test
		@DisplayName("Should parse every option")
		void shouldParseOptions() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "analyze", "octocat", "--refresh",
					"--cache-dir", "/tmp/reports", "--timeout", "90", "--max-retries", "0", "-v" });

			assertThat(config.refresh).isTrue();
			assertThat(config.verbose).isTrue();
			assertThat(config.cacheDirectory).isEqualTo(Path.of("/tmp/reports"));
			assertThat(config.timeout).isEqualTo(Duration.ofSeconds(90));
			assertThat(config.maxRetries).isZero();
		}

		@Test
		@DisplayName("Should carry the configuration into properties")
		void shouldApplyToProperties() {
			ParsedConfiguration config = parser.parseAndValidate(
					new String[] { "analyze", "octocat", "--cache-dir", "/tmp/reports", "--timeout", "30" });

			ContributionProperties applied = config.applyTo(new ContributionProperties());

			assertThat(applied.getCacheDirectory()).isEqualTo(Path.of("/tmp/reports"));
			assertThat(applied.getAnalysisTimeout()).isEqualTo(Duration.ofSeconds(30));
		}

		@Test
		@DisplayName("--no-cache should clear the cache directory")
		void noCacheShouldClearDirectory() {
			ParsedConfiguration config = parser
				.parseAndValidate(new String[] { "analyze", "octocat", "--cache-dir", "/tmp/reports", "--no-cache" });

			assertThat(config.applyTo(new ContributionProperties()).getCacheDirectory()).isNull();
		}

		@Test
		@DisplayName("Should use property defaults when options are absent")
		void shouldUseDefaults() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "analyze", "octocat" });

			assertThat(config.timeout).isEqualTo(properties.getAnalysisTimeout());
			assertThat(config.maxRetries).isEqualTo(properties.getMaxRetries());
		}

		@Test
		@DisplayName("Help should short-circuit validation")
		void helpShouldSkipValidation() {
			ParsedConfiguration config = parser.parseAndValidate(new String[] { "--help" });

			assertThat(config.helpRequested).isTrue();
			assertThat(parser.isHelpRequested(new String[] { "analyze", "-h" })).isTrue();
			assertThat(parser.generateHelpText()).startsWith("Usage: github-contributions COMMAND");
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should require a command")
		void shouldRequireCommand() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[0]))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing command");
		}

		@Test
		@DisplayName("Should reject unknown commands")
		void shouldRejectUnknownCommand() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "collect", "octocat" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown command: collect");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "analyze", "--zip" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --zip");
		}

		@ParameterizedTest
		@ValueSource(strings = { "-leading-dash", "under_score", "has.dot",
				"a-login-name-that-is-much-too-long-for-github" })
		@DisplayName("Should reject invalid usernames")
		void shouldRejectInvalidUsername(String login) {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "analyze", login, "2024" }))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@ParameterizedTest
		@ValueSource(strings = { "2007", "2025" })
		@DisplayName("Should reject years outside 2008 to the current year")
		void shouldRejectYearOutOfRange(String year) {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "analyze", "octocat", year }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Year must be between 2008 and 2024");
		}

		@Test
		@DisplayName("Should reject a reversed date range")
		void shouldRejectReversedRange() {
			assertThatThrownBy(() -> parser
				.parseAndValidate(new String[] { "analyze", "octocat", "2024-03-01", "2024-01-01" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must not be before");
		}

		@Test
		@DisplayName("alltime should not accept a range")
		void allTimeShouldRejectRange() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "alltime", "octocat", "2024" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("does not take a date range");
		}

		@Test
		@DisplayName("Should reject a non-positive timeout")
		void shouldRejectZeroTimeout() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "analyze", "octocat", "--timeout", "0" }))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject an option missing its value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> parser.parseAndValidate(new String[] { "analyze", "--cache-dir" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value for cache-dir");
		}

	}

}
