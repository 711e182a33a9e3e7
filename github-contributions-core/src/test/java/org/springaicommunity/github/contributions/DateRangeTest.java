package org.springaicommunity.github.contributions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DateRange Tests")
class DateRangeTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-15T18:30:00Z"), ZoneOffset.UTC);

	@Nested
	@DisplayName("Argument Parsing Tests")
	class ArgumentParsingTest {

		@Test
		@DisplayName("No arguments should give the trailing twelve months")
		void shouldDefaultToTrailingYear() {
			DateRange range = DateRange.fromArguments(List.of(), CLOCK);

			assertThat(range.kind()).isEqualTo(RangeKind.TRAILING_YEAR);
			assertThat(range.start()).isEqualTo(LocalDate.of(2023, 5, 16));
			assertThat(range.end()).isEqualTo(LocalDate.of(2024, 5, 15));
			assertThat(range.description()).isEqualTo("Last 12 months");
		}

		@Test
		@DisplayName("A year should give the whole calendar year")
		void shouldParseYear() {
			DateRange range = DateRange.fromArguments(List.of("2024"), CLOCK);

			assertThat(range).isEqualTo(DateRange.calendarYear(2024));
			assertThat(range.start()).isEqualTo(LocalDate.of(2024, 1, 1));
			assertThat(range.end()).isEqualTo(LocalDate.of(2024, 12, 31));
		}

		@Test
		@DisplayName("Two dates should give a custom range")
		void shouldParseDates() {
			DateRange range = DateRange.fromArguments(List.of("2024-01-01", "2024-03-31"), CLOCK);

			assertThat(range.kind()).isEqualTo(RangeKind.CUSTOM);
			assertThat(range.description()).isEqualTo("2024-01-01 to 2024-03-31");
		}

		@ParameterizedTest
		@ValueSource(strings = { "24", "twenty", "20245", "2024-01" })
		@DisplayName("Should reject values that are not 4-digit years")
		void shouldRejectInvalidYear(String year) {
			assertThatThrownBy(() -> DateRange.fromArguments(List.of(year), CLOCK))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("4-digit year");
		}

		@Test
		@DisplayName("Should reject malformed dates")
		void shouldRejectInvalidDate() {
			assertThatThrownBy(() -> DateRange.fromArguments(List.of("2024/01/01", "2024-02-01"), CLOCK))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("YYYY-MM-DD");
		}

		@Test
		@DisplayName("Should reject an end date before the start date")
		void shouldRejectReversedRange() {
			assertThatThrownBy(() -> DateRange.fromArguments(List.of("2024-03-01", "2024-02-01"), CLOCK))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@ParameterizedTest
	@CsvSource({ "2024-01-01T00:00:00Z, true", "2024-12-31T23:59:59Z, true", "2023-12-31T23:59:59Z, false",
			"2025-01-01T00:00:00Z, false" })
	@DisplayName("Calendar year should include both boundary days")
	void containsShouldBeInclusive(String instant, boolean expected) {
		assertThat(DateRange.calendarYear(2024).contains(Instant.parse(instant))).isEqualTo(expected);
	}

	@Nested
	@DisplayName("Window Tests")
	class WindowTest {

		@Test
		@DisplayName("A range of at most one year should be a single window")
		void shortRangeShouldBeOneWindow() {
			DateRange year = DateRange.calendarYear(2023);

			assertThat(year.windows()).containsExactly(year);
		}

		@Test
		@DisplayName("Longer ranges should split into consecutive windows")
		void longRangeShouldSplit() {
			DateRange range = DateRange.custom(LocalDate.of(2022, 3, 1), LocalDate.of(2024, 6, 30));

			List<DateRange> windows = range.windows();

			assertThat(windows).hasSize(3);
			assertThat(windows.get(0).end()).isEqualTo(LocalDate.of(2023, 2, 28));
			assertThat(windows.get(1).start()).isEqualTo(LocalDate.of(2023, 3, 1));
			assertThat(windows.get(2).end()).isEqualTo(LocalDate.of(2024, 6, 30));
		}

	}

	@Test
	@DisplayName("Cache key should be the year for calendar years and both dates otherwise")
	void cacheKeyShouldIdentifyRange() {
		assertThat(DateRange.calendarYear(2024).cacheKey()).isEqualTo("2024");
		assertThat(DateRange.custom(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)).cacheKey())
			.isEqualTo("2024-01-01_2024-12-31");
	}

}
