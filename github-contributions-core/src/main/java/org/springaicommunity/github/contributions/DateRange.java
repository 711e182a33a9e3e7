package org.springaicommunity.github.contributions;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of days analyzed for one subject.
 *
 * <p>
 * Days are interpreted in UTC: the range covers {@code start 00:00:00Z} through
 * {@code end 23:59:59Z}.
 *
 * @param start first day (inclusive)
 * @param end last day (inclusive), never before {@code start}
 * @param kind how the range was built
 */
public record DateRange(LocalDate start, LocalDate end, RangeKind kind) {

	/**
	 * First year with GitHub activity.
	 */
	public static final int EPOCH_YEAR = 2008;

	public DateRange {
		Objects.requireNonNull(start, "start");
		Objects.requireNonNull(end, "end");
		Objects.requireNonNull(kind, "kind");
		if (end.isBefore(start)) {
			throw new IllegalArgumentException("End date " + end + " must not be before start date " + start);
		}
	}

	/**
	 * The twelve months ending today (inclusive).
	 * @param clock clock supplying "today" in UTC
	 * @return trailing range
	 */
	public static DateRange trailingYear(Clock clock) {
		LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
		return new DateRange(today.minusYears(1).plusDays(1), today, RangeKind.TRAILING_YEAR);
	}

	/**
	 * January 1st through December 31st of {@code year}.
	 * @param year calendar year
	 * @return calendar year range
	 */
	public static DateRange calendarYear(int year) {
		return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31), RangeKind.CALENDAR_YEAR);
	}

	/**
	 * An explicit range.
	 * @param start first day
	 * @param end last day
	 * @return custom range
	 * @throws IllegalArgumentException if {@code end} is before {@code start}
	 */
	public static DateRange custom(LocalDate start, LocalDate end) {
		return new DateRange(start, end, RangeKind.CUSTOM);
	}

	/**
	 * Parse the command-level range arguments: none for the trailing twelve months, a
	 * four-digit year, or two ISO dates ({@code YYYY-MM-DD}).
	 * @param args range arguments
	 * @param clock clock used for the trailing range
	 * @return parsed range
	 * @throws IllegalArgumentException if the arguments match none of the forms
	 */
	public static DateRange fromArguments(List<String> args, Clock clock) {
		switch (args.size()) {
			case 0:
				return trailingYear(clock);
			case 1:
				String year = args.get(0).trim();
				if (!year.matches("\\d{4}")) {
					throw new IllegalArgumentException("Invalid year '" + year + "': must be a 4-digit year");
				}
				return calendarYear(Integer.parseInt(year));
			case 2:
				return custom(parseDate(args.get(0)), parseDate(args.get(1)));
			default:
				throw new IllegalArgumentException(
						"Expected no range, a year, or a start and end date (got " + args.size() + " arguments)");
		}
	}

	private static LocalDate parseDate(String value) {
		try {
			return LocalDate.parse(value.trim());
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format", e);
		}
	}

	/**
	 * First instant of the range.
	 * @return {@code start} at midnight UTC
	 */
	public Instant fromInstant() {
		return start.atStartOfDay(ZoneOffset.UTC).toInstant();
	}

	/**
	 * Last second of the range.
	 * @return {@code end} at 23:59:59 UTC
	 */
	public Instant toInstant() {
		return end.atTime(LocalTime.of(23, 59, 59)).toInstant(ZoneOffset.UTC);
	}

	public boolean contains(Instant instant) {
		return !instant.isBefore(fromInstant()) && !instant.isAfter(toInstant());
	}

	/**
	 * Split into consecutive sub-ranges of at most one year each. GitHub rejects
	 * contribution queries spanning more than a year.
	 * @return windows covering this range in order
	 */
	public List<DateRange> windows() {
		if (end.isBefore(start.plusYears(1))) {
			return List.of(this);
		}
		List<DateRange> windows = new ArrayList<>();
		LocalDate cursor = start;
		while (!cursor.isAfter(end)) {
			LocalDate windowEnd = cursor.plusYears(1).minusDays(1);
			if (windowEnd.isAfter(end)) {
				windowEnd = end;
			}
			windows.add(custom(cursor, windowEnd));
			cursor = windowEnd.plusDays(1);
		}
		return windows;
	}

	/**
	 * Discriminator used by {@link ReportCache}: the year for calendar years,
	 * {@code start_end} otherwise.
	 * @return cache key for this range
	 */
	public String cacheKey() {
		if (kind == RangeKind.CALENDAR_YEAR) {
			return String.valueOf(start.getYear());
		}
		return start + "_" + end;
	}

	public String description() {
		return switch (kind) {
			case CALENDAR_YEAR -> String.valueOf(start.getYear());
			case TRAILING_YEAR -> "Last 12 months";
			case CUSTOM -> start + " to " + end;
		};
	}

}
