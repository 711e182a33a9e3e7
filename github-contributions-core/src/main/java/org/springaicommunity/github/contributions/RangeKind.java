package org.springaicommunity.github.contributions;

/**
 * How a {@link DateRange} was constructed.
 */
public enum RangeKind {

	TRAILING_YEAR, CALENDAR_YEAR, CUSTOM

}
