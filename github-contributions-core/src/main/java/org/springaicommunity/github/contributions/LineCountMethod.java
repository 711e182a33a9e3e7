package org.springaicommunity.github.contributions;

import java.util.Locale;

/**
 * How the line totals of a report were computed.
 */
public enum LineCountMethod {

	/** Summed from commit-level additions and deletions for every contributed repository. */
	EXACT,

	/** At least one repository's lines came from pull request totals. */
	ESTIMATED;

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

}
