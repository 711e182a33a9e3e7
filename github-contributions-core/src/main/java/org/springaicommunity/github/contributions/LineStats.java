package org.springaicommunity.github.contributions;

/**
 * Result of the line-change calculation.
 *
 * @param added lines added
 * @param deleted lines deleted
 * @param method exact or estimated
 * @param sourceCount number of commits and pull requests the totals were derived from
 */
public record LineStats(long added, long deleted, LineCountMethod method, int sourceCount) {

	public LineStats {
		if (added < 0 || deleted < 0 || sourceCount < 0) {
			throw new IllegalArgumentException("Line statistics must be non-negative");
		}
	}

}
