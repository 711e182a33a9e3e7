package org.springaicommunity.github.contributions;

import java.time.Instant;

/**
 * Commit authored by the subject, used only while computing line totals.
 *
 * @param id commit oid
 * @param repository repository in "owner/name" format
 * @param committedAt commit timestamp
 * @param additions lines added
 * @param deletions lines deleted
 */
public record Commit(String id, String repository, Instant committedAt, int additions, int deletions) {

	public Commit {
		if (additions < 0 || deletions < 0) {
			throw new IllegalArgumentException("Commit " + id + " has negative line counts");
		}
	}

}
