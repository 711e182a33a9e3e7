package org.springaicommunity.github.contributions;

import java.time.Instant;

/**
 * Pull request opened by the subject, used only for the line estimate fallback.
 *
 * @param id GraphQL node id
 * @param baseRepository base repository in "owner/name" format
 * @param createdAt creation time
 * @param additions lines added
 * @param deletions lines deleted
 */
public record PullRequest(String id, String baseRepository, Instant createdAt, int additions, int deletions) {

	public PullRequest {
		if (additions < 0 || deletions < 0) {
			throw new IllegalArgumentException("Pull request " + id + " has negative line counts");
		}
	}

}
