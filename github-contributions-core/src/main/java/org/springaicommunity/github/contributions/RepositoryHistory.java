package org.springaicommunity.github.contributions;

import java.util.List;

/**
 * The subject's commits in one contributed repository.
 *
 * @param repository repository in "owner/name" format
 * @param commits commits found, in history order
 * @param complete whether the history was reachable, fully paged and every commit reported
 * its line counts
 */
public record RepositoryHistory(String repository, List<Commit> commits, boolean complete) {

	public RepositoryHistory {
		commits = List.copyOf(commits);
	}

	public static RepositoryHistory unavailable(String repository) {
		return new RepositoryHistory(repository, List.of(), false);
	}

	/**
	 * A repository is covered when its commit lines can be counted exactly.
	 * @return true if complete with at least one commit
	 */
	public boolean covered() {
		return complete && !commits.isEmpty();
	}

}
