package org.springaicommunity.github.contributions;

/**
 * GraphQL documents issued during an analysis. Every document also selects
 * {@code rateLimit} so the tracker sees the budget after each call.
 */
final class ContributionQueries {

	private ContributionQueries() {
	}

	static final String PROFILE = """
			query($login: String!) {
			  user(login: $login) {
			    id
			    login
			    followers { totalCount }
			    following { totalCount }
			    repositories(ownerAffiliations: OWNER, privacy: PUBLIC) { totalCount }
			    starredRepositories { totalCount }
			    repositoryDiscussions { totalCount }
			  }
			  rateLimit { limit remaining resetAt used }
			}
			""";

	static final String CONTRIBUTION_SUMMARY = """
			query($login: String!, $from: DateTime!, $to: DateTime!) {
			  user(login: $login) {
			    contributionsCollection(from: $from, to: $to) {
			      totalCommitContributions
			      totalIssueContributions
			      totalPullRequestContributions
			      totalPullRequestReviewContributions
			      totalRepositoriesWithContributedCommits
			      totalRepositoriesWithContributedPullRequests
			      totalRepositoriesWithContributedIssues
			      restrictedContributionsCount
			      commitContributionsByRepository(maxRepositories: 100) {
			        repository {
			          name
			          nameWithOwner
			          owner { login }
			          languages(first: 10, orderBy: {field: SIZE, direction: DESC}) {
			            edges { size node { name } }
			          }
			        }
			      }
			    }
			  }
			  rateLimit { limit remaining resetAt used }
			}
			""";

	static final String COMMIT_HISTORY = """
			query($owner: String!, $name: String!, $authorId: ID!, $since: GitTimestamp!, $until: GitTimestamp!, $cursor: String) {
			  repository(owner: $owner, name: $name) {
			    object(expression: "HEAD") {
			      ... on Commit {
			        history(first: 100, since: $since, until: $until, author: {id: $authorId}, after: $cursor) {
			          pageInfo { hasNextPage endCursor }
			          nodes { oid committedDate additions deletions }
			        }
			      }
			    }
			  }
			  rateLimit { limit remaining resetAt used }
			}
			""";

	static final String MERGED_PULL_REQUESTS = """
			query($login: String!, $cursor: String) {
			  user(login: $login) {
			    pullRequests(first: 100, states: [MERGED], after: $cursor, orderBy: {field: CREATED_AT, direction: DESC}) {
			      pageInfo { hasNextPage endCursor }
			      nodes {
			        id
			        createdAt
			        additions
			        deletions
			        baseRepository { nameWithOwner }
			      }
			    }
			  }
			  rateLimit { limit remaining resetAt used }
			}
			""";

}
