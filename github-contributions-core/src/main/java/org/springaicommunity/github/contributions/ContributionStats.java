package org.springaicommunity.github.contributions;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Consolidated contribution statistics for one subject over one {@link DateRange}.
 *
 * <p>
 * Instances are immutable. The language map is copied on construction and holds byte
 * counts per language name.
 */
public record ContributionStats(String subject, DateRange range, int commits, int pullRequests, int issues,
		int discussions, int reviews, int repositoriesContributed, int starredRepos, int followers, int following,
		int publicRepos, int privateContributions, Map<String, Long> languages, long linesAdded, long linesDeleted,
		LineCountMethod lineMethod, Instant generatedAt) {

	public ContributionStats {
		Objects.requireNonNull(subject, "subject");
		Objects.requireNonNull(range, "range");
		Objects.requireNonNull(lineMethod, "lineMethod");
		Objects.requireNonNull(generatedAt, "generatedAt");
		languages = languages != null ? Map.copyOf(languages) : Map.of();
		if (linesAdded < 0 || linesDeleted < 0) {
			throw new IllegalArgumentException("Line totals must be non-negative");
		}
	}

	public static Builder builder(String subject, DateRange range) {
		return new Builder(subject, range);
	}

	/**
	 * Mutable builder used while aggregating; the built record is immutable.
	 */
	public static final class Builder {

		private final String subject;

		private final DateRange range;

		private int commits;

		private int pullRequests;

		private int issues;

		private int discussions;

		private int reviews;

		private int repositoriesContributed;

		private int starredRepos;

		private int followers;

		private int following;

		private int publicRepos;

		private int privateContributions;

		private final Map<String, Long> languages = new LinkedHashMap<>();

		private long linesAdded;

		private long linesDeleted;

		private LineCountMethod lineMethod = LineCountMethod.EXACT;

		private Instant generatedAt = Instant.EPOCH;

		private Builder(String subject, DateRange range) {
			this.subject = subject;
			this.range = range;
		}

		public Builder commits(int commits) {
			this.commits = commits;
			return this;
		}

		public Builder pullRequests(int pullRequests) {
			this.pullRequests = pullRequests;
			return this;
		}

		public Builder issues(int issues) {
			this.issues = issues;
			return this;
		}

		public Builder discussions(int discussions) {
			this.discussions = discussions;
			return this;
		}

		public Builder reviews(int reviews) {
			this.reviews = reviews;
			return this;
		}

		public Builder repositoriesContributed(int repositoriesContributed) {
			this.repositoriesContributed = repositoriesContributed;
			return this;
		}

		public Builder starredRepos(int starredRepos) {
			this.starredRepos = starredRepos;
			return this;
		}

		public Builder followers(int followers) {
			this.followers = followers;
			return this;
		}

		public Builder following(int following) {
			this.following = following;
			return this;
		}

		public Builder publicRepos(int publicRepos) {
			this.publicRepos = publicRepos;
			return this;
		}

		public Builder privateContributions(int privateContributions) {
			this.privateContributions = privateContributions;
			return this;
		}

		/**
		 * Add bytes for a language, summing with any bytes already recorded.
		 * @param language language name
		 * @param bytes byte count
		 * @return this builder
		 */
		public Builder addLanguage(String language, long bytes) {
			this.languages.merge(language, bytes, Long::sum);
			return this;
		}

		public Builder languages(Map<String, Long> languages) {
			this.languages.clear();
			this.languages.putAll(languages);
			return this;
		}

		public Builder lines(LineStats lines) {
			this.linesAdded = lines.added();
			this.linesDeleted = lines.deleted();
			this.lineMethod = lines.method();
			return this;
		}

		public Builder lines(long added, long deleted, LineCountMethod method) {
			this.linesAdded = added;
			this.linesDeleted = deleted;
			this.lineMethod = method;
			return this;
		}

		public Builder generatedAt(Instant generatedAt) {
			this.generatedAt = generatedAt;
			return this;
		}

		public ContributionStats build() {
			return new ContributionStats(subject, range, commits, pullRequests, issues, discussions, reviews,
					repositoriesContributed, starredRepos, followers, following, publicRepos, privateContributions,
					languages, linesAdded, linesDeleted, lineMethod, generatedAt);
		}

	}

}
