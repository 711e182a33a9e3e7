package org.springaicommunity.github.contributions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LineStatsCalculator Tests")
class LineStatsCalculatorTest {

	private static final DateRange YEAR = DateRange.calendarYear(2024);

	private final LineStatsCalculator calculator = new LineStatsCalculator();

	private static Commit commit(String repo, String at, int additions, int deletions) {
		return new Commit("oid-" + at, repo, Instant.parse(at), additions, deletions);
	}

	private static PullRequest pullRequest(String repo, String at, int additions, int deletions) {
		return new PullRequest("PR-" + at, repo, Instant.parse(at), additions, deletions);
	}

	@Test
	@DisplayName("Should count exactly when every repository is covered")
	void shouldCountExactly() {
		List<RepositoryHistory> histories = List.of(
				new RepositoryHistory("a/one", List.of(commit("a/one", "2024-02-01T00:00:00Z", 10, 2)), true),
				new RepositoryHistory("a/two", List.of(commit("a/two", "2024-03-01T00:00:00Z", 5, 1),
						commit("a/two", "2023-12-31T23:00:00Z", 1000, 1000)), true));

		LineStats stats = calculator.calculate(histories, List.of(), YEAR);

		assertThat(stats).isEqualTo(new LineStats(15, 3, LineCountMethod.EXACT, 2));
		assertThat(calculator.requiresEstimate(histories)).isFalse();
	}

	@Test
	@DisplayName("No contributed repositories should be an exact zero")
	void noRepositoriesShouldBeExactZero() {
		assertThat(calculator.calculate(List.of(), List.of(), YEAR))
			.isEqualTo(new LineStats(0, 0, LineCountMethod.EXACT, 0));
	}

	@Nested
	@DisplayName("Estimate Tests")
	class EstimateTest {

		@Test
		@DisplayName("Should add pull requests only for uncovered repositories")
		void shouldEstimateUncoveredOnly() {
			List<RepositoryHistory> histories = List.of(
					new RepositoryHistory("a/covered", List.of(commit("a/covered", "2024-02-01T00:00:00Z", 10, 2)),
							true),
					RepositoryHistory.unavailable("B/Private"));
			List<PullRequest> pullRequests = List.of(pullRequest("b/private", "2024-04-01T00:00:00Z", 100, 20),
					pullRequest("a/covered", "2024-04-02T00:00:00Z", 999, 999),
					pullRequest("b/private", "2023-06-01T00:00:00Z", 999, 999));

			LineStats stats = calculator.calculate(histories, pullRequests, YEAR);

			assertThat(stats).isEqualTo(new LineStats(110, 22, LineCountMethod.ESTIMATED, 2));
		}

		@Test
		@DisplayName("With no coverage at all the totals should equal the in-range pull request sums")
		void zeroCoverageShouldUseAllPullRequests() {
			List<RepositoryHistory> histories = List.of(RepositoryHistory.unavailable("a/one"),
					new RepositoryHistory("a/two", List.of(), true));
			List<PullRequest> pullRequests = List.of(pullRequest("a/one", "2024-01-10T00:00:00Z", 40, 4),
					pullRequest("elsewhere/repo", "2024-11-10T00:00:00Z", 60, 6),
					pullRequest("a/one", "2025-01-01T00:00:00Z", 999, 999));

			LineStats stats = calculator.calculate(histories, pullRequests, YEAR);

			assertThat(stats.added()).isEqualTo(100);
			assertThat(stats.deleted()).isEqualTo(10);
			assertThat(stats.method()).isEqualTo(LineCountMethod.ESTIMATED);
			assertThat(stats.sourceCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("An incomplete history should not be counted as covered")
		void incompleteHistoryShouldRequireEstimate() {
			List<RepositoryHistory> histories = List.of(
					new RepositoryHistory("a/big", List.of(commit("a/big", "2024-02-01T00:00:00Z", 10, 2)), false));

			assertThat(calculator.requiresEstimate(histories)).isTrue();
			assertThat(calculator.calculate(histories, List.of(), YEAR).method())
				.isEqualTo(LineCountMethod.ESTIMATED);
		}

	}

}
