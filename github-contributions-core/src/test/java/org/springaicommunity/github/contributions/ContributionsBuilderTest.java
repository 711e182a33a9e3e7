package org.springaicommunity.github.contributions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ContributionsBuilder Tests")
class ContributionsBuilderTest {

	@TempDir
	Path tempDir;

	private ContributionProperties propertiesWithCache() {
		ContributionProperties properties = new ContributionProperties();
		properties.setCacheDirectory(tempDir);
		return properties;
	}

	@Test
	@DisplayName("Should require a token when no transport is given")
	void shouldRequireToken() {
		assertThatThrownBy(() -> ContributionsBuilder.create().buildAggregator())
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("token");
	}

	@Test
	@DisplayName("Should build with a token and no network access")
	void shouldBuildWithToken() {
		assertThat(ContributionsBuilder.create().token("ghp_test").buildTransport())
			.isInstanceOf(RetryingGraphQLClient.class);
	}

	@Test
	@DisplayName("A custom transport should be wrapped and used")
	void shouldUseCustomTransport() {
		FakeGitHub github = new FakeGitHub().user("octocat", 1, 1, 1, 1, 0).summary(2024, 3, 0, 0, 0, 0);

		ContributionStats stats = ContributionsBuilder.create()
			.transport(github)
			.noCache()
			.buildAggregator()
			.contributions("octocat", DateRange.calendarYear(2024));

		assertThat(stats.commits()).isEqualTo(3);
		assertThat(github.callsOf("summary")).isEqualTo(1);
	}

	@Nested
	@DisplayName("Cache Resolution Tests")
	class CacheResolutionTest {

		@Test
		@DisplayName("A cache directory should give file-backed storage")
		void directoryShouldGiveFileSystemCache() {
			ContributionsBuilder builder = ContributionsBuilder.create().properties(propertiesWithCache());

			assertThat(builder.buildReportCache()).isInstanceOf(FileSystemReportCache.class);
			assertThat(builder.buildSubjectRegistry()).isInstanceOf(FileSystemSubjectRegistry.class);
		}

		@Test
		@DisplayName("No cache directory should give in-memory storage")
		void noDirectoryShouldGiveInMemoryCache() {
			ContributionsBuilder builder = ContributionsBuilder.create();

			assertThat(builder.buildReportCache()).isInstanceOf(InMemoryReportCache.class);
			assertThat(builder.buildSubjectRegistry()).isInstanceOf(InMemorySubjectRegistry.class);
		}

		@Test
		@DisplayName("Disabling the cache should give no report cache")
		void noCacheShouldDisableReports() {
			ContributionsBuilder builder = ContributionsBuilder.create().properties(propertiesWithCache()).noCache();

			assertThat(builder.buildReportCache()).isNull();
			assertThat(builder.buildSubjectRegistry()).isInstanceOf(InMemorySubjectRegistry.class);
		}

		@Test
		@DisplayName("A custom cache should take precedence over the directory")
		void customCacheShouldWin() {
			InMemoryReportCache custom = new InMemoryReportCache();

			ReportCache resolved = ContributionsBuilder.create()
				.properties(propertiesWithCache())
				.reportCache(custom)
				.buildReportCache();

			assertThat(resolved).isSameAs(custom);
		}

	}

}
