package org.springaicommunity.github.contributions;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReportCache} held in a {@link ConcurrentHashMap}. Contents are lost when the
 * process exits.
 */
public class InMemoryReportCache implements ReportCache {

	private final Map<Key, CachedReport> reports = new ConcurrentHashMap<>();

	private final Clock clock;

	public InMemoryReportCache() {
		this(Clock.systemUTC());
	}

	public InMemoryReportCache(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Optional<CachedReport> get(String subject, String rangeKey) {
		return Optional.ofNullable(reports.get(new Key(ReportCache.normalizeSubject(subject), rangeKey)));
	}

	@Override
	public CachedReport put(String subject, String rangeKey, ContributionStats stats) {
		Key key = new Key(ReportCache.normalizeSubject(subject), rangeKey);
		return reports.compute(key, (k, previous) -> new CachedReport(
				previous != null ? previous.id() : UUID.randomUUID().toString(), stats, clock.instant()));
	}

	public int size() {
		return reports.size();
	}

	private record Key(String subject, String rangeKey) {
	}

}
