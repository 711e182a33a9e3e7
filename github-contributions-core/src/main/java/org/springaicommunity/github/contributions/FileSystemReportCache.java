package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * File system implementation of {@link ReportCache}.
 *
 * <p>
 * Each report is one JSON document at {@code <directory>/reports/<subject>/<rangeKey>.json}.
 * Writes go to a temporary file in the same directory which is then moved over the
 * target, so readers never see a half-written document.
 */
public class FileSystemReportCache implements ReportCache {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemReportCache.class);

	private static final Pattern SAFE_SEGMENT = Pattern.compile("[a-z0-9][a-z0-9._-]*");

	private final Path reportsDirectory;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public FileSystemReportCache(Path directory, ObjectMapper objectMapper) {
		this(directory, objectMapper, Clock.systemUTC());
	}

	public FileSystemReportCache(Path directory, ObjectMapper objectMapper, Clock clock) {
		this.reportsDirectory = directory.resolve("reports");
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public Optional<CachedReport> get(String subject, String rangeKey) {
		Path file = reportFile(subject, rangeKey);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(file.toFile(), CachedReport.class));
		}
		catch (JsonProcessingException e) {
			logger.warn("Ignoring unreadable cached report {}: {}", file, e.getOriginalMessage());
			return Optional.empty();
		}
		catch (IOException e) {
			throw new ReportCacheException("Failed to read cached report " + file, e);
		}
	}

	@Override
	public CachedReport put(String subject, String rangeKey, ContributionStats stats) {
		Path file = reportFile(subject, rangeKey);
		String id = get(subject, rangeKey).map(CachedReport::id).orElseGet(() -> UUID.randomUUID().toString());
		CachedReport report = new CachedReport(id, stats, clock.instant());
		try {
			Files.createDirectories(file.getParent());
			Path temp = Files.createTempFile(file.getParent(), rangeKey, ".tmp");
			try {
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), report);
				moveIntoPlace(temp, file);
			}
			finally {
				Files.deleteIfExists(temp);
			}
		}
		catch (IOException e) {
			throw new ReportCacheException("Failed to write cached report " + file, e);
		}
		logger.debug("Cached report {} for {} ({})", id, subject, rangeKey);
		return report;
	}

	static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	Path reportFile(String subject, String rangeKey) {
		String normalized = ReportCache.normalizeSubject(subject);
		if (!SAFE_SEGMENT.matcher(normalized).matches()) {
			throw new IllegalArgumentException("Invalid subject for cache key: '" + subject + "'");
		}
		if (!SAFE_SEGMENT.matcher(rangeKey).matches()) {
			throw new IllegalArgumentException("Invalid range key: '" + rangeKey + "'");
		}
		return reportsDirectory.resolve(normalized).resolve(rangeKey + ".json");
	}

}
