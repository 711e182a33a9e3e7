package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SubjectRegistry} stored as a single JSON document keyed by caller id. Access is
 * serialized within the process and every write replaces the document atomically.
 */
public class FileSystemSubjectRegistry implements SubjectRegistry {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemSubjectRegistry.class);

	private static final TypeReference<LinkedHashMap<String, RememberedSubject>> DOCUMENT_TYPE = new TypeReference<>() {
	};

	private final Path file;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final Object lock = new Object();

	public FileSystemSubjectRegistry(Path directory, ObjectMapper objectMapper) {
		this(directory, objectMapper, Clock.systemUTC());
	}

	public FileSystemSubjectRegistry(Path directory, ObjectMapper objectMapper, Clock clock) {
		this.file = directory.resolve("subjects.json");
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public RememberedSubject remember(String callerId, String subject) {
		synchronized (lock) {
			Map<String, RememberedSubject> subjects = read();
			Instant now = clock.instant();
			RememberedSubject previous = subjects.get(callerId);
			RememberedSubject entry = new RememberedSubject(callerId, subject,
					previous != null ? previous.createdAt() : now, now);
			subjects.put(callerId, entry);
			write(subjects);
			logger.debug("Remembered subject {} for caller {}", subject, callerId);
			return entry;
		}
	}

	@Override
	public Optional<RememberedSubject> lookup(String callerId) {
		synchronized (lock) {
			return Optional.ofNullable(read().get(callerId));
		}
	}

	private Map<String, RememberedSubject> read() {
		if (!Files.exists(file)) {
			return new LinkedHashMap<>();
		}
		try {
			return objectMapper.readValue(file.toFile(), DOCUMENT_TYPE);
		}
		catch (IOException e) {
			throw new ReportCacheException("Failed to read subject registry " + file, e);
		}
	}

	private void write(Map<String, RememberedSubject> subjects) {
		try {
			Files.createDirectories(file.getParent());
			Path temp = Files.createTempFile(file.getParent(), "subjects", ".tmp");
			try {
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), subjects);
				FileSystemReportCache.moveIntoPlace(temp, file);
			}
			finally {
				Files.deleteIfExists(temp);
			}
		}
		catch (IOException e) {
			throw new ReportCacheException("Failed to write subject registry " + file, e);
		}
	}

}
