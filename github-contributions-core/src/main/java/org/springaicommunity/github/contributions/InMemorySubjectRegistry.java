package org.springaicommunity.github.contributions;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SubjectRegistry} held in memory.
 */
public class InMemorySubjectRegistry implements SubjectRegistry {

	private final Map<String, RememberedSubject> subjects = new ConcurrentHashMap<>();

	private final Clock clock;

	public InMemorySubjectRegistry() {
		this(Clock.systemUTC());
	}

	public InMemorySubjectRegistry(Clock clock) {
		this.clock = clock;
	}

	@Override
	public RememberedSubject remember(String callerId, String subject) {
		Instant now = clock.instant();
		return subjects.compute(callerId, (id, previous) -> new RememberedSubject(id, subject,
				previous != null ? previous.createdAt() : now, now));
	}

	@Override
	public Optional<RememberedSubject> lookup(String callerId) {
		return Optional.ofNullable(subjects.get(callerId));
	}

}
