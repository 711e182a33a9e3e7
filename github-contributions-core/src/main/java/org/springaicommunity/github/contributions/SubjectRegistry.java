package org.springaicommunity.github.contributions;

import java.util.Optional;

/**
 * Remembers which subject an external caller last asked about, so later requests can omit
 * it. Not consulted by aggregation itself.
 */
public interface SubjectRegistry {

	/**
	 * Record that {@code callerId} asked about {@code subject}. The first-seen time of an
	 * existing caller is kept; the subject and last query time are replaced.
	 * @param callerId external caller identity
	 * @param subject GitHub login
	 * @return the stored entry
	 */
	RememberedSubject remember(String callerId, String subject);

	/**
	 * Look up the caller's remembered subject.
	 * @param callerId external caller identity
	 * @return the remembered subject, or empty if the caller is unknown
	 */
	Optional<RememberedSubject> lookup(String callerId);

}
