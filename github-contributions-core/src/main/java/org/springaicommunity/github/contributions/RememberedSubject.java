package org.springaicommunity.github.contributions;

import java.time.Instant;

/**
 * The subject last analyzed on behalf of an external caller.
 *
 * @param callerId caller identity (a chat user id, an OS user name)
 * @param subject GitHub login
 * @param createdAt first time the caller was seen
 * @param lastQueryAt most recent analysis request
 */
public record RememberedSubject(String callerId, String subject, Instant createdAt, Instant lastQueryAt) {
}
