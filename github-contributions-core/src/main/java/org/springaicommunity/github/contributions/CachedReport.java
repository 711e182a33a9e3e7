package org.springaicommunity.github.contributions;

import java.time.Instant;

/**
 * A stored {@link ContributionStats} plus storage metadata. Never updated in place; a
 * later write for the same key supersedes it.
 *
 * @param id storage identifier, stable across superseding writes
 * @param stats the stored statistics
 * @param createdAt when this version was written
 */
public record CachedReport(String id, ContributionStats stats, Instant createdAt) {
}
