package com.raditha.lazygraph.cache;

import java.time.LocalDate;

/**
 * Persisted node record.
 *
 * @param name unique node name
 * @param externalId optional external ID, may be null
 * @param neighborsCached whether the node's neighbor set has been written to the cache
 * @param creationDate the day the record was created
 */
public record CachedNode(String name, String externalId, boolean neighborsCached, LocalDate creationDate) {
}
