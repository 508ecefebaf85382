package com.clapgrow.summary.common.cache;

import java.time.Instant;

/**
 * Cached value with the instant it was recorded. Never mutated after creation.
 */
public record CacheEntry<V>(V value, Instant recordedAt) {
}
