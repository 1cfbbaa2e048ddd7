package tech.gatekeeper.platform.cache;

/**
 * Snapshot of permission cache statistics.
 *
 * @param size      Approximate number of live entries
 * @param hits      Lookups served from the cache
 * @param misses    Lookups that found no live entry
 * @param evictions Entries removed by size or expiry
 * @param hitRate   hits / (hits + misses), 1.0 when there were no lookups
 */
public record PermissionCacheStats(long size, long hits, long misses, long evictions, double hitRate) {
}
