package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import de.mirkosertic.mcp.queryexplainer.ExplainCacheStats;

/**
 * Response DTO for the getServerInfo tool. Cache metrics are null when caching is disabled.
 */
public record ServerInfoResponse(
        boolean success,
        String status,
        String version,
        String buildTimestamp,
        CacheMetrics cache,
        String error
) {
    public record CacheMetrics(
            long maximumSize,
            long currentSize,
            long totalRequests,
            long hits,
            long misses,
            long evictions,
            double hitRate
    ) {
        public static CacheMetrics from(final long maximumSize, final ExplainCacheStats stats) {
            return new CacheMetrics(maximumSize, stats.getCurrentSize(), stats.getTotalRequests(),
                    stats.getCacheHits(), stats.getCacheMisses(), stats.getEvictions(), stats.getHitRate());
        }
    }

    public static ServerInfoResponse success(final String version, final String buildTimestamp,
                                             final CacheMetrics cache) {
        return new ServerInfoResponse(true, "ok", version, buildTimestamp, cache, null);
    }

    public static ServerInfoResponse error(final String errorMessage) {
        return new ServerInfoResponse(false, null, null, null, null, errorMessage);
    }
}
