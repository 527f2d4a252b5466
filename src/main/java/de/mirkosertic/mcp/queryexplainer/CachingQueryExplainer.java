package de.mirkosertic.mcp.queryexplainer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caching wrapper around a {@link QueryExplainer}, keyed on the raw query string.
 *
 * <p>Explaining is a pure function of the query string, so a cached {@link QueryResult} is
 * returned as is. Queries that fail are not cached and fail again on every call.</p>
 *
 * <p>Cache characteristics:</p>
 * <ul>
 *   <li>Bounded by a configurable maximum number of entries</li>
 *   <li>Eviction policy: Caffeine's size based eviction (Window TinyLFU)</li>
 *   <li>Thread-safe, may be called concurrently</li>
 *   <li>Hits, misses and evictions are tracked in {@link ExplainCacheStats}</li>
 * </ul>
 *
 * <p>Concurrent first requests for the same query run the delegate once and count a single miss.
 * The other callers wait for that result and count as hits.</p>
 */
public class CachingQueryExplainer implements QueryExplainer {

    private final QueryExplainer delegate;
    private final Cache<String, QueryResult> cache;
    private final ExplainCacheStats stats;

    public CachingQueryExplainer(final QueryExplainer delegate, final long maximumSize, final ExplainCacheStats stats) {
        this.delegate = delegate;
        this.stats = stats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .evictionListener((String key, QueryResult value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    @Override
    public QueryResult parse(final String query) throws QuerySyntaxException {
        if (query == null) {
            stats.recordMiss();
            return delegate.parse(null);
        }

        final AtomicBoolean loaded = new AtomicBoolean();
        final QueryResult result;
        try {
            result = cache.get(query, key -> {
                loaded.set(true);
                stats.recordMiss();
                try {
                    return delegate.parse(key);
                } catch (final QuerySyntaxException e) {
                    throw new LoadFailure(e);
                }
            });
        } catch (final LoadFailure e) {
            throw e.syntaxException;
        }

        if (loaded.get()) {
            stats.setCurrentSize(cache.estimatedSize());
        } else {
            stats.recordHit();
        }
        return result;
    }

    /**
     * Carries the checked exception out of the loading function. Caffeine leaves no mapping behind.
     */
    private static final class LoadFailure extends RuntimeException {

        private final QuerySyntaxException syntaxException;

        LoadFailure(final QuerySyntaxException syntaxException) {
            super(syntaxException.getMessage(), syntaxException, false, false);
            this.syntaxException = syntaxException;
        }
    }

    public ExplainCacheStats getStats() {
        return stats;
    }
}
