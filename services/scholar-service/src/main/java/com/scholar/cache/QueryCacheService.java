package com.scholar.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Memoizes full ranked lists per normalized query. Page, size and sort are not part of the key; callers
 * slice and re-sort the cached list themselves.
 */
@Service
public class QueryCacheService {
    private static final Logger log = LoggerFactory.getLogger(QueryCacheService.class);

    private final QueryCacheProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final TtlCache<CachedRanking> cache;

    @Autowired
    public QueryCacheService(QueryCacheProperties properties, MeterRegistry meterRegistry) {
        this(properties, meterRegistry, Clock.systemUTC());
    }

    public QueryCacheService(QueryCacheProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.cache = new TtlCache<>(properties.getMaxEntries(), clock);
    }

    public TtlCache.Lookup<CachedRanking> get(String query, long generation, Supplier<CachedRanking> ranker) {
        if (!properties.isEnabled()) {
            return new TtlCache.Lookup<>(ranker.get(), TtlCache.Source.LOADED, clock.millis());
        }
        String key = keyFor(query, generation);
        TtlCache.Lookup<CachedRanking> lookup = cache.getOrLoad(key, properties.getTtlMs(), ranker);
        switch (lookup.source()) {
            case HIT -> meterRegistry.counter("scholar_search_cache_hit_total").increment();
            case JOINED -> meterRegistry.counter("scholar_search_cache_join_total").increment();
            default -> meterRegistry.counter("scholar_search_cache_miss_total").increment();
        }
        log.debug("query cache {} key={}", lookup.source().name().toLowerCase(Locale.ROOT), key);
        return lookup;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public int size() {
        return cache.size();
    }

    /**
     * Trimmed, case-folded query text under the index generation it was ranked against, so a rebuilt index
     * never serves rankings from the previous one.
     */
    public String keyFor(String query, long generation) {
        String prefix = properties.getKeyPrefix() == null ? "" : properties.getKeyPrefix();
        return prefix + generation + ":" + normalize(query);
    }

    public static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}
