package com.scholar.cache;

import com.scholar.search.RankedDocument;
import java.util.List;

/** Full ranked list for one normalized query against one index generation. */
public record CachedRanking(String query, long generation, List<RankedDocument> results) {
    public CachedRanking {
        results = List.copyOf(results);
    }

    public static CachedRanking of(String query, long generation, List<RankedDocument> results) {
        return new CachedRanking(query, generation, results);
    }
}
