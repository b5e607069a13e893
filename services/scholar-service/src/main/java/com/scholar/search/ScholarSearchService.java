package com.scholar.search;

import com.scholar.cache.CachedRanking;
import com.scholar.cache.QueryCacheService;
import com.scholar.cache.TtlCache;
import com.scholar.corpus.CorpusIndex;
import com.scholar.corpus.CorpusService;
import com.scholar.text.DocumentVector;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScholarSearchService {
    private static final Logger log = LoggerFactory.getLogger(ScholarSearchService.class);

    private final CorpusService corpusService;
    private final Ranker ranker;
    private final QueryCacheService queryCacheService;
    private final SearchProperties properties;

    public ScholarSearchService(
        CorpusService corpusService,
        Ranker ranker,
        QueryCacheService queryCacheService,
        SearchProperties properties
    ) {
        this.corpusService = corpusService;
        this.ranker = ranker;
        this.queryCacheService = queryCacheService;
        this.properties = properties;
    }

    /**
     * Ranks the corpus for {@code query} and returns one page. A blank query lists every publication. Page and
     * size are clamped rather than rejected; a page past the end is empty.
     */
    public SearchResult search(String query, Integer page, Integer size, String sortBy, String sortOrder) {
        long started = System.nanoTime();
        PageWindow window = PageWindow.of(page, size, properties.getDefaultSize(), properties.getMaxSize());
        SortField field = SortField.from(sortBy);
        SortOrder order = SortOrder.from(sortOrder);
        CorpusIndex index = corpusService.current();
        String normalized = QueryCacheService.normalize(query);
        boolean browse = normalized.isEmpty();

        List<RankedDocument> ranked;
        boolean fromCache = false;
        if (browse) {
            ranked = ranker.browse(index);
        } else {
            TtlCache.Lookup<CachedRanking> lookup = queryCacheService.get(
                normalized,
                index.getGeneration(),
                () -> rank(normalized, index)
            );
            ranked = lookup.value().results();
            fromCache = lookup.fromCache();
        }

        if (field != SortField.RELEVANCE) {
            ranked = new ArrayList<>(ranked);
            ranked.sort(RankingOrder.of(field, order, browse));
        }

        int total = ranked.size();
        SearchResult result = new SearchResult(
            window.slice(ranked),
            total,
            window.totalPages(total),
            window.page(),
            window.size(),
            fromCache,
            field,
            order
        );
        log.debug(
            "search q=\"{}\" total={} page={} size={} from_cache={} took_ms={}",
            normalized,
            total,
            window.page(),
            window.size(),
            fromCache,
            (System.nanoTime() - started) / 1_000_000L
        );
        return result;
    }

    /** Rebuilds the corpus index and drops every cached ranking. */
    public CorpusIndex reloadCorpus() {
        CorpusIndex rebuilt = corpusService.reload();
        queryCacheService.invalidateAll();
        return rebuilt;
    }

    public CorpusIndex currentIndex() {
        return corpusService.current();
    }

    public int cachedQueries() {
        return queryCacheService.size();
    }

    private CachedRanking rank(String normalized, CorpusIndex index) {
        DocumentVector queryVector = corpusService.getExtractor().vectorize(normalized, index.getVocabulary());
        return CachedRanking.of(normalized, index.getGeneration(), ranker.rank(queryVector, index));
    }
}
