package com.scholar.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import com.scholar.cache.QueryCacheProperties;
import com.scholar.cache.QueryCacheService;
import com.scholar.corpus.CorpusLoader;
import com.scholar.corpus.CorpusProperties;
import com.scholar.corpus.CorpusService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScholarSearchServiceTest {

    @Mock
    private CorpusLoader loader;

    private SimpleMeterRegistry meterRegistry;
    private ScholarSearchService service;

    @BeforeEach
    void setUp() {
        when(loader.load()).thenReturn(List.of(
            RankerTest.publication("Machine Learning in Healthcare", "https://example.org/1", "2023-03-14",
                "machine learning for clinical decision support"),
            RankerTest.publication("Learning Analytics in Schools", "https://example.org/2", "2019-05-01",
                "student learning outcomes"),
            RankerTest.publication("Reinforcement Learning for Traffic", "https://example.org/3", "2022-06-18",
                "agents learn signal timing"),
            RankerTest.publication("Supply Chain Resilience", "https://example.org/4", "2021-07-19",
                "manufacturing firms and logistics"),
            RankerTest.publication("Electoral Systems and Turnout", "https://example.org/5", "2020-01-10",
                "voters and party competition")
        ));
        CorpusService corpusService = new CorpusService(loader, new CorpusProperties());
        corpusService.init();

        SearchProperties searchProperties = new SearchProperties();
        meterRegistry = new SimpleMeterRegistry();
        QueryCacheService cache = new QueryCacheService(new QueryCacheProperties(), meterRegistry);
        service = new ScholarSearchService(corpusService, new Ranker(searchProperties), cache, searchProperties);
    }

    @Test
    void emptyQueryBrowsesWholeCorpus() {
        SearchResult result = service.search("  ", null, null, null, null);

        assertEquals(5, result.total());
        assertEquals(1, result.totalPages());
        assertEquals("Machine Learning in Healthcare", result.results().get(0).record().title());
        assertFalse(result.fromCache());
        assertEquals(0, service.cachedQueries());
    }

    @Test
    void repeatedQueryIsServedFromCache() {
        SearchResult first = service.search("Machine Learning", 1, 10, null, null);
        SearchResult second = service.search("  machine learning ", 1, 10, null, null);

        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(first.total(), second.total());
        assertEquals(1.0, meterRegistry.counter("scholar_search_cache_miss_total").count());
        assertEquals(1.0, meterRegistry.counter("scholar_search_cache_hit_total").count());
    }

    @Test
    void pagingSlicesOneRankedList() {
        SearchResult page1 = service.search("learning", 1, 2, null, null);
        SearchResult page2 = service.search("learning", 2, 2, null, null);
        SearchResult beyond = service.search("learning", 9, 2, null, null);

        assertEquals(3, page1.total());
        assertEquals(2, page1.totalPages());
        assertEquals(2, page1.results().size());
        assertEquals(1, page2.results().size());
        assertTrue(beyond.results().isEmpty());
        assertEquals(3, beyond.total());
    }

    @Test
    void titleSortAppliesToBrowse() {
        SearchResult ascending = service.search("", 1, 10, "title", "asc");
        SearchResult descending = service.search("", 1, 10, "title", "desc");

        assertEquals("Electoral Systems and Turnout", ascending.results().get(0).record().title());
        assertEquals("Supply Chain Resilience", descending.results().get(0).record().title());
        assertEquals(SortField.TITLE, ascending.sortBy());
        assertEquals(SortOrder.ASC, ascending.sortOrder());
    }

    @Test
    void dateSortAppliesToBrowse() {
        SearchResult ascending = service.search("", 1, 10, "date", "asc");
        SearchResult descending = service.search("", 1, 10, "date", "desc");

        assertEquals("Learning Analytics in Schools", ascending.results().get(0).record().title());
        assertEquals("Machine Learning in Healthcare", ascending.results().get(4).record().title());
        assertEquals("Machine Learning in Healthcare", descending.results().get(0).record().title());
        assertEquals(SortField.DATE, descending.sortBy());
    }

    @Test
    void dateSortKeepsRelevanceOrderForQueries() {
        SearchResult relevance = service.search("learning", 1, 10, null, null);
        SearchResult byDate = service.search("learning", 1, 10, "date", "asc");

        assertEquals(
            relevance.results().stream().map(RankedDocument::recordId).toList(),
            byDate.results().stream().map(RankedDocument::recordId).toList()
        );
        assertTrue(byDate.fromCache());
    }

    @Test
    void reloadClearsCachedRankings() {
        service.search("learning", 1, 10, null, null);
        assertEquals(1, service.cachedQueries());

        service.reloadCorpus();

        assertEquals(0, service.cachedQueries());
        assertEquals(2L, service.currentIndex().getGeneration());
        assertFalse(service.search("learning", 1, 10, null, null).fromCache());
    }
}
