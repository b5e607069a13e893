package com.scholar.api;

import com.scholar.api.dto.SearchResponse;
import com.scholar.corpus.CorpusIndex;
import com.scholar.search.ScholarSearchService;
import com.scholar.search.SearchResult;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final ScholarSearchService searchService;

    public SearchController(ScholarSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        CorpusIndex index = searchService.currentIndex();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("publications", index.size());
        body.put("index_generation", index.getGeneration());
        body.put("cache_entries", searchService.cachedQueries());
        return body;
    }

    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(
        @RequestParam(value = "query", required = false) String query,
        @RequestParam(value = "page", required = false) Integer page,
        @RequestParam(value = "size", required = false) Integer size,
        @RequestParam(value = "sort_by", required = false) String sortBy,
        @RequestParam(value = "sort_order", required = false) String sortOrder,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        long started = System.nanoTime();
        SearchResult result = searchService.search(query, page, size, sortBy, sortOrder);
        SearchResponse response = SearchResponse.from(result);
        RequestIds ids = RequestIds.of(traceIdHeader, requestIdHeader);
        response.setTraceId(ids.traceId());
        response.setRequestId(ids.requestId());
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/internal/corpus/reload")
    public Map<String, Object> reloadCorpus() {
        CorpusIndex index = searchService.reloadCorpus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "reloaded");
        body.put("publications", index.size());
        body.put("terms", index.getVocabulary().size());
        body.put("index_generation", index.getGeneration());
        body.put("built_at", index.getBuiltAt().toString());
        return body;
    }
}
