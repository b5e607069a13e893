package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholar.search.RankedDocument;
import com.scholar.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    private List<PublicationHit> results;
    private int total;
    private int page;
    private int size;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("sort_by")
    private String sortBy;

    @JsonProperty("sort_order")
    private String sortOrder;

    @JsonProperty("from_cache")
    private boolean fromCache;

    public static SearchResponse from(SearchResult result) {
        SearchResponse response = new SearchResponse();
        List<PublicationHit> hits = new ArrayList<>(result.results().size());
        for (RankedDocument ranked : result.results()) {
            hits.add(PublicationHit.from(ranked));
        }
        response.setResults(hits);
        response.setTotal(result.total());
        response.setPage(result.page());
        response.setSize(result.size());
        response.setTotalPages(result.totalPages());
        response.setSortBy(result.sortBy().name().toLowerCase(Locale.ROOT));
        response.setSortOrder(result.sortOrder().name().toLowerCase(Locale.ROOT));
        response.setFromCache(result.fromCache());
        return response;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public List<PublicationHit> getResults() {
        return results;
    }

    public void setResults(List<PublicationHit> results) {
        this.results = results;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(String sortOrder) {
        this.sortOrder = sortOrder;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public void setFromCache(boolean fromCache) {
        this.fromCache = fromCache;
    }
}
