package com.scholar.search;

import java.util.List;

public record SearchResult(
    List<RankedDocument> results,
    int total,
    int totalPages,
    int page,
    int size,
    boolean fromCache,
    SortField sortBy,
    SortOrder sortOrder
) {}
