package com.scholar.search;

import java.util.List;

/**
 * A clamped (page, size) request. Pages are 1-based; a non-positive page becomes 1, a non-positive size the
 * default, and a size above the maximum the maximum.
 */
public record PageWindow(int page, int size) {

    public static PageWindow of(Integer page, Integer size, int defaultSize, int maxSize) {
        int resolvedMax = Math.max(1, maxSize);
        int resolvedSize = size == null || size <= 0 ? defaultSize : size;
        resolvedSize = Math.max(1, Math.min(resolvedSize, resolvedMax));
        int resolvedPage = page == null || page <= 0 ? 1 : page;
        return new PageWindow(resolvedPage, resolvedSize);
    }

    public long offset() {
        return (long) (page - 1) * size;
    }

    public <T> List<T> slice(List<T> items) {
        long from = offset();
        if (from >= items.size()) {
            return List.of();
        }
        int to = (int) Math.min(items.size(), from + size);
        return List.copyOf(items.subList((int) from, to));
    }

    public int totalPages(int total) {
        return total <= 0 ? 0 : (total + size - 1) / size;
    }
}
