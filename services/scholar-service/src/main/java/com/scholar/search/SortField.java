package com.scholar.search;

import java.util.Locale;

public enum SortField {
    RELEVANCE,
    DATE,
    TITLE;

    public static SortField from(String raw) {
        if (raw == null) {
            return RELEVANCE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "date", "published_date" -> DATE;
            case "title" -> TITLE;
            default -> RELEVANCE;
        };
    }
}
