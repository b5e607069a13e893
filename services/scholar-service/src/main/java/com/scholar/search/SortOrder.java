package com.scholar.search;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder from(String raw) {
        if (raw == null) {
            return DESC;
        }
        return "asc".equals(raw.trim().toLowerCase(Locale.ROOT)) ? ASC : DESC;
    }
}
