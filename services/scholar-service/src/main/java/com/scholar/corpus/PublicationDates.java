package com.scholar.corpus;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

public final class PublicationDates {
    private static final List<DateTimeFormatter> DAY_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ENGLISH)
    );
    private static final List<DateTimeFormatter> MONTH_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH)
    );

    private PublicationDates() {
    }

    /**
     * Reads the date formats seen in crawler output. Month or year precision resolves to the first day of
     * the period. Returns {@code null} for anything else.
     */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == 'T') {
            value = value.substring(0, 10);
        }
        for (DateTimeFormatter format : DAY_FORMATS) {
            LocalDate parsed = tryParseDay(value, format);
            if (parsed != null) {
                return parsed;
            }
        }
        for (DateTimeFormatter format : MONTH_FORMATS) {
            LocalDate parsed = tryParseMonth(value, format);
            if (parsed != null) {
                return parsed;
            }
        }
        if (value.matches("\\d{4}")) {
            return LocalDate.of(Integer.parseInt(value), 1, 1);
        }
        return null;
    }

    private static LocalDate tryParseDay(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate tryParseMonth(String value, DateTimeFormatter format) {
        try {
            return YearMonth.parse(value, format).atDay(1);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
