package com.scholar.search;

import com.scholar.corpus.PublicationRecord;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Locale;

/**
 * Orderings over ranked lists. Score always dominates; a secondary key only separates documents whose scores
 * are exactly equal. Title then link close every ordering so results are fully deterministic.
 */
public final class RankingOrder {
    private static final Comparator<RankedDocument> BY_SCORE_DESC =
        Comparator.comparingDouble(RankedDocument::score).reversed();
    private static final Comparator<RankedDocument> BY_TITLE =
        Comparator.comparing(doc -> doc.record().title());
    private static final Comparator<RankedDocument> BY_TITLE_IGNORE_CASE =
        Comparator.comparing(doc -> doc.record().title().toLowerCase(Locale.ROOT));
    private static final Comparator<RankedDocument> BY_DATE =
        Comparator.comparing(doc -> publishedOrMin(doc.record()));
    private static final Comparator<RankedDocument> FINAL_TIE_BREAK =
        BY_TITLE.thenComparing(RankedDocument::recordId);

    /** Query mode: score descending, then title. */
    public static final Comparator<RankedDocument> RELEVANCE = BY_SCORE_DESC.thenComparing(FINAL_TIE_BREAK);

    /** Browse mode: every score is zero, newest first. */
    public static final Comparator<RankedDocument> BROWSE =
        BY_SCORE_DESC.thenComparing(BY_DATE.reversed()).thenComparing(FINAL_TIE_BREAK);

    private RankingOrder() {
    }

    public static Comparator<RankedDocument> of(SortField field, SortOrder order, boolean browse) {
        Comparator<RankedDocument> secondary;
        if (field == SortField.DATE) {
            secondary = BY_DATE;
        } else if (field == SortField.TITLE) {
            secondary = BY_TITLE_IGNORE_CASE;
        } else {
            return browse ? BROWSE : RELEVANCE;
        }
        if (order != SortOrder.ASC) {
            secondary = secondary.reversed();
        }
        return BY_SCORE_DESC.thenComparing(secondary).thenComparing(FINAL_TIE_BREAK);
    }

    private static LocalDate publishedOrMin(PublicationRecord record) {
        return record.publishedOn() == null ? LocalDate.MIN : record.publishedOn();
    }
}
