package com.scholar.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholar.corpus.CorpusIndex;
import com.scholar.text.FeatureExtractor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RankingOrderTest {

    @Test
    void dateSortOnlyReordersExactScoreTies() {
        List<RankedDocument> ranked = List.of(
            scored("Learning", "https://example.org/c", "2019-02-01", 0.9),
            scored("Graph Learning", "https://example.org/a", "2020-04-01", 0.5),
            scored("Graph Learning", "https://example.org/b", "2022-04-01", 0.5),
            scored("Recent Survey", "https://example.org/d", "2024-01-01", 0.3)
        );

        assertThat(links(sorted(ranked, SortField.DATE, SortOrder.DESC, false)))
            .containsExactly("https://example.org/c", "https://example.org/b", "https://example.org/a",
                "https://example.org/d");
        assertThat(links(sorted(ranked, SortField.DATE, SortOrder.ASC, false)))
            .containsExactly("https://example.org/c", "https://example.org/a", "https://example.org/b",
                "https://example.org/d");
    }

    @Test
    void identicalDocumentsScoreEquallySoDateDecidesTheirOrder() {
        FeatureExtractor extractor = new FeatureExtractor(2);
        CorpusIndex index = CorpusIndex.build(List.of(
            RankerTest.publication("Graph Learning", "https://example.org/a", "2020-04-01", "graph networks"),
            RankerTest.publication("Graph Learning", "https://example.org/b", "2022-04-01", "graph networks"),
            RankerTest.publication("Learning", "https://example.org/c", "2019-02-01", "")
        ), extractor, 1L);
        List<RankedDocument> ranked = new Ranker(new SearchProperties())
            .rank(extractor.vectorize("learning", index.getVocabulary()), index);

        assertThat(ranked.get(1).score()).isEqualTo(ranked.get(2).score());
        assertThat(links(ranked))
            .containsExactly("https://example.org/c", "https://example.org/a", "https://example.org/b");
        assertThat(links(sorted(ranked, SortField.DATE, SortOrder.DESC, false)))
            .containsExactly("https://example.org/c", "https://example.org/b", "https://example.org/a");
    }

    @Test
    void browseDateSortPlacesUndatedRecordsAtTheOldEnd() {
        List<RankedDocument> browsed = List.of(
            scored("Middle", "https://example.org/m", "2021-06-01", 0.0),
            scored("Undated", "https://example.org/u", null, 0.0),
            scored("Newest", "https://example.org/n", "2023-06-01", 0.0)
        );

        assertThat(links(sorted(browsed, SortField.DATE, SortOrder.DESC, true)))
            .containsExactly("https://example.org/n", "https://example.org/m", "https://example.org/u");
        assertThat(links(sorted(browsed, SortField.DATE, SortOrder.ASC, true)))
            .containsExactly("https://example.org/u", "https://example.org/m", "https://example.org/n");
        assertThat(links(sorted(browsed, SortField.RELEVANCE, SortOrder.DESC, true)))
            .containsExactly("https://example.org/n", "https://example.org/m", "https://example.org/u");
    }

    @Test
    void titleSortIgnoresCaseWhileRelevanceFallsBackToTitleThenLink() {
        List<RankedDocument> tied = List.of(
            scored("beta methods", "https://example.org/1", "2020-01-01", 0.4),
            scored("Alpha methods", "https://example.org/2", "2020-01-01", 0.4),
            scored("Alpha methods", "https://example.org/0", "2020-01-01", 0.4)
        );

        assertThat(links(sorted(tied, SortField.TITLE, SortOrder.DESC, false)))
            .containsExactly("https://example.org/1", "https://example.org/0", "https://example.org/2");
        assertThat(links(sorted(tied, SortField.RELEVANCE, SortOrder.DESC, false)))
            .containsExactly("https://example.org/0", "https://example.org/2", "https://example.org/1");
    }

    private static RankedDocument scored(String title, String link, String date, double score) {
        return new RankedDocument(RankerTest.publication(title, link, date, ""), score);
    }

    private static List<RankedDocument> sorted(
        List<RankedDocument> documents,
        SortField field,
        SortOrder order,
        boolean browse
    ) {
        List<RankedDocument> copy = new ArrayList<>(documents);
        copy.sort(RankingOrder.of(field, order, browse));
        return copy;
    }

    private static List<String> links(List<RankedDocument> documents) {
        return documents.stream().map(RankedDocument::recordId).toList();
    }
}
