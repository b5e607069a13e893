package com.scholar.search;

import com.scholar.corpus.CorpusIndex;
import com.scholar.text.DocumentVector;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Cosine-similarity ranking over a {@link CorpusIndex}. Vectors are unit length, so the score is a dot product.
 */
@Component
public class Ranker {
    private final SearchProperties properties;

    public Ranker(SearchProperties properties) {
        this.properties = properties;
    }

    /**
     * Scores every indexed document against the query. Documents with no term overlap (score 0) or a score
     * at or below the configured minimum are dropped.
     */
    public List<RankedDocument> rank(DocumentVector query, CorpusIndex index) {
        List<RankedDocument> ranked = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return ranked;
        }
        double minScore = Math.max(0.0, properties.getMinScore());
        for (CorpusIndex.IndexedDocument document : index.allVectors()) {
            double score = clamp(query.dot(document.vector()));
            if (score > minScore) {
                ranked.add(new RankedDocument(document.record(), score));
            }
        }
        ranked.sort(RankingOrder.RELEVANCE);
        return cap(ranked);
    }

    /** Empty-query mode: every document with score 0, newest first. */
    public List<RankedDocument> browse(CorpusIndex index) {
        List<RankedDocument> all = new ArrayList<>(index.size());
        for (CorpusIndex.IndexedDocument document : index.allVectors()) {
            all.add(new RankedDocument(document.record(), 0.0));
        }
        all.sort(RankingOrder.BROWSE);
        return all;
    }

    private List<RankedDocument> cap(List<RankedDocument> ranked) {
        int maxResults = properties.getMaxResults();
        if (maxResults > 0 && ranked.size() > maxResults) {
            return new ArrayList<>(ranked.subList(0, maxResults));
        }
        return ranked;
    }

    private static double clamp(double score) {
        if (score < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score);
    }
}
