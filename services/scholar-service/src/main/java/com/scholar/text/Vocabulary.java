package com.scholar.text;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Terms observed across a document collection with their document frequencies.
 */
public final class Vocabulary {
    public static final Vocabulary EMPTY = new Vocabulary(Map.of(), 0);

    private final Map<String, Integer> documentFrequency;
    private final int documentCount;
    private final List<String> terms;

    public Vocabulary(Map<String, Integer> documentFrequency, int documentCount) {
        this.documentFrequency = Collections.unmodifiableMap(new TreeMap<>(documentFrequency));
        this.documentCount = Math.max(0, documentCount);
        this.terms = List.copyOf(this.documentFrequency.keySet());
    }

    public static Vocabulary fromTermCounts(Collection<Map<String, Integer>> documents) {
        Map<String, Integer> df = new TreeMap<>();
        for (Map<String, Integer> counts : documents) {
            for (String term : counts.keySet()) {
                df.merge(term, 1, Integer::sum);
            }
        }
        return new Vocabulary(df, documents.size());
    }

    /**
     * Smoothed inverse document frequency: {@code ln((1 + N) / (1 + df)) + 1}. Terms never seen get df = 0.
     */
    public double idf(String term) {
        int df = documentFrequency.getOrDefault(term, 0);
        return Math.log((1.0 + documentCount) / (1.0 + df)) + 1.0;
    }

    public boolean contains(String term) {
        return documentFrequency.containsKey(term);
    }

    public int documentFrequency(String term) {
        return documentFrequency.getOrDefault(term, 0);
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public int size() {
        return terms.size();
    }

    /** Sorted term list; the position of a term is its feature index. */
    public List<String> getTerms() {
        return terms;
    }

    public int indexOf(String term) {
        int index = Collections.binarySearch(terms, term);
        return index < 0 ? -1 : index;
    }
}
