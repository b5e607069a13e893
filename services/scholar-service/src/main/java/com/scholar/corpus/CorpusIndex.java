package com.scholar.corpus;

import com.scholar.text.DocumentVector;
import com.scholar.text.FeatureExtractor;
import com.scholar.text.Vocabulary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable vectorized view of one corpus snapshot. A changed record set means a new index; nothing here is
 * ever updated in place.
 */
public final class CorpusIndex {
    private final long generation;
    private final Vocabulary vocabulary;
    private final List<IndexedDocument> documents;
    private final Map<String, IndexedDocument> byLink;
    private final Instant builtAt;

    private CorpusIndex(long generation, Vocabulary vocabulary, List<IndexedDocument> documents, Instant builtAt) {
        this.generation = generation;
        this.vocabulary = vocabulary;
        this.documents = Collections.unmodifiableList(documents);
        Map<String, IndexedDocument> links = new HashMap<>();
        for (IndexedDocument document : documents) {
            links.putIfAbsent(document.recordId(), document);
        }
        this.byLink = Collections.unmodifiableMap(links);
        this.builtAt = builtAt;
    }

    public static CorpusIndex empty() {
        return new CorpusIndex(0L, Vocabulary.EMPTY, List.of(), Instant.EPOCH);
    }

    public static CorpusIndex build(List<PublicationRecord> records, FeatureExtractor extractor, long generation) {
        List<Map<String, Integer>> counts = new ArrayList<>(records.size());
        for (PublicationRecord record : records) {
            counts.add(extractor.termCounts(record.searchableText()));
        }
        Vocabulary vocabulary = Vocabulary.fromTermCounts(counts);
        List<IndexedDocument> documents = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            PublicationRecord record = records.get(i);
            documents.add(new IndexedDocument(record.link(), record, extractor.vectorize(counts.get(i), vocabulary)));
        }
        return new CorpusIndex(generation, vocabulary, documents, Instant.now());
    }

    public long getGeneration() {
        return generation;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public List<IndexedDocument> allVectors() {
        return documents;
    }

    public IndexedDocument get(String recordId) {
        return byLink.get(recordId);
    }

    public int size() {
        return documents.size();
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public record IndexedDocument(String recordId, PublicationRecord record, DocumentVector vector) {}
}
