package com.scholar.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor(2);

    @Test
    void tokenizeLowercasesAndDropsStopwordsAndShortTokens() {
        List<String> tokens = extractor.tokenize("The Machine-Learning models, in a Hospital!");

        assertEquals(List.of("machine", "learning", "models", "hospital"), tokens);
    }

    @Test
    void tokenizeKeepsDigitsAndUnicodeLetters() {
        assertEquals(List.of("covid", "19", "café"), extractor.tokenize("COVID-19 café"));
    }

    @Test
    void tokenizeBlankTextYieldsNothing() {
        assertTrue(extractor.tokenize(null).isEmpty());
        assertTrue(extractor.tokenize("   ").isEmpty());
        assertTrue(extractor.tokenize("the and of").isEmpty());
    }

    @Test
    void minimumTokenLengthIsConfigurable() {
        FeatureExtractor strict = new FeatureExtractor(4);

        assertEquals(List.of("trade", "deal"), strict.tokenize("EU trade deal"));
    }

    @Test
    void stemmingIsOffByDefault() {
        assertEquals(List.of("learning", "learned"), extractor.tokenize("learning learned"));
    }

    @Test
    void stemmingReducesInflectionsToOneTerm() {
        FeatureExtractor stemmed = new FeatureExtractor(2, true);

        assertEquals(List.of("learn", "learn", "learn", "learn"), stemmed.tokenize("Learning learned learns learn"));
        assertEquals(Map.of("model", 2), stemmed.termCounts("models model"));
    }

    @Test
    void stemmingRunsAfterStopwordFiltering() {
        FeatureExtractor stemmed = new FeatureExtractor(2, true);

        assertTrue(stemmed.tokenize("the being having").isEmpty());
    }

    @Test
    void termCountsAggregatesRepeats() {
        Map<String, Integer> counts = extractor.termCounts("health policy and health care");

        assertEquals(2, counts.get("health"));
        assertEquals(1, counts.get("policy"));
        assertEquals(1, counts.get("care"));
        assertFalse(counts.containsKey("and"));
    }

    @Test
    void vectorizeProducesUnitLengthOverKnownTermsOnly() {
        Vocabulary vocabulary = Vocabulary.fromTermCounts(List.of(
            extractor.termCounts("machine learning healthcare"),
            extractor.termCounts("supply chain finance")
        ));

        DocumentVector vector = extractor.vectorize("machine learning for quantum computing", vocabulary);

        assertEquals(2, vector.size());
        assertEquals(1.0, vector.norm(), 1e-9);
        assertEquals(0.0, vector.weight("quantum"));
    }

    @Test
    void vectorizeWithNoKnownTermIsEmpty() {
        Vocabulary vocabulary = Vocabulary.fromTermCounts(List.of(extractor.termCounts("economics")));

        assertSame(DocumentVector.EMPTY, extractor.vectorize("zebra", vocabulary));
        assertSame(DocumentVector.EMPTY, extractor.vectorize("", vocabulary));
    }
}
