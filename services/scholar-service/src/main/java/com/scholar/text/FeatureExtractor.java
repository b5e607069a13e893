package com.scholar.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.tartarus.snowball.ext.PorterStemmer;

/**
 * Turns free text into term counts and L2-normalized TF-IDF vectors. Stateless apart from the minimum
 * token length and the stemming switch, so one instance may be shared by any number of threads.
 *
 * <p>With stemming on, every kept token is reduced by the Porter algorithm after the length and
 * stopword filters, so "learning", "learned" and "learns" all count as "learn".
 */
public class FeatureExtractor {
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private final int minTokenLength;
    private final boolean stemming;

    public FeatureExtractor(int minTokenLength) {
        this(minTokenLength, false);
    }

    public FeatureExtractor(int minTokenLength, boolean stemming) {
        this.minTokenLength = Math.max(1, minTokenLength);
        this.stemming = stemming;
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        // snowball stemmers keep per-word state
        PorterStemmer stemmer = stemming ? new PorterStemmer() : null;
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(lowered)) {
            if (token.length() < minTokenLength || EnglishStopwords.contains(token)) {
                continue;
            }
            tokens.add(stemmer == null ? token : stem(stemmer, token));
        }
        return tokens;
    }

    private static String stem(PorterStemmer stemmer, String token) {
        stemmer.setCurrent(token);
        stemmer.stem();
        return stemmer.getCurrent();
    }

    public Map<String, Integer> termCounts(String text) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String token : tokenize(text)) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    public DocumentVector vectorize(String text, Vocabulary vocabulary) {
        return vectorize(termCounts(text), vocabulary);
    }

    /**
     * Weights each term count by its idf and scales the result to unit length. Terms outside the
     * vocabulary are dropped; a text with no known term yields {@link DocumentVector#EMPTY}.
     */
    public DocumentVector vectorize(Map<String, Integer> counts, Vocabulary vocabulary) {
        if (counts == null || counts.isEmpty() || vocabulary == null) {
            return DocumentVector.EMPTY;
        }
        Map<String, Double> weights = new TreeMap<>();
        double sumSquares = 0.0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (!vocabulary.contains(entry.getKey())) {
                continue;
            }
            double weight = entry.getValue() * vocabulary.idf(entry.getKey());
            weights.put(entry.getKey(), weight);
            sumSquares += weight * weight;
        }
        if (weights.isEmpty() || sumSquares == 0.0) {
            return DocumentVector.EMPTY;
        }
        double norm = Math.sqrt(sumSquares);
        weights.replaceAll((term, weight) -> weight / norm);
        return new DocumentVector(weights);
    }
}
