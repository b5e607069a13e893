package com.scholar.classify;

import com.scholar.text.DocumentVector;
import com.scholar.text.FeatureExtractor;
import com.scholar.text.Vocabulary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Fits a {@link ClassifierModel} from labeled documents. Training is a pure function of the documents, the
 * category list and the configured hyperparameters; nothing is published here.
 */
@Component
public class ClassifierTrainer {
    private final ClassifierProperties properties;

    public ClassifierTrainer(ClassifierProperties properties) {
        this.properties = properties;
    }

    public ClassifierModel train(List<TrainingDocument> documents, AlgorithmKind kind, List<String> categories) {
        Map<String, Integer> categoryIndex = validate(documents, categories);
        FeatureExtractor extractor = new FeatureExtractor(properties.getMinTokenLength(), properties.isStemming());

        List<Map<String, Integer>> counts = new ArrayList<>(documents.size());
        int[] labels = new int[documents.size()];
        for (int d = 0; d < documents.size(); d++) {
            TrainingDocument document = documents.get(d);
            counts.add(extractor.termCounts(document.text()));
            labels[d] = categoryIndex.get(document.category());
        }
        Vocabulary vocabulary = Vocabulary.fromTermCounts(counts);

        ModelParameters parameters = kind == AlgorithmKind.LOGISTIC_REGRESSION
            ? fitLogistic(counts, labels, categories.size(), vocabulary, extractor)
            : fitNaiveBayes(counts, labels, categories.size(), vocabulary);
        return new ClassifierModel(
            vocabulary,
            parameters,
            categories,
            extractor,
            documents.size(),
            trainingStats(documents, categories),
            Instant.now()
        );
    }

    /**
     * Counts documents per category, in category order, followed by a {@code total} entry. Labels outside
     * {@code categories} count toward the total only.
     */
    public static Map<String, Integer> trainingStats(List<TrainingDocument> documents, List<String> categories) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (String category : categories) {
            stats.put(category, 0);
        }
        for (TrainingDocument document : documents) {
            if (document.category() != null) {
                stats.computeIfPresent(document.category(), (key, count) -> count + 1);
            }
        }
        stats.put("total", documents.size());
        return Collections.unmodifiableMap(stats);
    }

    /**
     * Rejects an empty set, a label outside {@code categories}, and a category without any document.
     *
     * @return category name to position
     */
    public static Map<String, Integer> validate(List<TrainingDocument> documents, List<String> categories) {
        if (categories == null || categories.isEmpty()) {
            throw new InsufficientTrainingDataException("no categories configured");
        }
        if (documents == null || documents.isEmpty()) {
            throw new InsufficientTrainingDataException("training set is empty");
        }
        Map<String, Integer> categoryIndex = new HashMap<>();
        for (int c = 0; c < categories.size(); c++) {
            categoryIndex.putIfAbsent(categories.get(c), c);
        }
        int[] perCategory = new int[categories.size()];
        for (TrainingDocument document : documents) {
            Integer index = document.category() == null ? null : categoryIndex.get(document.category());
            if (index == null) {
                throw new UnknownCategoryException(
                    "training label '" + document.category() + "' is not one of " + categories
                );
            }
            perCategory[index]++;
        }
        for (int c = 0; c < perCategory.length; c++) {
            if (perCategory[c] == 0) {
                throw new InsufficientTrainingDataException("no training documents for category " + categories.get(c));
            }
        }
        return categoryIndex;
    }

    /**
     * Multinomial naive Bayes with add-one smoothing:
     * {@code P(t|c) = (count(t, c) + 1) / (terms(c) + |V|)}, prior = share of documents in {@code c}.
     */
    private NaiveBayesParameters fitNaiveBayes(
        List<Map<String, Integer>> counts,
        int[] labels,
        int categoryCount,
        Vocabulary vocabulary
    ) {
        int termCount = vocabulary.size();
        double[][] termTotals = new double[categoryCount][termCount];
        double[] categoryTerms = new double[categoryCount];
        int[] categoryDocs = new int[categoryCount];

        for (int d = 0; d < counts.size(); d++) {
            int c = labels[d];
            categoryDocs[c]++;
            for (Map.Entry<String, Integer> entry : counts.get(d).entrySet()) {
                int t = vocabulary.indexOf(entry.getKey());
                termTotals[c][t] += entry.getValue();
                categoryTerms[c] += entry.getValue();
            }
        }

        double[] logPriors = new double[categoryCount];
        double[][] logConditionals = new double[categoryCount][termCount];
        for (int c = 0; c < categoryCount; c++) {
            logPriors[c] = Math.log((double) categoryDocs[c] / counts.size());
            double denominator = categoryTerms[c] + termCount;
            for (int t = 0; t < termCount; t++) {
                logConditionals[c][t] = Math.log((termTotals[c][t] + 1.0) / denominator);
            }
        }
        return new NaiveBayesParameters(logPriors, logConditionals);
    }

    /**
     * One-vs-rest logistic regression over unit-length TF-IDF vectors, fit by full-batch gradient descent on
     * binary cross-entropy with an L2 penalty on the weights. Fixed iteration count, zero initialization.
     */
    private LogisticParameters fitLogistic(
        List<Map<String, Integer>> counts,
        int[] labels,
        int categoryCount,
        Vocabulary vocabulary,
        FeatureExtractor extractor
    ) {
        int termCount = vocabulary.size();
        int docCount = counts.size();
        int[][] indices = new int[docCount][];
        double[][] values = new double[docCount][];
        for (int d = 0; d < docCount; d++) {
            DocumentVector vector = extractor.vectorize(counts.get(d), vocabulary);
            indices[d] = new int[vector.size()];
            values[d] = new double[vector.size()];
            int i = 0;
            for (Map.Entry<String, Double> entry : vector.getWeights().entrySet()) {
                indices[d][i] = vocabulary.indexOf(entry.getKey());
                values[d][i] = entry.getValue();
                i++;
            }
        }

        ClassifierProperties.Logistic settings = properties.getLogistic();
        double learningRate = settings.getLearningRate();
        double l2 = Math.max(0.0, settings.getL2Penalty());
        int iterations = Math.max(1, settings.getIterations());

        double[][] weights = new double[categoryCount][termCount];
        double[] biases = new double[categoryCount];
        double[] gradient = new double[termCount];
        for (int c = 0; c < categoryCount; c++) {
            double[] w = weights[c];
            for (int iteration = 0; iteration < iterations; iteration++) {
                Arrays.fill(gradient, 0.0);
                double biasGradient = 0.0;
                for (int d = 0; d < docCount; d++) {
                    double z = biases[c];
                    for (int i = 0; i < indices[d].length; i++) {
                        z += w[indices[d][i]] * values[d][i];
                    }
                    double error = sigmoid(z) - (labels[d] == c ? 1.0 : 0.0);
                    for (int i = 0; i < indices[d].length; i++) {
                        gradient[indices[d][i]] += error * values[d][i];
                    }
                    biasGradient += error;
                }
                for (int t = 0; t < termCount; t++) {
                    w[t] -= learningRate * (gradient[t] / docCount + l2 * w[t]);
                }
                biases[c] -= learningRate * biasGradient / docCount;
            }
        }
        return new LogisticParameters(weights, biases);
    }

    private static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
