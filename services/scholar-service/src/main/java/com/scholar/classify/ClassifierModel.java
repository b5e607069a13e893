package com.scholar.classify;

import com.scholar.text.FeatureExtractor;
import com.scholar.text.Vocabulary;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one training run. The feature extractor travels with the model so prediction always
 * tokenizes the way training did, and the per-category document counts are kept so model info never has to
 * reread the training file.
 */
public final class ClassifierModel {
    private final Vocabulary vocabulary;
    private final ModelParameters parameters;
    private final List<String> categories;
    private final FeatureExtractor extractor;
    private final int documentCount;
    private final Map<String, Integer> trainingStats;
    private final Instant trainedAt;

    public ClassifierModel(
        Vocabulary vocabulary,
        ModelParameters parameters,
        List<String> categories,
        FeatureExtractor extractor,
        int documentCount,
        Map<String, Integer> trainingStats,
        Instant trainedAt
    ) {
        this.vocabulary = vocabulary;
        this.parameters = parameters;
        this.categories = List.copyOf(categories);
        this.extractor = extractor;
        this.documentCount = documentCount;
        this.trainingStats = trainingStats;
        this.trainedAt = trainedAt;
    }

    public AlgorithmKind getKind() {
        return parameters.kind();
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public List<String> getCategories() {
        return categories;
    }

    public FeatureExtractor getExtractor() {
        return extractor;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    /**
     * Documents per category in category order, then {@code total}.
     */
    public Map<String, Integer> getTrainingStats() {
        return trainingStats;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }
}
