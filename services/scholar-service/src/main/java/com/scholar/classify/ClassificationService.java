package com.scholar.classify;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class ClassificationService {
    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);
    private static final double MAX_HOLDOUT_RATIO = 0.5;

    private final TrainingSetLoader trainingSetLoader;
    private final ClassifierTrainer trainer;
    private final ClassifierPredictor predictor;
    private final ModelRegistry registry;
    private final ClassifierProperties properties;
    private final MeterRegistry meterRegistry;
    private final Object trainLock = new Object();

    public ClassificationService(
        TrainingSetLoader trainingSetLoader,
        ClassifierTrainer trainer,
        ClassifierPredictor predictor,
        ModelRegistry registry,
        ClassifierProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.trainingSetLoader = trainingSetLoader;
        this.trainer = trainer;
        this.predictor = predictor;
        this.registry = registry;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void trainOnStartup() {
        if (!properties.isTrainOnStartup()) {
            return;
        }
        try {
            trainModels();
        } catch (RuntimeException ex) {
            log.warn("startup training failed, models stay untrained: {}", ex.getMessage());
        }
    }

    /**
     * Trains every algorithm on the current training set. Both models are built before either is published;
     * on any failure nothing is published and the previous models keep serving.
     */
    public Map<AlgorithmKind, TrainingSummary> trainModels() {
        synchronized (trainLock) {
            List<TrainingDocument> documents = trainingSetLoader.load();
            List<String> categories = List.copyOf(properties.getCategories());
            ClassifierTrainer.validate(documents, categories);
            Split split = split(documents, categories);

            Map<AlgorithmKind, ClassifierModel> trained = new EnumMap<>(AlgorithmKind.class);
            Map<AlgorithmKind, TrainingSummary> summaries = new EnumMap<>(AlgorithmKind.class);
            for (AlgorithmKind kind : AlgorithmKind.values()) {
                ClassifierModel model = trainer.train(split.train(), kind, categories);
                trained.put(kind, model);
                summaries.put(kind, evaluate(model, split));
            }
            registry.publish(trained);

            for (TrainingSummary summary : summaries.values()) {
                meterRegistry.counter("scholar_classifier_train_total", "algorithm", summary.algorithm().id()).increment();
                log.info(
                    "classifier trained algorithm={} training_size={} test_size={} accuracy={}",
                    summary.algorithm().id(),
                    summary.trainingSize(),
                    summary.testSize(),
                    summary.accuracy()
                );
            }
            return summaries;
        }
    }

    public ClassificationResult classify(String text, String modelType) {
        if (text == null || text.isBlank()) {
            throw new InvalidClassificationRequestException("text is required for classification");
        }
        AlgorithmKind kind = AlgorithmKind.from(modelType);
        ClassifierModel model = registry.current(kind);
        if (model == null) {
            throw new ModelNotTrainedException("model " + kind.id() + " must be trained before classification");
        }
        Prediction prediction = predictor.predict(text, model);
        meterRegistry.counter("scholar_classifier_predict_total", "algorithm", kind.id()).increment();
        return new ClassificationResult(
            prediction.category(),
            prediction.confidence(),
            prediction.probabilities(),
            new ClassificationResult.Explanation(summarize(kind, prediction), prediction.topTerms()),
            kind,
            text.length(),
            prediction.processedTokenCount()
        );
    }

    /**
     * Describes one algorithm. A trained model reports the snapshot taken when it was fit; only an untrained
     * algorithm reads the current training file.
     */
    public ModelInfo modelInfo(String modelType) {
        AlgorithmKind kind = AlgorithmKind.from(modelType);
        ClassifierModel model = registry.current(kind);
        if (model != null) {
            return new ModelInfo(
                kind,
                true,
                model.getDocumentCount(),
                model.getCategories(),
                model.getTrainingStats(),
                model.getTrainedAt()
            );
        }
        List<String> categories = List.copyOf(properties.getCategories());
        List<TrainingDocument> documents = trainingSetLoader.load();
        return new ModelInfo(
            kind,
            false,
            documents.size(),
            categories,
            ClassifierTrainer.trainingStats(documents, categories),
            null
        );
    }

    /**
     * Holds out an evenly spaced, per-category slice for evaluation. Tiny sets train on everything.
     */
    Split split(List<TrainingDocument> documents, List<String> categories) {
        double ratio = Math.max(0.0, Math.min(MAX_HOLDOUT_RATIO, properties.getHoldoutRatio()));
        if (ratio == 0.0 || documents.size() < Math.max(6, categories.size() * 2)) {
            return new Split(documents, List.of());
        }
        List<TrainingDocument> train = new ArrayList<>();
        List<TrainingDocument> test = new ArrayList<>();
        for (String category : categories) {
            int position = 0;
            for (TrainingDocument document : documents) {
                if (!category.equals(document.category())) {
                    continue;
                }
                boolean holdout = Math.floor((position + 1) * ratio) > Math.floor(position * ratio);
                (holdout ? test : train).add(document);
                position++;
            }
        }
        return new Split(train, test);
    }

    private TrainingSummary evaluate(ClassifierModel model, Split split) {
        List<String> categories = model.getCategories();
        if (split.test().isEmpty()) {
            return new TrainingSummary(
                model.getKind(), null, Map.of(), split.train().size(), 0, categories, model.getTrainedAt()
            );
        }
        Map<String, int[]> tallies = new LinkedHashMap<>();
        for (String category : categories) {
            tallies.put(category, new int[3]);
        }
        int correct = 0;
        for (TrainingDocument document : split.test()) {
            String predicted = predictor.predict(document.text(), model).category();
            tallies.get(document.category())[2]++;
            if (predicted.equals(document.category())) {
                correct++;
                tallies.get(predicted)[0]++;
            } else {
                tallies.get(predicted)[1]++;
            }
        }
        Map<String, CategoryMetrics> report = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> entry : tallies.entrySet()) {
            int truePositive = entry.getValue()[0];
            int falsePositive = entry.getValue()[1];
            int support = entry.getValue()[2];
            double precision = ratio(truePositive, truePositive + falsePositive);
            double recall = ratio(truePositive, support);
            double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
            report.put(entry.getKey(), new CategoryMetrics(precision, recall, f1, support));
        }
        double accuracy = (double) correct / split.test().size();
        return new TrainingSummary(
            model.getKind(),
            accuracy,
            report,
            split.train().size(),
            split.test().size(),
            categories,
            model.getTrainedAt()
        );
    }

    private String summarize(AlgorithmKind kind, Prediction prediction) {
        double confidence = prediction.confidence();
        String level = confidence >= 0.8 ? "high" : confidence >= 0.6 ? "moderate" : "low";
        StringBuilder summary = new StringBuilder(String.format(
            Locale.ROOT,
            "The %s model classified this text as '%s' with %.1f%% confidence. This is a %s-confidence prediction.",
            kind.id().replace('_', ' '),
            prediction.category(),
            confidence * 100,
            level
        ));
        List<Map.Entry<String, Double>> alternatives = new ArrayList<>(prediction.probabilities().entrySet());
        alternatives.removeIf(entry -> entry.getKey().equals(prediction.category()));
        alternatives.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
        if (!alternatives.isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Double> entry : alternatives) {
                parts.add(String.format(Locale.ROOT, "%s: %.1f%%", entry.getKey(), entry.getValue() * 100));
            }
            summary.append(" Alternative classifications: ").append(String.join(", ", parts));
        }
        return summary.toString();
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    record Split(List<TrainingDocument> train, List<TrainingDocument> test) {}
}
