package com.scholar.classify;

import com.scholar.text.DocumentVector;
import com.scholar.text.Vocabulary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ClassifierPredictor {
    private final ClassifierProperties properties;

    public ClassifierPredictor(ClassifierProperties properties) {
        this.properties = properties;
    }

    /**
     * Scores {@code text} against every category of {@code model} and softmax-normalizes the scores. Terms the
     * model has never seen contribute nothing. Equal probabilities resolve to the earlier category.
     */
    public Prediction predict(String text, ClassifierModel model) {
        if (model == null) {
            throw new ModelNotTrainedException("model must be trained before classification");
        }
        List<String> categories = model.getCategories();
        Map<String, Integer> counts = model.getExtractor().termCounts(text);
        int tokenCount = 0;
        for (int count : counts.values()) {
            tokenCount += count;
        }

        double[] scores = new double[categories.size()];
        Map<String, double[]> termScores = new LinkedHashMap<>();
        ModelParameters parameters = model.getParameters();
        if (parameters instanceof NaiveBayesParameters naiveBayes) {
            scoreNaiveBayes(naiveBayes, counts, model.getVocabulary(), scores, termScores);
        } else if (parameters instanceof LogisticParameters logistic) {
            DocumentVector features = model.getExtractor().vectorize(counts, model.getVocabulary());
            scoreLogistic(logistic, features, model.getVocabulary(), scores, termScores);
        }

        double[] probabilities = softmax(scores);
        int winner = argmax(probabilities);
        Map<String, Double> byCategory = new LinkedHashMap<>();
        for (int c = 0; c < categories.size(); c++) {
            byCategory.put(categories.get(c), probabilities[c]);
        }
        return new Prediction(
            model.getKind(),
            categories.get(winner),
            probabilities[winner],
            byCategory,
            topTerms(termScores, winner),
            tokenCount
        );
    }

    private void scoreNaiveBayes(
        NaiveBayesParameters parameters,
        Map<String, Integer> counts,
        Vocabulary vocabulary,
        double[] scores,
        Map<String, double[]> termScores
    ) {
        for (int c = 0; c < scores.length; c++) {
            scores[c] = parameters.logPrior(c);
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int t = vocabulary.indexOf(entry.getKey());
            if (t < 0) {
                continue;
            }
            double[] perCategory = new double[scores.length];
            for (int c = 0; c < scores.length; c++) {
                perCategory[c] = entry.getValue() * parameters.logConditional(c, t);
                scores[c] += perCategory[c];
            }
            termScores.put(entry.getKey(), perCategory);
        }
    }

    private void scoreLogistic(
        LogisticParameters parameters,
        DocumentVector features,
        Vocabulary vocabulary,
        double[] scores,
        Map<String, double[]> termScores
    ) {
        for (int c = 0; c < scores.length; c++) {
            scores[c] = parameters.bias(c);
        }
        for (Map.Entry<String, Double> entry : features.getWeights().entrySet()) {
            int t = vocabulary.indexOf(entry.getKey());
            double[] perCategory = new double[scores.length];
            for (int c = 0; c < scores.length; c++) {
                perCategory[c] = entry.getValue() * parameters.weight(c, t);
                scores[c] += perCategory[c];
            }
            termScores.put(entry.getKey(), perCategory);
        }
    }

    /**
     * A term's pull toward the winner is its score for the winner minus its best score for any other category.
     * Only positive pulls are reported.
     */
    private List<Prediction.TermContribution> topTerms(Map<String, double[]> termScores, int winner) {
        List<Prediction.TermContribution> contributions = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : termScores.entrySet()) {
            double[] perCategory = entry.getValue();
            double bestOther = Double.NEGATIVE_INFINITY;
            for (int c = 0; c < perCategory.length; c++) {
                if (c != winner) {
                    bestOther = Math.max(bestOther, perCategory[c]);
                }
            }
            double pull = bestOther == Double.NEGATIVE_INFINITY
                ? perCategory[winner]
                : perCategory[winner] - bestOther;
            if (pull > 0.0) {
                contributions.add(new Prediction.TermContribution(entry.getKey(), pull));
            }
        }
        contributions.sort(
            Comparator.comparingDouble(Prediction.TermContribution::weight).reversed()
                .thenComparing(Prediction.TermContribution::term)
        );
        int limit = Math.max(0, properties.getExplanationTerms());
        return contributions.size() > limit ? List.copyOf(contributions.subList(0, limit)) : contributions;
    }

    static double[] softmax(double[] scores) {
        double max = Double.NEGATIVE_INFINITY;
        for (double score : scores) {
            max = Math.max(max, score);
        }
        double[] probabilities = new double[scores.length];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            probabilities[i] = Math.exp(scores[i] - max);
            sum += probabilities[i];
        }
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] /= sum;
        }
        return probabilities;
    }

    static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
