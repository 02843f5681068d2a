package eu.virtualparadox.docclassifier.classify.zeroshot;

import java.util.List;

/**
 * Output of one zero-shot call: parallel lists sorted by descending score, where
 * {@code labels} is a permutation of the requested categories.
 *
 * @param labels candidate labels, best first
 * @param scores probability-like scores in {@code [0, 1]}, aligned with {@code labels}
 */
public record ZeroShotPrediction(List<String> labels, List<Double> scores) {

    public ZeroShotPrediction {
        labels = List.copyOf(labels);
        scores = List.copyOf(scores);
    }

    public String topLabel() {
        return labels.isEmpty() ? null : labels.get(0);
    }

    public double topScore() {
        return scores.isEmpty() ? 0.0 : scores.get(0);
    }
}
