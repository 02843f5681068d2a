package eu.virtualparadox.docclassifier.classify.zeroshot;

import java.util.List;

/**
 * Zero-shot classification primitive with a bounded input length.
 * <p>Implementations must tolerate being called from several threads or be accessed
 * through {@link eu.virtualparadox.docclassifier.classify.InferenceGate}.</p>
 */
public interface ZeroShotClassifier {

    /**
     * Scores {@code text} against every category.
     *
     * @param text       text to classify (non-blank)
     * @param categories ordered, unique candidate labels
     * @return labels and scores sorted by descending score
     */
    ZeroShotPrediction classify(String text, List<String> categories);
}
