package eu.virtualparadox.docclassifier.classify.model;

import eu.virtualparadox.docclassifier.classify.tokenizer.TextTokenizer;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotClassifier;

/**
 * A loaded model: the tokenizer used for chunking plus the zero-shot primitive.
 * Expensive to build, so it is created once per {@link ESupportedModel} and shared.
 */
public interface ClassifierModel {

    ESupportedModel descriptor();

    TextTokenizer tokenizer();

    ZeroShotClassifier classifier();

    /**
     * Frees native resources. The handle must not be used afterwards.
     */
    void release();
}
