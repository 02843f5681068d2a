package eu.virtualparadox.docclassifier.classify.support;

import eu.virtualparadox.docclassifier.classify.model.ClassifierModel;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;
import eu.virtualparadox.docclassifier.classify.tokenizer.TextTokenizer;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotClassifier;

import java.util.concurrent.atomic.AtomicInteger;

public class StubModel implements ClassifierModel {

    private final ESupportedModel descriptor;
    private final TextTokenizer tokenizer;
    private final ZeroShotClassifier classifier;
    private final AtomicInteger releases = new AtomicInteger();

    public StubModel(ESupportedModel descriptor, TextTokenizer tokenizer, ZeroShotClassifier classifier) {
        this.descriptor = descriptor;
        this.tokenizer = tokenizer;
        this.classifier = classifier;
    }

    @Override
    public ESupportedModel descriptor() {
        return descriptor;
    }

    @Override
    public TextTokenizer tokenizer() {
        return tokenizer;
    }

    @Override
    public ZeroShotClassifier classifier() {
        return classifier;
    }

    @Override
    public void release() {
        releases.incrementAndGet();
    }

    public int releases() {
        return releases.get();
    }
}
