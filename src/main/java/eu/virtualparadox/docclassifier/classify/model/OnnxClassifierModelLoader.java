package eu.virtualparadox.docclassifier.classify.model;

import ai.onnxruntime.OrtException;
import eu.virtualparadox.docclassifier.application.config.ApplicationConfig;
import eu.virtualparadox.docclassifier.classify.tokenizer.HuggingFaceTextTokenizer;
import eu.virtualparadox.docclassifier.classify.tokenizer.TextTokenizer;
import eu.virtualparadox.docclassifier.classify.zeroshot.OnnxZeroShotClassifier;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads ONNX models from {@code <models>/<key>/model.onnx} with the tokenizer next to it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OnnxClassifierModelLoader implements ClassifierModelLoader {

    private final ApplicationConfig config;

    @Override
    public ClassifierModel load(final ESupportedModel model) {
        if (config.getModels() == null) {
            throw new ModelUnavailableException("docclassifier.models is not configured");
        }

        final Path modelRoot = config.getModels().resolve(model.key());
        final Path modelPath = modelRoot.resolve("model.onnx");
        final Path tokenizerPath = modelRoot.resolve("tokenizer.json");

        if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            throw new ModelUnavailableException("Model artifacts for " + model.key() + " not found under " + modelRoot);
        }

        log.info("Loading {} ({}) model...", model.displayName(), model.modelId());

        final HuggingFaceTextTokenizer tokenizer = new HuggingFaceTextTokenizer(tokenizerPath, model.maxInputTokens());
        final OnnxZeroShotClassifier classifier = new OnnxZeroShotClassifier(
                model, modelPath, tokenizer, config.getOrt().getIntraOpThreads());
        try {
            tokenizer.initialize();
            classifier.initialize();
        } catch (IOException | OrtException e) {
            tokenizer.release();
            throw new ModelUnavailableException("Failed to load " + model.displayName() + " model", e);
        }

        log.info("{} model and tokenizer loaded successfully", model.displayName());
        return new OnnxClassifierModel(model, tokenizer, classifier);
    }

    private record OnnxClassifierModel(ESupportedModel descriptor,
                                       HuggingFaceTextTokenizer hfTokenizer,
                                       OnnxZeroShotClassifier onnxClassifier) implements ClassifierModel {

        @Override
        public TextTokenizer tokenizer() {
            return hfTokenizer;
        }

        @Override
        public ZeroShotClassifier classifier() {
            return onnxClassifier;
        }

        @Override
        public void release() {
            try {
                onnxClassifier.release();
            } catch (OrtException e) {
                log.error("Unable to close ONNX session for {}", descriptor.key(), e);
            }
            hfTokenizer.release();
        }
    }
}
