package eu.virtualparadox.docclassifier.classify.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * NLI models usable as zero-shot classifiers. Each needs an ONNX export and its
 * {@code tokenizer.json} under {@code <models>/<key>/}.
 */
public enum ESupportedModel {

    BART_LARGE_MNLI("bart-large-mnli",
            "BART Large MNLI",
            "facebook/bart-large-mnli",
            "Facebook's BART model fine-tuned for MNLI",
            2, 1024),

    MDEBERTA_V3_BASE("mdeberta-v3-base",
            "mDeBERTa v3 Base",
            "MoritzLaurer/mDeBERTa-v3-base-mnli-xnli",
            "Multilingual DeBERTa model for cross-lingual classification",
            0, 512);

    /** Tokens kept free for the hypothesis and special tokens when sizing a premise. */
    public static final int HYPOTHESIS_RESERVE_TOKENS = 64;

    private final String key;
    private final String displayName;
    private final String modelId;
    private final String description;
    private final int entailmentIndex;
    private final int maxInputTokens;

    ESupportedModel(final String key,
                    final String displayName,
                    final String modelId,
                    final String description,
                    final int entailmentIndex,
                    final int maxInputTokens) {
        this.key = key;
        this.displayName = displayName;
        this.modelId = modelId;
        this.description = description;
        this.entailmentIndex = entailmentIndex;
        this.maxInputTokens = maxInputTokens;
    }

    public String key() { return key; }
    public String displayName() { return displayName; }
    public String modelId() { return modelId; }
    public String description() { return description; }

    /** Position of the "entailment" logit in the model's output. */
    public int entailmentIndex() { return entailmentIndex; }

    /** Longest premise+hypothesis encoding the model accepts. */
    public int maxInputTokens() { return maxInputTokens; }

    /** Longest premise that still leaves room for any hypothesis; chunk windows never exceed it. */
    public int maxPremiseTokens() { return maxInputTokens - HYPOTHESIS_RESERVE_TOKENS; }

    /**
     * Resolves a model by its key.
     *
     * @throws IllegalArgumentException if the key is unknown
     */
    public static ESupportedModel fromKey(final String key) {
        for (ESupportedModel model : values()) {
            if (model.key.equals(key)) {
                return model;
            }
        }
        final String available = Arrays.stream(values())
                .map(ESupportedModel::key)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Model '" + key + "' not supported. Available models: [" + available + "]");
    }
}
