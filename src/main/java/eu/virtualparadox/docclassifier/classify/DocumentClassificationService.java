package eu.virtualparadox.docclassifier.classify;

import eu.virtualparadox.docclassifier.application.config.ApplicationConfig;
import eu.virtualparadox.docclassifier.classify.aggregate.AggregatedScores;
import eu.virtualparadox.docclassifier.classify.aggregate.ScoreAggregator;
import eu.virtualparadox.docclassifier.classify.chunker.TokenChunk;
import eu.virtualparadox.docclassifier.classify.chunker.TokenChunker;
import eu.virtualparadox.docclassifier.classify.invoker.ChunkClassificationInvoker;
import eu.virtualparadox.docclassifier.classify.invoker.ChunkScores;
import eu.virtualparadox.docclassifier.classify.model.ClassifierModel;
import eu.virtualparadox.docclassifier.classify.model.ClassifierModelRegistry;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;
import eu.virtualparadox.docclassifier.classify.model.ModelUnavailableException;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotPrediction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point for classifying document text.
 *
 * <ol>
 *   <li>Blank text returns an error result without touching the model.</li>
 *   <li>Texts of at most {@code maxChunkTokens} tokens are classified once, directly. The
 *       configured size is lowered to the model's premise budget when it does not fit.</li>
 *   <li>Longer texts are split into overlapping chunks, each chunk is classified, and the
 *       chunk scores are aggregated.</li>
 * </ol>
 * Every call returns a {@link ClassificationResult}; nothing is thrown for bad input, a
 * missing model or failing chunks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentClassificationService {

    static final String ERROR_EMPTY_TEXT = "Empty text provided";

    private final ClassifierModelRegistry modelRegistry;
    private final TokenChunker chunker;
    private final ChunkClassificationInvoker invoker;
    private final ScoreAggregator aggregator;
    private final InferenceGate inferenceGate;
    private final ApplicationConfig config;

    public ClassificationResult classifyDocumentText(final String text) {
        return classifyDocumentText(text, null, null);
    }

    public ClassificationResult classifyDocumentText(final String text, final List<String> categories) {
        return classifyDocumentText(text, categories, null);
    }

    /**
     * Classifies {@code text} into one of {@code categories}.
     *
     * @param text       document text
     * @param categories candidate categories; {@code null} or empty uses the configured defaults
     * @param modelKey   model to use; {@code null} uses the configured default
     * @return the decision, or an error result for blank text or an unavailable model
     * @throws IllegalArgumentException if {@code modelKey} names no supported model
     */
    public ClassificationResult classifyDocumentText(final String text,
                                                     final List<String> categories,
                                                     final String modelKey) {
        if (StringUtils.isBlank(text)) {
            return ClassificationResult.error(ERROR_EMPTY_TEXT);
        }

        final ESupportedModel model = ESupportedModel.fromKey(modelKey != null ? modelKey : config.getDefaultModel());
        final List<String> effectiveCategories = resolveCategories(categories);
        if (effectiveCategories.isEmpty()) {
            return ClassificationResult.error("No categories provided");
        }

        final ClassifierModel handle;
        try {
            handle = modelRegistry.acquire(model);
        } catch (ModelUnavailableException e) {
            log.error("Classifier {} unavailable", model.key(), e);
            return ClassificationResult.error("Classifier unavailable: " + e.getMessage());
        }

        return inferenceGate.withSlot(
                () -> classifyWith(handle, text, effectiveCategories),
                () -> ClassificationResult.error("Interrupted while waiting for the classifier"));
    }

    private ClassificationResult classifyWith(final ClassifierModel handle,
                                              final String text,
                                              final List<String> categories) {
        final long started = System.nanoTime();

        final long[] tokens;
        try {
            tokens = handle.tokenizer().encode(text);
        } catch (RuntimeException e) {
            log.error("Tokenization failed", e);
            return ClassificationResult.error("Tokenization failed: " + e.getMessage());
        }

        final TokenChunker effectiveChunker = chunker.limitedTo(handle.descriptor().maxPremiseTokens());
        log.info("Processing document with {} tokens using {} token chunks",
                tokens.length, effectiveChunker.params().maxChunkTokens());

        final AggregatedScores scores;
        if (!effectiveChunker.needsChunking(tokens.length)) {
            final ZeroShotPrediction prediction;
            try {
                prediction = handle.classifier().classify(text, categories);
            } catch (RuntimeException e) {
                log.error("Classification failed", e);
                return ClassificationResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            }
            scores = aggregator.direct(categories, prediction);
        } else {
            final List<TokenChunk> chunks = effectiveChunker.split(tokens, handle.tokenizer());
            final List<ChunkScores> chunkScores = invoker.classifyChunks(chunks, categories, handle.classifier());
            final long failed = chunkScores.stream().filter(ChunkScores::failed).count();
            if (failed > 0) {
                log.warn("{} of {} chunks failed and were scored as zero", failed, chunkScores.size());
            }
            scores = aggregator.aggregate(categories, chunkScores);
        }

        final double seconds = BigDecimal.valueOf((System.nanoTime() - started) / 1_000_000_000.0)
                .setScale(3, RoundingMode.HALF_UP)
                .doubleValue();

        log.info("Classification completed: {} ({}) using {} chunks via {}",
                scores.predictedCategory(), scores.confidenceScore(), scores.chunksUsed(), scores.method().label());

        return ClassificationResult.of(scores, tokens.length, seconds, handle.descriptor());
    }

    private List<String> resolveCategories(final List<String> requested) {
        final List<String> source = requested == null || requested.isEmpty() ? config.getCategories() : requested;
        final LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String category : source) {
            if (StringUtils.isNotBlank(category)) {
                unique.add(category.trim());
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }

    public List<ESupportedModel> listAvailableModels() {
        return modelRegistry.listAvailableModels();
    }
}
