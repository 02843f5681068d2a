package eu.virtualparadox.docclassifier.classify.invoker;

import eu.virtualparadox.docclassifier.classify.chunker.TokenChunk;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotClassifier;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotPrediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the zero-shot primitive once per chunk, in chunk order.
 *
 * <p>A failing chunk (exception or malformed output) is logged and recorded with a zero
 * score for every category; the remaining chunks are still classified.</p>
 */
@Component
@Slf4j
public class ChunkClassificationInvoker {

    /**
     * @param chunks     chunks in document order
     * @param categories ordered, unique categories
     * @param classifier zero-shot primitive
     * @return one entry per attempted chunk, same order as {@code chunks}
     */
    public List<ChunkScores> classifyChunks(final List<TokenChunk> chunks,
                                            final List<String> categories,
                                            final ZeroShotClassifier classifier) {
        final List<ChunkScores> results = new ArrayList<>(chunks.size());
        for (TokenChunk chunk : chunks) {
            results.add(classifyChunk(chunk, categories, classifier));
        }
        return results;
    }

    private ChunkScores classifyChunk(final TokenChunk chunk,
                                      final List<String> categories,
                                      final ZeroShotClassifier classifier) {
        try {
            final ZeroShotPrediction prediction = classifier.classify(chunk.text(), categories);
            final ChunkScores scores = toChunkScores(chunk.index(), prediction, categories);
            log.debug("Processed chunk {} {}: top={}", chunk.index(), chunk.span(), scores.vote());
            return scores;
        } catch (RuntimeException e) {
            log.warn("Classification of chunk {} {} failed, scoring it as zero: {}",
                    chunk.index(), chunk.span(), e.getMessage(), e);
            return ChunkScores.failed(chunk.index(), categories);
        }
    }

    /**
     * Maps a prediction onto the category order.
     *
     * @throws MalformedPredictionException if the prediction cannot be trusted
     */
    static ChunkScores toChunkScores(final int chunkIndex,
                                     final ZeroShotPrediction prediction,
                                     final List<String> categories) {
        if (prediction == null) {
            throw new MalformedPredictionException("no prediction returned");
        }
        if (prediction.labels().size() != prediction.scores().size()) {
            throw new MalformedPredictionException("labels and scores differ in size: "
                    + prediction.labels().size() + " vs " + prediction.scores().size());
        }

        final Map<String, Double> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < prediction.labels().size(); i++) {
            final Double score = prediction.scores().get(i);
            if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                throw new MalformedPredictionException("score out of range for '"
                        + prediction.labels().get(i) + "': " + score);
            }
            byLabel.put(prediction.labels().get(i), score);
        }

        final Map<String, Double> ordered = new LinkedHashMap<>();
        for (String category : categories) {
            ordered.put(category, byLabel.getOrDefault(category, 0.0));
        }
        return new ChunkScores(chunkIndex, ordered, false);
    }
}
