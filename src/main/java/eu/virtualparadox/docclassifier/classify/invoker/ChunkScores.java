package eu.virtualparadox.docclassifier.classify.invoker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-category scores of one attempted chunk, in category order.
 *
 * @param chunkIndex position of the chunk in chunk order
 * @param scores     score per category; every category is present
 * @param failed     {@code true} if classification failed and all scores are zero
 */
public record ChunkScores(int chunkIndex, Map<String, Double> scores, boolean failed) {

    public ChunkScores {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static ChunkScores failed(final int chunkIndex, final List<String> categories) {
        final Map<String, Double> zeros = new LinkedHashMap<>();
        for (String category : categories) {
            zeros.put(category, 0.0);
        }
        return new ChunkScores(chunkIndex, zeros, true);
    }

    public double score(final String category) {
        return scores.getOrDefault(category, 0.0);
    }

    /**
     * The category with this chunk's highest score; the earliest category wins a tie.
     * Failed chunks have no vote.
     */
    public String vote() {
        if (failed) {
            return null;
        }
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        return best;
    }
}
