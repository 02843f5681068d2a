package eu.virtualparadox.docclassifier.classify.aggregate;

import eu.virtualparadox.docclassifier.classify.invoker.ChunkScores;
import eu.virtualparadox.docclassifier.classify.zeroshot.ZeroShotPrediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-chunk category scores into one decision.
 *
 * <h2>Strategies</h2>
 * <ul>
 *   <li><strong>Mean probabilities:</strong> per category, the average score over all attempted
 *       chunks. Failed chunks count as zero and pull the mean down.</li>
 *   <li><strong>Majority vote:</strong> every successful chunk votes for its top category; the most
 *       voted category wins, a tie goes to the category that was voted for first.</li>
 *   <li><strong>Confidence-weighted average:</strong> per category, {@code sum(score * score)}
 *       divided by one shared normalizer, the sum of the <em>first</em> category's scores.
 *       Kept for compatibility with existing results even though a per-category normalizer
 *       would be the textbook choice; values may therefore exceed 1.</li>
 * </ul>
 *
 * <h2>Selection</h2>
 * The weighted winner replaces the mean winner only if its score is more than 10% above the
 * mean winner's score. The majority vote is reported but never selected. Selection runs on
 * raw values; only the reported numbers are rounded.
 */
@Component
@Slf4j
public class ScoreAggregator {

    static final double WEIGHTED_OVERRIDE_MARGIN = 1.1;
    static final int REPORTED_CHUNK_PREDICTIONS = 5;
    private static final int SCALE = 4;

    /**
     * Aggregates the scores of a chunked document.
     *
     * @param categories  ordered, unique categories
     * @param chunkScores one entry per attempted chunk, in chunk order (non-empty)
     * @return aggregated decision
     */
    public AggregatedScores aggregate(final List<String> categories, final List<ChunkScores> chunkScores) {
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("categories cannot be empty");
        }
        if (chunkScores.isEmpty()) {
            throw new IllegalArgumentException("chunkScores cannot be empty");
        }

        final Map<String, Double> mean = meanProbabilities(categories, chunkScores);
        final Map<String, Double> weighted = weightedAverage(categories, chunkScores);
        final List<String> votes = votes(chunkScores);

        final String meanWinner = argmax(mean);
        final double meanConfidence = mean.get(meanWinner);
        final String weightedWinner = argmax(weighted);
        final double weightedConfidence = weighted.get(weightedWinner);

        final String majority = votes.isEmpty() ? meanWinner : majorityVote(votes);

        final String predicted;
        final double confidence;
        final EAggregationMethod method;
        if (weightedConfidence > meanConfidence * WEIGHTED_OVERRIDE_MARGIN) {
            predicted = weightedWinner;
            confidence = weightedConfidence;
            method = EAggregationMethod.WEIGHTED_AVERAGE;
        } else {
            predicted = meanWinner;
            confidence = meanConfidence;
            method = EAggregationMethod.MEAN_PROBABILITIES;
        }

        log.debug("Aggregated {} chunks: mean={} ({}), weighted={} ({}), majority={}, selected={}",
                chunkScores.size(), meanWinner, meanConfidence, weightedWinner, weightedConfidence, majority, method);

        return new AggregatedScores(
                predicted,
                round(confidence),
                roundAll(mean),
                chunkScores.size(),
                method,
                majority,
                roundAll(weighted),
                List.copyOf(votes.subList(0, Math.min(REPORTED_CHUNK_PREDICTIONS, votes.size())))
        );
    }

    /**
     * Wraps a single classification of the whole text.
     *
     * @param categories ordered, unique categories
     * @param prediction result of classifying the full text once
     * @return decision with {@link EAggregationMethod#DIRECT} and one chunk
     */
    public AggregatedScores direct(final List<String> categories, final ZeroShotPrediction prediction) {
        final Map<String, Double> byLabel = new HashMap<>();
        for (int i = 0; i < prediction.labels().size(); i++) {
            byLabel.put(prediction.labels().get(i), prediction.scores().get(i));
        }
        final Map<String, Double> scores = new LinkedHashMap<>();
        for (String category : categories) {
            scores.put(category, byLabel.getOrDefault(category, 0.0));
        }

        final String top = prediction.topLabel() != null ? prediction.topLabel() : argmax(scores);
        final double topScore = scores.getOrDefault(top, prediction.topScore());
        final Map<String, Double> rounded = roundAll(scores);

        return new AggregatedScores(
                top,
                round(topScore),
                rounded,
                1,
                EAggregationMethod.DIRECT,
                top,
                rounded,
                List.of(top)
        );
    }

    static Map<String, Double> meanProbabilities(final List<String> categories, final List<ChunkScores> chunkScores) {
        final Map<String, Double> mean = new LinkedHashMap<>();
        for (String category : categories) {
            double sum = 0.0;
            for (ChunkScores chunk : chunkScores) {
                sum += chunk.score(category);
            }
            mean.put(category, sum / chunkScores.size());
        }
        return mean;
    }

    static Map<String, Double> weightedAverage(final List<String> categories, final List<ChunkScores> chunkScores) {
        // shared normalizer: total weight of the first category only
        double totalWeight = 0.0;
        final String first = categories.get(0);
        for (ChunkScores chunk : chunkScores) {
            totalWeight += chunk.score(first);
        }

        final Map<String, Double> weighted = new LinkedHashMap<>();
        for (String category : categories) {
            double weightedSum = 0.0;
            for (ChunkScores chunk : chunkScores) {
                final double score = chunk.score(category);
                weightedSum += score * score;
            }
            weighted.put(category, totalWeight > 0.0 ? weightedSum / totalWeight : 0.0);
        }
        return weighted;
    }

    static List<String> votes(final List<ChunkScores> chunkScores) {
        final List<String> votes = new ArrayList<>(chunkScores.size());
        for (ChunkScores chunk : chunkScores) {
            final String vote = chunk.vote();
            if (vote != null) {
                votes.add(vote);
            }
        }
        return votes;
    }

    static String majorityVote(final List<String> votes) {
        // insertion order = order of first vote, so the first-voted category wins ties
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (String vote : votes) {
            counts.merge(vote, 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static String argmax(final Map<String, Double> scores) {
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

    static double round(final double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Map<String, Double> roundAll(final Map<String, Double> scores) {
        final Map<String, Double> rounded = new LinkedHashMap<>();
        scores.forEach((category, score) -> rounded.put(category, round(score)));
        return Collections.unmodifiableMap(rounded);
    }
}
