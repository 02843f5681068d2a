package eu.virtualparadox.docclassifier.classify.aggregate;

import java.util.List;
import java.util.Map;

/**
 * Document-level decision combined from per-chunk scores.
 *
 * @param predictedCategory selected category
 * @param confidenceScore   score of the selected category, rounded to 4 decimals
 * @param allScores         mean probability per category, rounded
 * @param chunksUsed        number of attempted chunks
 * @param method            strategy the prediction was taken from
 * @param majorityVote      most frequent per-chunk winner; informational only
 * @param weightedScores    confidence-weighted score per category, rounded
 * @param chunkPredictions  per-chunk winners of the first chunks, in chunk order
 */
public record AggregatedScores(String predictedCategory,
                               double confidenceScore,
                               Map<String, Double> allScores,
                               int chunksUsed,
                               EAggregationMethod method,
                               String majorityVote,
                               Map<String, Double> weightedScores,
                               List<String> chunkPredictions) {
}
