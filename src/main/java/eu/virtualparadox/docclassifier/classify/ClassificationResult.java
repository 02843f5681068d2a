package eu.virtualparadox.docclassifier.classify;

import eu.virtualparadox.docclassifier.classify.aggregate.AggregatedScores;
import eu.virtualparadox.docclassifier.classify.aggregate.EAggregationMethod;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;

import java.util.List;
import java.util.Map;

/**
 * Outcome of classifying one document. Either a full decision or, when {@link #error()} is
 * set, the fallback category {@value #FALLBACK_CATEGORY} with zero confidence and no scores.
 */
public record ClassificationResult(String predictedCategory,
                                   double confidenceScore,
                                   Map<String, Double> allScores,
                                   int chunksUsed,
                                   EAggregationMethod aggregationMethod,
                                   String majorityVote,
                                   Map<String, Double> weightedScores,
                                   List<String> chunkPredictions,
                                   int tokenCount,
                                   boolean wasTruncated,
                                   double inferenceTimeSeconds,
                                   String modelKey,
                                   String modelId,
                                   String modelName,
                                   String error) {

    public static final String FALLBACK_CATEGORY = "Other";

    public static ClassificationResult error(final String message) {
        return new ClassificationResult(FALLBACK_CATEGORY, 0.0, Map.of(), 0, null, null,
                Map.of(), List.of(), 0, false, 0.0, null, null, null, message);
    }

    public static ClassificationResult of(final AggregatedScores scores,
                                          final int tokenCount,
                                          final double inferenceTimeSeconds,
                                          final ESupportedModel model) {
        return new ClassificationResult(
                scores.predictedCategory(),
                scores.confidenceScore(),
                scores.allScores(),
                scores.chunksUsed(),
                scores.method(),
                scores.majorityVote(),
                scores.weightedScores(),
                scores.chunkPredictions(),
                tokenCount,
                false,
                inferenceTimeSeconds,
                model.key(),
                model.modelId(),
                model.displayName(),
                null);
    }

    public boolean isError() {
        return error != null;
    }
}
