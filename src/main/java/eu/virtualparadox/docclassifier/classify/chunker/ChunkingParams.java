package eu.virtualparadox.docclassifier.classify.chunker;

/**
 * Token-window parameters for splitting long documents.
 *
 * @param maxChunkTokens  maximum tokens per chunk; documents at or below this size are not split
 * @param overlapFraction share of {@code maxChunkTokens} repeated at the start of the next chunk
 */
public record ChunkingParams(int maxChunkTokens, double overlapFraction) {

    public static final int DEFAULT_MAX_CHUNK_TOKENS = 900;
    public static final double DEFAULT_OVERLAP_FRACTION = 0.2;

    public ChunkingParams {
        if (maxChunkTokens <= 0) {
            throw new IllegalArgumentException("maxChunkTokens must be positive (was " + maxChunkTokens + ")");
        }
        if (overlapFraction < 0.0 || Double.isNaN(overlapFraction)) {
            throw new IllegalArgumentException("overlapFraction must be non-negative (was " + overlapFraction + ")");
        }
        final int overlap = (int) Math.floor(maxChunkTokens * overlapFraction);
        if (overlap >= maxChunkTokens) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + " tokens) must be less than maxChunkTokens (" + maxChunkTokens + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_MAX_CHUNK_TOKENS, DEFAULT_OVERLAP_FRACTION);
    }

    public int overlapTokens() {
        return (int) Math.floor(maxChunkTokens * overlapFraction);
    }

    /** Distance between the starts of two consecutive chunks. */
    public int stride() {
        return maxChunkTokens - overlapTokens();
    }
}
