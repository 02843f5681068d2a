package eu.virtualparadox.docclassifier.classify.chunker;

import eu.virtualparadox.docclassifier.classify.tokenizer.TextTokenizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a token sequence into overlapping fixed-size windows.
 *
 * <h2>Algorithm</h2>
 * Starting at offset 0, take up to {@code maxChunkTokens} tokens; stop once a window reaches
 * the end of the sequence, otherwise move the start forward by
 * {@code maxChunkTokens - overlapTokens}. Consequences:
 * <ul>
 *   <li>the windows cover {@code [0, N)} without gaps;</li>
 *   <li>consecutive windows share exactly {@code overlapTokens} tokens, except that the last
 *       window may share more;</li>
 *   <li>the last window always ends at {@code N} and may be shorter than the others.</li>
 * </ul>
 * Each window is decoded back to text through the tokenizer, so chunk text follows token
 * boundaries rather than character offsets.
 *
 * <h2>Thread-safety</h2>
 * Stateless after construction.
 */
public class TokenChunker {

    private final ChunkingParams params;

    public TokenChunker(final ChunkingParams params) {
        this.params = params;
    }

    public ChunkingParams params() {
        return params;
    }

    /**
     * Returns a chunker whose windows hold at most {@code maxTokens} tokens, keeping the overlap
     * fraction. Returns {@code this} when the configured size already fits.
     *
     * @param maxTokens window size limit, typically the model's premise budget
     */
    public TokenChunker limitedTo(final int maxTokens) {
        if (maxTokens >= params.maxChunkTokens()) {
            return this;
        }
        return new TokenChunker(new ChunkingParams(maxTokens, params.overlapFraction()));
    }

    /**
     * @return {@code true} if a document of {@code tokenCount} tokens has to be split
     */
    public boolean needsChunking(final int tokenCount) {
        return tokenCount > params.maxChunkTokens();
    }

    /**
     * Computes the window boundaries for a sequence of {@code totalTokens} tokens.
     *
     * @param totalTokens sequence length (non-negative)
     * @return ordered spans; empty for an empty sequence
     */
    public List<TokenSpan> spans(final int totalTokens) {
        if (totalTokens < 0) {
            throw new IllegalArgumentException("totalTokens cannot be negative");
        }
        final List<TokenSpan> spans = new ArrayList<>();
        final int maxTokens = params.maxChunkTokens();
        final int stride = params.stride();

        int start = 0;
        while (start < totalTokens) {
            final int end = Math.min(start + maxTokens, totalTokens);
            spans.add(new TokenSpan(start, end));
            if (end == totalTokens) {
                break;
            }
            start += stride;
        }
        return spans;
    }

    /**
     * Splits and decodes {@code tokens}.
     *
     * @param tokens    full document token sequence
     * @param tokenizer tokenizer used to decode each window
     * @return ordered chunks covering the whole sequence
     */
    public List<TokenChunk> split(final long[] tokens, final TextTokenizer tokenizer) {
        final List<TokenSpan> spans = spans(tokens.length);
        final List<TokenChunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            final TokenSpan span = spans.get(i);
            final long[] window = Arrays.copyOfRange(tokens, span.start(), span.end());
            chunks.add(new TokenChunk(i, span, tokenizer.decode(window)));
        }
        return chunks;
    }
}
