package eu.virtualparadox.docclassifier.classify.tokenizer;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link TextTokenizer} backed by DJL {@link HuggingFaceTokenizer}s loaded from a
 * {@code tokenizer.json} file.
 *
 * <p>Two instances are built from the same file. The one behind {@link #encode(String)} and
 * {@link #decode(long[])} never truncates, so token counts and chunk windows see the whole
 * document. The pair encoder used for inference is capped at {@code maxPairTokens} and only
 * ever cuts the premise, so the hypothesis and the closing special tokens always reach the
 * model.</p>
 */
@Slf4j
public final class HuggingFaceTextTokenizer implements TextTokenizer {

    private final Path tokenizerPath;
    private final int maxPairTokens;

    private HuggingFaceTokenizer tokenizer;
    private HuggingFaceTokenizer pairTokenizer;

    public HuggingFaceTextTokenizer(final Path tokenizerPath, final int maxPairTokens) {
        this.tokenizerPath = tokenizerPath;
        this.maxPairTokens = maxPairTokens;
    }

    public void initialize() throws IOException {
        if (tokenizer != null) {
            return;
        }
        final HuggingFaceTokenizer counting = HuggingFaceTokenizer.builder()
                .optTokenizerPath(tokenizerPath)
                .optTruncation(false)
                .optPadding(false)
                .build();
        try {
            this.pairTokenizer = HuggingFaceTokenizer.builder()
                    .optTokenizerPath(tokenizerPath)
                    .optMaxLength(maxPairTokens)
                    .optTruncateFirstOnly()
                    .optPadding(false)
                    .build();
        } catch (IOException | RuntimeException e) {
            counting.close();
            throw e;
        }
        this.tokenizer = counting;
        log.info("Loaded tokenizer: {} (pair limit {} tokens)", tokenizerPath, maxPairTokens);
    }

    public void release() {
        if (tokenizer != null) {
            tokenizer.close();
            tokenizer = null;
        }
        if (pairTokenizer != null) {
            pairTokenizer.close();
            pairTokenizer = null;
        }
    }

    /**
     * Encodes a premise/hypothesis pair with special tokens, as the NLI model expects.
     * A premise too long for {@code maxPairTokens} is cut from its end.
     */
    public Encoding encodePair(final String premise, final String hypothesis) {
        requireLoaded();
        return pairTokenizer.encode(premise, hypothesis);
    }

    @Override
    public long[] encode(final String text) {
        return requireLoaded().encode(text, false, false).getIds();
    }

    @Override
    public String decode(final long[] tokens) {
        return requireLoaded().decode(tokens, true);
    }

    private HuggingFaceTokenizer requireLoaded() {
        if (tokenizer == null) {
            throw new IllegalStateException("Tokenizer not initialized: " + tokenizerPath);
        }
        return tokenizer;
    }
}
