package eu.virtualparadox.docclassifier.classify.tokenizer;

import ai.djl.huggingface.tokenizers.Encoding;
import eu.virtualparadox.docclassifier.classify.support.WordTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the DJL-backed tokenizer against a small word-level {@code tokenizer.json}.
 */
class HuggingFaceTextTokenizerTest {

    private static final int VOCABULARY_WORDS = 2000;
    private static final int MAX_PAIR_TOKENS = 16;
    private static final String HYPOTHESIS = "This example is Legal.";

    @TempDir
    Path tempDir;

    private HuggingFaceTextTokenizer tokenizer;

    @BeforeEach
    void setUp() throws IOException {
        tokenizer = new HuggingFaceTextTokenizer(writeWordLevelTokenizer(tempDir), MAX_PAIR_TOKENS);
        tokenizer.initialize();
    }

    @AfterEach
    void tearDown() {
        tokenizer.release();
    }

    /**
     * Whitespace pre-tokenizer, word-level model over {@code w0..w1999} plus the hypothesis words,
     * no post-processor and no decoder.
     */
    private static Path writeWordLevelTokenizer(final Path dir) throws IOException {
        final StringBuilder vocab = new StringBuilder("\"[UNK]\":0,\"This\":1,\"example\":2,\"is\":3,\"Legal\":4,\".\":5");
        for (int i = 0; i < VOCABULARY_WORDS; i++) {
            vocab.append(",\"w").append(i).append("\":").append(i + 6);
        }
        final String json = "{\"version\":\"1.0\",\"truncation\":null,\"padding\":null,\"added_tokens\":[],"
                + "\"normalizer\":null,\"pre_tokenizer\":{\"type\":\"Whitespace\"},\"post_processor\":null,"
                + "\"decoder\":null,\"model\":{\"type\":\"WordLevel\",\"vocab\":{" + vocab + "},\"unk_token\":\"[UNK]\"}}";
        return Files.writeString(dir.resolve("tokenizer.json"), json, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Encoding counts every token of a long document")
    void encodeDoesNotTruncate() {
        long[] ids = tokenizer.encode(WordTokenizer.words(VOCABULARY_WORDS));

        assertThat(ids).hasSize(VOCABULARY_WORDS);
        assertThat(ids[VOCABULARY_WORDS - 1]).isEqualTo(VOCABULARY_WORDS - 1 + 6L);
    }

    @Test
    @DisplayName("Decoding a window gives back its words")
    void decodeKeepsWords() {
        String text = WordTokenizer.words(600);
        long[] ids = tokenizer.encode(text);

        assertThat(tokenizer.decode(ids)).isEqualTo(text);
        assertThat(tokenizer.decode(Arrays.copyOfRange(ids, 590, 600)))
                .isEqualTo("w590 w591 w592 w593 w594 w595 w596 w597 w598 w599");
    }

    @Test
    @DisplayName("A long premise is cut, the hypothesis is kept whole")
    void pairKeepsHypothesis() {
        long[] hypothesis = tokenizer.encode(HYPOTHESIS);

        Encoding pair = tokenizer.encodePair(WordTokenizer.words(1500), HYPOTHESIS);
        long[] ids = pair.getIds();

        assertThat(ids).hasSize(MAX_PAIR_TOKENS);
        assertThat(Arrays.copyOfRange(ids, ids.length - hypothesis.length, ids.length)).containsExactly(hypothesis);
        assertThat(ids[0]).isEqualTo(6L);
        assertThat(pair.getAttentionMask()).hasSize(MAX_PAIR_TOKENS);
    }

    @Test
    @DisplayName("A pair within the limit is left intact")
    void shortPairIsUntouched() {
        long[] ids = tokenizer.encodePair("w1 w2 w3", HYPOTHESIS).getIds();

        assertThat(ids).containsExactly(7L, 8L, 9L, 1L, 2L, 3L, 4L, 5L);
    }

    @Test
    @DisplayName("Use after release fails loudly")
    void releasedTokenizerRejectsCalls() {
        tokenizer.release();

        assertThatThrownBy(() -> tokenizer.encode("w1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tokenizer.json");
    }
}
