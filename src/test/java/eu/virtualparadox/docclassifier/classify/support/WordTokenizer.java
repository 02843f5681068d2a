package eu.virtualparadox.docclassifier.classify.support;

import eu.virtualparadox.docclassifier.classify.tokenizer.TextTokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Whitespace tokenizer: one token per word, ids assigned on first sight.
 */
public class WordTokenizer implements TextTokenizer {

    private final Map<String, Long> ids = new HashMap<>();
    private final List<String> words = new ArrayList<>();

    /**
     * Builds a text of exactly {@code count} distinct words: {@code w0 w1 ... w<count-1>}.
     */
    public static String words(final int count) {
        return IntStream.range(0, count).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }

    @Override
    public synchronized long[] encode(final String text) {
        final String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return new long[0];
        }
        final String[] parts = trimmed.split("\\s+");
        final long[] out = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            out[i] = ids.computeIfAbsent(parts[i], w -> {
                words.add(w);
                return (long) (words.size() - 1);
            });
        }
        return out;
    }

    @Override
    public synchronized String decode(final long[] tokens) {
        final StringBuilder sb = new StringBuilder();
        for (long token : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(words.get((int) token));
        }
        return sb.toString();
    }
}
