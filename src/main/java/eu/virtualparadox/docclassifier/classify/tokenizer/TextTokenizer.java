package eu.virtualparadox.docclassifier.classify.tokenizer;

/**
 * Converts text to token ids and back. Used to measure document length and to materialize
 * chunk boundaries as text; the classifier does its own encoding.
 */
public interface TextTokenizer {

    /**
     * Encodes text without adding special tokens.
     *
     * @param text input text (non-null)
     * @return token ids in document order
     */
    long[] encode(String text);

    /**
     * Decodes token ids back to text, skipping special tokens. The result may differ from
     * the input in whitespace but keeps its content.
     *
     * @param tokens token ids
     * @return decoded text
     */
    String decode(long[] tokens);
}
