package eu.virtualparadox.docclassifier.classify.chunker;

/**
 * One window of a document.
 *
 * @param index zero-based position in chunk order
 * @param span  token range covered
 * @param text  tokenizer decoding of the tokens in {@code span}
 */
public record TokenChunk(int index, TokenSpan span, String text) {
}
