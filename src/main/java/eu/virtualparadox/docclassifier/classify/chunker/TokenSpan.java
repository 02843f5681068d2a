package eu.virtualparadox.docclassifier.classify.chunker;

/**
 * Half-open range {@code [start, end)} into a document's token sequence.
 */
public record TokenSpan(int start, int end) {

    public TokenSpan {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid token span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
