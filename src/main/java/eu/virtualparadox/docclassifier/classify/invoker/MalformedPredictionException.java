package eu.virtualparadox.docclassifier.classify.invoker;

/**
 * The zero-shot primitive returned output that does not match its contract.
 */
public class MalformedPredictionException extends RuntimeException {

    public MalformedPredictionException(final String message) {
        super(message);
    }
}
