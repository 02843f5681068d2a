package eu.virtualparadox.docclassifier.classify.model;

/**
 * Raised when a model or its tokenizer cannot be initialized.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(final String message) {
        super(message);
    }

    public ModelUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
