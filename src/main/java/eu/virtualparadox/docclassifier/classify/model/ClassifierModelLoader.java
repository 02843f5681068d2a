package eu.virtualparadox.docclassifier.classify.model;

/**
 * Builds and initializes a {@link ClassifierModel}.
 */
@FunctionalInterface
public interface ClassifierModelLoader {

    /**
     * @param model model to load
     * @return an initialized handle
     * @throws ModelUnavailableException if the artifacts are missing or cannot be loaded
     */
    ClassifierModel load(ESupportedModel model);
}
