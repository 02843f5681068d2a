package eu.virtualparadox.docclassifier.classify.aggregate;

public enum EAggregationMethod {
    DIRECT("direct"),
    MEAN_PROBABILITIES("mean_probabilities"),
    WEIGHTED_AVERAGE("weighted_average");

    private final String label;

    EAggregationMethod(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
