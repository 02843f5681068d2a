package eu.virtualparadox.docclassifier.job;

public enum EJobStatus {
    QUEUED,
    EXTRACTING,
    CLASSIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
