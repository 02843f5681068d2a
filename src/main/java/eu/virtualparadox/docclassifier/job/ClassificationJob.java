package eu.virtualparadox.docclassifier.job;

import eu.virtualparadox.docclassifier.classify.ClassificationResult;

import java.nio.file.Path;

public class ClassificationJob {
    private final long id;
    private final Path source;
    private volatile EJobStatus status;
    private volatile ClassificationResult result;
    private volatile String errorMessage;
    private volatile String preview;

    public ClassificationJob(long id, Path source) {
        this.id = id;
        this.source = source;
        this.status = EJobStatus.QUEUED;
    }

    public long getId() { return id; }
    public Path getSource() { return source; }
    public EJobStatus getStatus() { return status; }
    public ClassificationResult getResult() { return result; }
    public String getErrorMessage() { return errorMessage; }
    public String getPreview() { return preview; }

    public void setStatus(EJobStatus status) { this.status = status; }
    public void setResult(ClassificationResult result) { this.result = result; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public void setPreview(String preview) { this.preview = preview; }
}
