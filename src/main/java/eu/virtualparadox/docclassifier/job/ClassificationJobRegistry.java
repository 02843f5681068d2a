package eu.virtualparadox.docclassifier.job;

import eu.virtualparadox.docclassifier.classify.ClassificationResult;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ClassificationJobRegistry {

    private final AtomicLong counter;
    private final Map<Long, ClassificationJob> jobs;

    public ClassificationJobRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public ClassificationJob createJob(Path source) {
        long id = counter.incrementAndGet();
        ClassificationJob job = new ClassificationJob(id, source);
        jobs.put(id, job);
        return job;
    }

    public void updateStatus(long id, EJobStatus status) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(status);
            return job;
        });
    }

    public void complete(long id, ClassificationResult result) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setResult(result);
            job.setErrorMessage(result.error());
            job.setStatus(result.isError() ? EJobStatus.FAILED : EJobStatus.COMPLETED);
            return job;
        });
    }

    public void fail(long id, String errorMessage) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setErrorMessage(errorMessage);
            job.setStatus(EJobStatus.FAILED);
            return job;
        });
    }
}
