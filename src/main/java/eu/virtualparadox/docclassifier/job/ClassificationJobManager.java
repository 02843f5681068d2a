package eu.virtualparadox.docclassifier.job;

import eu.virtualparadox.docclassifier.application.executor.ClassificationExecutor;
import eu.virtualparadox.docclassifier.classify.ClassificationResult;
import eu.virtualparadox.docclassifier.classify.DocumentClassificationService;
import eu.virtualparadox.docclassifier.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docclassifier.ingest.extractor.DocumentTextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs extraction + classification of files on the {@link ClassificationExecutor}.
 * <p>Workers may run in parallel; access to the model itself is bounded by the inference gate
 * inside {@link DocumentClassificationService}.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClassificationJobManager {

    private final DocumentTextExtractor textExtractor;
    private final TextCleaner textCleaner;
    private final DocumentClassificationService classificationService;
    private final ClassificationJobRegistry registry;
    private final ClassificationExecutor classificationExecutor;

    /**
     * Submits every file and blocks until all of them reached a terminal state.
     *
     * @param files files to classify
     * @return the jobs, in submission order
     */
    public List<ClassificationJob> submitAllAndWait(final List<Path> files) throws InterruptedException {
        final List<Submission> submissions = new ArrayList<>(files.size());
        for (Path file : files) {
            submissions.add(submitAsync(file));
        }

        final List<ClassificationJob> jobs = new ArrayList<>(submissions.size());
        for (Submission submission : submissions) {
            try {
                submission.future().get();
            } catch (ExecutionException e) {
                log.error("Job {} terminated abnormally", submission.job().getId(), e.getCause());
                registry.fail(submission.job().getId(), String.valueOf(e.getCause()));
            }
            jobs.add(submission.job());
        }
        return jobs;
    }

    private Submission submitAsync(final Path file) {
        final ClassificationJob job = registry.createJob(file);
        final Future<?> future = classificationExecutor.submit(() -> process(job));
        return new Submission(job, future);
    }

    private void process(final ClassificationJob job) {
        try {
            registry.updateStatus(job.getId(), EJobStatus.EXTRACTING);
            final String text = textExtractor.extract(job.getSource());
            job.setPreview(textCleaner.preview(text, TextCleaner.DEFAULT_PREVIEW_LENGTH));

            registry.updateStatus(job.getId(), EJobStatus.CLASSIFYING);
            final ClassificationResult result = classificationService.classifyDocumentText(text);
            registry.complete(job.getId(), result);

            if (result.isError()) {
                log.warn("Job {} ({}) produced no classification: {}", job.getId(), job.getSource(), result.error());
            } else {
                log.info("Job {} ({}) classified as {} ({})", job.getId(), job.getSource(),
                        result.predictedCategory(), result.confidenceScore());
            }
        } catch (Exception ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.fail(job.getId(), ex.getMessage());
        }
    }

    private record Submission(ClassificationJob job, Future<?> future) {
    }
}
