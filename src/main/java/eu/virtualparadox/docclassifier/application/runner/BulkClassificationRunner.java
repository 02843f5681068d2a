package eu.virtualparadox.docclassifier.application.runner;

import eu.virtualparadox.docclassifier.classify.ClassificationResult;
import eu.virtualparadox.docclassifier.classify.DocumentClassificationService;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;
import eu.virtualparadox.docclassifier.ingest.extractor.DocumentTextExtractor;
import eu.virtualparadox.docclassifier.job.ClassificationJob;
import eu.virtualparadox.docclassifier.job.ClassificationJobManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the files passed as non-option command line arguments and logs one summary
 * line per file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BulkClassificationRunner implements ApplicationRunner {

    private final ClassificationJobManager jobManager;
    private final DocumentTextExtractor textExtractor;
    private final DocumentClassificationService classificationService;

    @Override
    public void run(final ApplicationArguments args) throws Exception {
        final List<Path> files = new ArrayList<>();
        for (String arg : args.getNonOptionArgs()) {
            final Path path = Path.of(arg);
            if (!Files.isRegularFile(path)) {
                log.warn("Skipping {}: not a regular file", path);
            } else if (!textExtractor.isSupported(path)) {
                log.warn("Skipping {}: unsupported file type", path);
            } else {
                files.add(path);
            }
        }
        if (files.isEmpty()) {
            log.info("No input files given, nothing to classify. Available models:");
            for (ESupportedModel model : classificationService.listAvailableModels()) {
                log.info(" - {} ({}): {}", model.key(), model.modelId(), model.description());
            }
            return;
        }

        log.info("Classifying {} file(s)", files.size());
        final List<ClassificationJob> jobs = jobManager.submitAllAndWait(files);

        for (ClassificationJob job : jobs) {
            final ClassificationResult result = job.getResult();
            if (result == null || result.isError()) {
                log.info(" - {}: {} ({})", job.getSource(), job.getStatus(), job.getErrorMessage());
                continue;
            }
            log.info(" - {}: {} [{}] method={} chunks={} tokens={} majority={} scores={}",
                    job.getSource(),
                    result.predictedCategory(),
                    result.confidenceScore(),
                    result.aggregationMethod().label(),
                    result.chunksUsed(),
                    result.tokenCount(),
                    result.majorityVote(),
                    result.allScores());
        }
    }
}
