package eu.virtualparadox.docclassifier.ingest.extractor;

import java.nio.file.Path;

public interface TextExtractor {

    /**
     * @param fileType lower-case file extension without the dot
     */
    boolean supports(final String fileType);

    String extractText(final Path path);

}
