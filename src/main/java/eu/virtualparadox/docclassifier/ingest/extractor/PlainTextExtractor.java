package eu.virtualparadox.docclassifier.ingest.extractor;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code .txt} files as UTF-8.
 */
@Service
public final class PlainTextExtractor implements TextExtractor {

    @Override
    public boolean supports(final String fileType) {
        return "txt".equals(fileType);
    }

    @Override
    public String extractText(final Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read text file " + path, e);
        }
    }
}
