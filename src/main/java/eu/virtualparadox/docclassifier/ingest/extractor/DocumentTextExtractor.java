package eu.virtualparadox.docclassifier.ingest.extractor;

import eu.virtualparadox.docclassifier.ingest.cleaner.TextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks the extractor matching a file's extension and cleans its output.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentTextExtractor {

    private final List<TextExtractor> extractors;
    private final TextCleaner textCleaner;

    /**
     * @param path file to read
     * @return cleaned text (possibly empty)
     * @throws IllegalArgumentException if no extractor supports the file type
     * @throws IllegalStateException    if reading or parsing fails
     */
    public String extract(final Path path) {
        final String fileType = fileTypeOf(path.getFileName().toString());
        final TextExtractor extractor = extractors.stream()
                .filter(e -> e.supports(fileType))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported file type: " + fileType + ". Supported types: txt, pdf"));

        final String cleaned = textCleaner.cleanText(extractor.extractText(path));
        log.debug("Extracted {} characters from {}", cleaned.length(), path);
        return cleaned;
    }

    public boolean isSupported(final Path path) {
        final String fileType = fileTypeOf(path.getFileName().toString());
        return extractors.stream().anyMatch(e -> e.supports(fileType));
    }

    static String fileTypeOf(final String filename) {
        final int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "unknown";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
