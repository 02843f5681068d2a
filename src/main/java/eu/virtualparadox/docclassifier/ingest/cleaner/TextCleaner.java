package eu.virtualparadox.docclassifier.ingest.cleaner;

import org.springframework.stereotype.Component;

@Component
public class TextCleaner {

    public static final int DEFAULT_PREVIEW_LENGTH = 200;

    /**
     * Cleans extracted text by removing control characters, zero-width spaces,
     * and normalizing whitespace while keeping diacritics.
     *
     * @param input raw text (may be null)
     * @return cleaned text, never null
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return input
                // line breaks -> space
                .replaceAll("[\\r\\n]+", " ")
                // zero-width and similar -> space
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> space
                .replace('\u00A0', ' ')
                // soft hyphen
                .replace("\u00AD", "")
                .replaceAll("\\p{Cf}", " ")
                .replaceAll("\\p{Cc}", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Short preview for logs and job listings.
     *
     * @param content   text (may be null)
     * @param maxLength maximum characters kept before the ellipsis
     * @return trimmed text, cut at {@code maxLength} with {@code "..."} appended when longer
     */
    public String preview(final String content, final int maxLength) {
        if (content == null || content.isBlank()) {
            return "";
        }
        final String trimmed = content.strip();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, maxLength) + "...";
    }
}
