package eu.virtualparadox.docclassifier.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.text.Normalizer;

/**
 * PDF extractor based on Apache PDFBox. Pages are stripped one at a time and joined with a
 * newline so that words at page borders do not run together.
 */
@Service
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public boolean supports(final String fileType) {
        return "pdf".equals(fileType);
    }

    @Override
    public String extractText(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder(100_000);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                text.append(pageText).append('\n');
            }
            return text.toString().strip();
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to extract text from PDF " + path, e);
        }
    }
}
