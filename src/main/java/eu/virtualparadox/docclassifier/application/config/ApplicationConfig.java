package eu.virtualparadox.docclassifier.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration bound from {@code docclassifier.*} properties.
 * <p>Model artifacts are expected under {@code models/<model-key>/model.onnx} and
 * {@code models/<model-key>/tokenizer.json}.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "docclassifier")
@Getter @Setter
public class ApplicationConfig {

    private Path models;
    private String defaultModel = "bart-large-mnli";
    private boolean eagerLoad = false;
    private List<String> categories = new ArrayList<>(List.of(
            "Technical Documentation",
            "Business Proposal",
            "Legal Document",
            "Academic Paper",
            "General Article"
    ));
    private int inferenceSlots = 1;
    private final Chunking chunking = new Chunking();
    private final Bulk bulk = new Bulk();
    private final Ort ort = new Ort();

    @Getter @Setter
    public static class Chunking {
        private int maxChunkTokens = 900;
        private double overlapFraction = 0.2;
    }

    @Getter @Setter
    public static class Bulk {
        private int workers = 2;
        private int awaitTerminationSeconds = 60;
    }

    @Getter @Setter
    public static class Ort {
        /** Zero or negative means "all cores but one". */
        private int intraOpThreads = 0;
    }
}
