package eu.virtualparadox.docclassifier.classify;

import eu.virtualparadox.docclassifier.application.config.ApplicationConfig;
import eu.virtualparadox.docclassifier.classify.aggregate.EAggregationMethod;
import eu.virtualparadox.docclassifier.classify.aggregate.ScoreAggregator;
import eu.virtualparadox.docclassifier.classify.chunker.ChunkingParams;
import eu.virtualparadox.docclassifier.classify.chunker.TokenChunker;
import eu.virtualparadox.docclassifier.classify.invoker.ChunkClassificationInvoker;
import eu.virtualparadox.docclassifier.classify.model.ClassifierModelLoader;
import eu.virtualparadox.docclassifier.classify.model.ClassifierModelRegistry;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;
import eu.virtualparadox.docclassifier.classify.model.ModelUnavailableException;
import eu.virtualparadox.docclassifier.classify.support.ScriptedClassifier;
import eu.virtualparadox.docclassifier.classify.support.StubModel;
import eu.virtualparadox.docclassifier.classify.support.WordTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DocumentClassificationServiceTest {

    private static final Map<String, Double> LEGAL_SCORES = Map.of(
            "Legal Document", 0.8,
            "Business Proposal", 0.2);

    private ApplicationConfig config;
    private WordTokenizer tokenizer;
    private ScriptedClassifier classifier;
    private AtomicInteger loads;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        tokenizer = new WordTokenizer();
        classifier = ScriptedClassifier.constant(LEGAL_SCORES);
        loads = new AtomicInteger();
    }

    private DocumentClassificationService service(final ClassifierModelLoader loader) {
        ClassifierModelRegistry registry = new ClassifierModelRegistry(loader, config);
        return new DocumentClassificationService(
                registry,
                new TokenChunker(ChunkingParams.defaults()),
                new ChunkClassificationInvoker(),
                new ScoreAggregator(),
                new InferenceGate(1),
                config);
    }

    private DocumentClassificationService service() {
        return service(model -> {
            loads.incrementAndGet();
            return new StubModel(model, tokenizer, classifier);
        });
    }

    @Test
    @DisplayName("Empty and whitespace-only text return the error result without touching the model")
    void emptyTextShortCircuits() {
        DocumentClassificationService service = service();

        for (String text : new String[]{"", "   \n\t", null}) {
            ClassificationResult result = service.classifyDocumentText(text);

            assertTrue(result.isError());
            assertNotNull(result.error());
            assertEquals("Other", result.predictedCategory());
            assertEquals(0.0, result.confidenceScore());
        }
        assertEquals(0, classifier.calls());
        assertEquals(0, loads.get());
    }

    @Test
    @DisplayName("Texts within the token limit are classified directly, once")
    void shortTextIsClassifiedDirectly() {
        String text = WordTokenizer.words(900);

        ClassificationResult result = service().classifyDocumentText(text);

        assertNull(result.error());
        assertEquals(EAggregationMethod.DIRECT, result.aggregationMethod());
        assertEquals(1, result.chunksUsed());
        assertEquals(900, result.tokenCount());
        assertFalse(result.wasTruncated());
        assertEquals("Legal Document", result.predictedCategory());
        assertEquals(0.8, result.confidenceScore());
        assertEquals(List.of(text), classifier.seenTexts());
        assertEquals("bart-large-mnli", result.modelKey());
        assertEquals("facebook/bart-large-mnli", result.modelId());
    }

    @Test
    @DisplayName("Long texts are chunked, every chunk classified and the scores aggregated")
    void longTextIsChunked() {
        ClassificationResult result = service().classifyDocumentText(WordTokenizer.words(2000));

        assertNull(result.error());
        assertEquals(3, result.chunksUsed());
        assertEquals(2000, result.tokenCount());
        assertFalse(result.wasTruncated());
        assertNotEquals(EAggregationMethod.DIRECT, result.aggregationMethod());
        assertEquals("Legal Document", result.predictedCategory());
        assertEquals("Legal Document", result.majorityVote());
        assertEquals(3, classifier.calls());

        List<String> seen = classifier.seenTexts();
        assertTrue(seen.get(0).startsWith("w0 ") && seen.get(0).endsWith(" w899"));
        assertTrue(seen.get(1).startsWith("w720 ") && seen.get(1).endsWith(" w1619"));
        assertTrue(seen.get(2).startsWith("w1440 ") && seen.get(2).endsWith(" w1999"));
        assertEquals(config.getCategories(), List.copyOf(result.allScores().keySet()));
    }

    @Test
    @DisplayName("Chunks are shrunk to fit a model with a smaller input limit")
    void chunksFitSmallerModel() {
        String text = WordTokenizer.words(900);

        ClassificationResult result = service().classifyDocumentText(text, null, "mdeberta-v3-base");

        assertNull(result.error());
        assertEquals("mdeberta-v3-base", result.modelKey());
        assertEquals(900, result.tokenCount());
        assertEquals(3, result.chunksUsed());
        assertNotEquals(EAggregationMethod.DIRECT, result.aggregationMethod());

        int premiseBudget = ESupportedModel.MDEBERTA_V3_BASE.maxPremiseTokens();
        for (String chunk : classifier.seenTexts()) {
            assertTrue(chunk.split(" ").length <= premiseBudget);
        }
        assertTrue(classifier.seenTexts().get(2).endsWith(" w899"));
    }

    @Test
    @DisplayName("A failing chunk scores zero and does not abort the document")
    void failingChunkDoesNotEscape() {
        classifier = new ScriptedClassifier(text -> {
            if (text.contains("w1700")) {
                throw new IllegalStateException("model crashed");
            }
            return LEGAL_SCORES;
        });

        ClassificationResult result = assertDoesNotThrow(
                () -> service().classifyDocumentText(WordTokenizer.words(2000)));

        assertNull(result.error());
        assertEquals(3, result.chunksUsed());
        assertEquals(3, classifier.calls());
        // (0.8 + 0.8 + 0) / 3
        assertEquals(0.5333, result.allScores().get("Legal Document"), 1e-4);
        assertEquals(List.of("Legal Document", "Legal Document"), result.chunkPredictions());
    }

    @Test
    @DisplayName("A model that cannot be loaded yields an error result and is retried on the next call")
    void modelUnavailable() {
        DocumentClassificationService service = service(model -> {
            loads.incrementAndGet();
            throw new ModelUnavailableException("model.onnx missing");
        });

        ClassificationResult first = service.classifyDocumentText("some contract text");
        ClassificationResult second = service.classifyDocumentText("some contract text");

        assertTrue(first.isError());
        assertTrue(first.error().contains("model.onnx missing"));
        assertEquals("Other", first.predictedCategory());
        assertEquals(0.0, first.confidenceScore());
        assertTrue(second.isError());
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("A failing direct classification yields an error result")
    void directFailureIsReported() {
        classifier = new ScriptedClassifier(text -> {
            throw new IllegalStateException("session closed");
        });

        ClassificationResult result = service().classifyDocumentText("short text");

        assertTrue(result.isError());
        assertEquals("session closed", result.error());
        assertEquals("Other", result.predictedCategory());
    }

    @Test
    @DisplayName("The model is loaded once and reused across documents")
    void modelLoadedOnce() {
        DocumentClassificationService service = service();

        service.classifyDocumentText("first document");
        service.classifyDocumentText(WordTokenizer.words(1500));
        service.classifyDocumentText("third document");

        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("Identical input gives identical results")
    void deterministic() {
        classifier = new ScriptedClassifier(text -> text.contains("w100 ")
                ? Map.of("Business Proposal", 0.6, "Legal Document", 0.4)
                : LEGAL_SCORES);
        DocumentClassificationService service = service();
        String text = WordTokenizer.words(3000);

        ClassificationResult a = service.classifyDocumentText(text);
        ClassificationResult b = service.classifyDocumentText(text);

        assertEquals(a.predictedCategory(), b.predictedCategory());
        assertEquals(a.confidenceScore(), b.confidenceScore());
        assertEquals(a.allScores(), b.allScores());
        assertEquals(a.weightedScores(), b.weightedScores());
        assertEquals(a.majorityVote(), b.majorityVote());
        assertEquals(a.chunkPredictions(), b.chunkPredictions());
        assertEquals(a.aggregationMethod(), b.aggregationMethod());
    }

    @Test
    @DisplayName("Caller categories are used in order, duplicates dropped")
    void customCategories() {
        classifier = ScriptedClassifier.constant(Map.of("Invoice", 0.9, "Letter", 0.1));

        ClassificationResult result = service().classifyDocumentText(
                "pay within thirty days", List.of("Letter", "Invoice", "Letter"));

        assertEquals(List.of("Letter", "Invoice"), List.copyOf(result.allScores().keySet()));
        assertEquals("Invoice", result.predictedCategory());
    }

    @Test
    @DisplayName("Unknown model keys are rejected")
    void unknownModelKey() {
        DocumentClassificationService service = service();

        assertThrows(IllegalArgumentException.class,
                () -> service.classifyDocumentText("text", null, "gpt-classifier"));
    }

    @Test
    @DisplayName("The catalogue lists both supported models")
    void availableModels() {
        assertEquals(List.of(ESupportedModel.BART_LARGE_MNLI, ESupportedModel.MDEBERTA_V3_BASE),
                service().listAvailableModels());
    }
}
