package eu.virtualparadox.docclassifier.application.config;

import eu.virtualparadox.docclassifier.classify.InferenceGate;
import eu.virtualparadox.docclassifier.classify.chunker.ChunkingParams;
import eu.virtualparadox.docclassifier.classify.chunker.TokenChunker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the chunking parameters and the inference gate from {@link ApplicationConfig}.
 * <p>An invalid chunk/overlap combination fails here, at startup, never per call.</p>
 */
@Configuration
public class ClassificationConfig {

    @Bean
    public ChunkingParams chunkingParams(final ApplicationConfig config) {
        final ApplicationConfig.Chunking chunking = config.getChunking();
        return new ChunkingParams(chunking.getMaxChunkTokens(), chunking.getOverlapFraction());
    }

    @Bean
    public TokenChunker tokenChunker(final ChunkingParams params) {
        return new TokenChunker(params);
    }

    @Bean
    public InferenceGate inferenceGate(final ApplicationConfig config) {
        return new InferenceGate(config.getInferenceSlots());
    }
}
