package eu.virtualparadox.docclassifier.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for a CPU classification session.
     *
     * @param requestedIntraThreads intra-op thread count; {@code <= 0} leaves one core free
     * @return configured session options
     */
    public static OrtSession.SessionOptions initializeOrt(final int requestedIntraThreads) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int intraThreads = requestedIntraThreads > 0
                    ? requestedIntraThreads
                    : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
