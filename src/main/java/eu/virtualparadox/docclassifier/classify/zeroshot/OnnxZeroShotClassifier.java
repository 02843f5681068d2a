package eu.virtualparadox.docclassifier.classify.zeroshot;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.docclassifier.classify.model.ESupportedModel;
import eu.virtualparadox.docclassifier.classify.tokenizer.HuggingFaceTextTokenizer;
import eu.virtualparadox.docclassifier.util.OrtInitializer;
import lombok.extern.slf4j.Slf4j;

import java.nio.LongBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-shot classifier built on an NLI cross-encoder exported to ONNX.
 *
 * <p>Every category is turned into the hypothesis {@code "This example is <category>."} and
 * scored against the text as premise. The entailment logits of all categories are then
 * soft-maxed together, so the scores of one call sum to 1 (single-label mode).</p>
 *
 * <p>The pair encoder caps every input at {@link ESupportedModel#maxInputTokens()} by cutting
 * the premise only; callers chunk long documents to {@link ESupportedModel#maxPremiseTokens()}
 * first, so the cut is not expected to fire.</p>
 */
@Slf4j
public final class OnnxZeroShotClassifier implements ZeroShotClassifier {

    private static final String HYPOTHESIS_TEMPLATE = "This example is %s.";

    private final ESupportedModel model;
    private final Path modelPath;
    private final HuggingFaceTextTokenizer tokenizer;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;

    public OnnxZeroShotClassifier(final ESupportedModel model,
                                  final Path modelPath,
                                  final HuggingFaceTextTokenizer tokenizer,
                                  final int intraOpThreads) {
        this.model = model;
        this.modelPath = modelPath;
        this.tokenizer = tokenizer;
        this.intraOpThreads = intraOpThreads;
    }

    public void initialize() throws OrtException {
        if (session != null) {
            return;
        }
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt(intraOpThreads);
        this.session = env.createSession(modelPath.toString(), options);

        log.info("Loaded ONNX zero-shot model {} from {}", model.modelId(), modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    public void release() throws OrtException {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    @Override
    public ZeroShotPrediction classify(final String text, final List<String> categories) {
        if (session == null) {
            throw new IllegalStateException("ONNX session not initialized for " + model.key());
        }

        final double[] entailment = new double[categories.size()];
        try {
            for (int i = 0; i < categories.size(); i++) {
                final String hypothesis = String.format(HYPOTHESIS_TEMPLATE, categories.get(i));
                entailment[i] = entailmentLogit(tokenizer.encodePair(text, hypothesis));
            }
        } catch (OrtException e) {
            throw new IllegalStateException("Zero-shot inference failed", e);
        }

        final double[] probabilities = softmax(entailment);

        final List<Integer> order = new ArrayList<>(categories.size());
        for (int i = 0; i < categories.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> probabilities[i]).reversed());

        final List<String> labels = new ArrayList<>(order.size());
        final List<Double> scores = new ArrayList<>(order.size());
        for (int i : order) {
            labels.add(categories.get(i));
            scores.add(probabilities[i]);
        }
        return new ZeroShotPrediction(labels, scores);
    }

    private double entailmentLogit(final Encoding encoding) throws OrtException {
        final long[] ids = encoding.getIds();
        final long[] mask = encoding.getAttentionMask();
        final long[] types = encoding.getTypeIds();

        final long[] shape = {1, ids.length};
        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, LongBuffer.wrap(ids), shape);
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, LongBuffer.wrap(mask), shape);
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, LongBuffer.wrap(types), shape)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            inputs.put("input_ids", inputIds);
            if (session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final Object value = result.get(0).getValue();
                if (value instanceof float[][] logits2d) {
                    // [batch, (contradiction, neutral, entailment)] in model-specific order
                    return logits2d[0][model.entailmentIndex()];
                }
                throw new IllegalStateException("Unexpected output shape: " + value.getClass());
            }
        }
    }

    private static double[] softmax(final double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double l : logits) {
            max = Math.max(max, l);
        }
        double sum = 0.0;
        final double[] out = new double[logits.length];
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }
}
