package eu.virtualparadox.docclassifier.classify.model;

import eu.virtualparadox.docclassifier.application.config.ApplicationConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the process-wide model handles.
 *
 * <p>A handle is created at most once per {@link ESupportedModel}, on first use (or at startup
 * when {@code docclassifier.eager-load} is set), reused for every document, and released in
 * {@link #release()}. A load that fails is not remembered, so the next call retries.</p>
 */
@Service
@Slf4j
public class ClassifierModelRegistry {

    private final ClassifierModelLoader loader;
    private final ApplicationConfig config;
    private final Map<ESupportedModel, ClassifierModel> models = new EnumMap<>(ESupportedModel.class);

    public ClassifierModelRegistry(final ClassifierModelLoader loader, final ApplicationConfig config) {
        this.loader = loader;
        this.config = config;
    }

    @PostConstruct
    public void initialize() {
        // fail fast on a misspelled default model key
        final ESupportedModel defaultModel = ESupportedModel.fromKey(config.getDefaultModel());
        if (config.isEagerLoad()) {
            acquire(defaultModel);
        }
    }

    /**
     * Returns the shared handle for {@code model}, loading it on first use.
     *
     * @throws ModelUnavailableException if loading fails
     */
    public synchronized ClassifierModel acquire(final ESupportedModel model) {
        final ClassifierModel existing = models.get(model);
        if (existing != null) {
            return existing;
        }
        final ClassifierModel loaded = loader.load(model);
        models.put(model, loaded);
        return loaded;
    }

    public synchronized boolean isLoaded(final ESupportedModel model) {
        return models.containsKey(model);
    }

    public List<ESupportedModel> listAvailableModels() {
        return List.of(ESupportedModel.values());
    }

    @PreDestroy
    public synchronized void release() {
        if (models.isEmpty()) {
            log.info("No ML resources to clean up");
            return;
        }
        for (ClassifierModel model : new ArrayList<>(models.values())) {
            try {
                model.release();
                log.info("Released model {}", model.descriptor().key());
            } catch (RuntimeException e) {
                log.error("Unable to release model {}", model.descriptor().key(), e);
            }
        }
        models.clear();
        log.info("ML resources cleaned up successfully");
    }
}
