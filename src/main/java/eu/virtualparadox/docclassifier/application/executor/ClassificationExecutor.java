package eu.virtualparadox.docclassifier.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for bulk classification jobs, kept as its own type so it can be injected
 * without qualifiers.
 */
public class ClassificationExecutor extends ThreadPoolTaskExecutor {
}
