package eu.virtualparadox.docclassifier.application.config;

import eu.virtualparadox.docclassifier.application.executor.ClassificationExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public ClassificationExecutor classificationExecutor(final ApplicationConfig config) {
        final int workers = Math.max(1, config.getBulk().getWorkers());

        ClassificationExecutor executor = new ClassificationExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);             // fixed size, the inference gate bounds model access
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("classify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(config.getBulk().getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
