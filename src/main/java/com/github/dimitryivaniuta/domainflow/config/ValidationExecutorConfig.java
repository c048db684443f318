package com.github.dimitryivaniuta.domainflow.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool shared by the check lanes of every running validation batch in this instance.
 */
@Configuration
public class ValidationExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidationExecutorConfig.class);

    @Bean("validationExecutor")
    public ThreadPoolTaskExecutor validationExecutor(AppProperties props) {
        AppProperties.Validation validation = props.getValidation();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(validation.getExecutorThreads());
        executor.setMaxPoolSize(validation.getExecutorThreads());
        executor.setQueueCapacity(validation.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("validation-");
        executor.setDaemon(true);
        executor.setTaskDecorator(mdcPropagating());
        // a saturated pool runs the lane on the job's worker thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        log.info("Validation executor configured threads={} queue={}",
                validation.getExecutorThreads(), validation.getExecutorQueueCapacity());
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
