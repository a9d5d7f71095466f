package com.callreplay.infrastructure.ai.pipeline;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for blocking LLM calls.
 * <p>
 * Both pools are fixed at {@code pipeline.concurrency} (default 4) with a bounded queue.
 * The batch pool runs an overflowing task on the submitting thread, which throttles
 * a large batch. The ingestion pool rejects overflow instead, so an ingest caller
 * never ends up running an analysis itself.
 * The submitter's MDC is copied onto the worker for the duration of the task.
 * </p>
 */
@Configuration
public class AnalysisExecutorConfig {

    public static final String ANALYSIS_EXECUTOR = "analysisExecutor";
    public static final String INGESTION_EXECUTOR = "ingestionExecutor";

    @Value("${pipeline.concurrency:4}")
    private int concurrency = 4;

    @Value("${pipeline.queue-capacity:100}")
    private int queueCapacity = 100;

    @Value("${pipeline.ingestion-queue-capacity:100}")
    private int ingestionQueueCapacity = 100;

    @Primary
    @Bean(name = ANALYSIS_EXECUTOR)
    public ThreadPoolTaskExecutor analysisExecutor() {
        return buildExecutor("analysis-pool-", queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = INGESTION_EXECUTOR)
    public ThreadPoolTaskExecutor ingestionExecutor() {
        return buildExecutor("ingest-pool-", ingestionQueueCapacity, new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(String threadNamePrefix,
                                                 int capacity,
                                                 RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(capacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
