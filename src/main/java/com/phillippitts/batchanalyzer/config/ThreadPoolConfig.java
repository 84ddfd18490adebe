package com.phillippitts.batchanalyzer.config;

import com.phillippitts.batchanalyzer.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by batch analysis.
 *
 * <p>Two pools are kept apart so that a slow provider cannot starve fingerprinting:
 * <ul>
 *   <li>{@code analysisExecutor}: fingerprinting and one task per similarity group</li>
 *   <li>{@code capabilityExecutor}: individual capability calls, each awaited with a timeout</li>
 * </ul>
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for fingerprinting and group analysis tasks.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the task, providing backpressure instead of failing.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (run token, request id) from the
     * submitting thread to the worker thread.
     *
     * @return configured executor for analysis work
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        return build(threadPoolProperties.getAnalysis());
    }

    /**
     * Executor for capability calls. Calls are awaited with a timeout by the submitting analysis
     * task; sizing should be at least the configured batch concurrency.
     *
     * @return configured executor for capability calls
     */
    @Bean(name = "capabilityExecutor")
    public Executor capabilityExecutor() {
        return build(threadPoolProperties.getCapability());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Decorator that runs each task with the submitter's ThreadContext and restores the
     * worker's previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
