package com.phillippitts.batchanalyzer.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes analysis and capability pool metrics via Micrometer.
 *
 * <p>For each pool ({@code analysis}, {@code capability}) the gauges
 * {@code <pool>.pool.size}, {@code .active}, {@code .queued} and {@code .completed} are registered
 * and available at {@code /actuator/metrics}.
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> capabilityExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("analysisExecutor") ObjectProvider<ThreadPoolTaskExecutor> analysisExecutorProvider,
            @Qualifier("capabilityExecutor") ObjectProvider<ThreadPoolTaskExecutor> capabilityExecutorProvider) {
        this.analysisExecutorProvider = analysisExecutorProvider;
        this.capabilityExecutorProvider = capabilityExecutorProvider;
    }

    @Bean
    public MeterBinder analysisPoolMetrics() {
        return registry -> {
            ThreadPoolTaskExecutor executor = analysisExecutorProvider.getIfAvailable();
            if (executor != null) {
                bind(registry, "analysis", executor.getThreadPoolExecutor());
            }
        };
    }

    @Bean
    public MeterBinder capabilityPoolMetrics() {
        return registry -> {
            ThreadPoolTaskExecutor executor = capabilityExecutorProvider.getIfAvailable();
            if (executor != null) {
                bind(registry, "capability", executor.getThreadPoolExecutor());
            }
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);

        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing " + pool + " tasks")
                .register(registry);

        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Number of " + pool + " tasks waiting in the queue")
                .register(registry);

        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);

        LOG.info("Thread pool metrics registered: {}.pool.* available via /actuator/metrics", pool);
    }

    /**
     * Logs a pool health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("Analysis", analysisExecutorProvider.getIfAvailable());
        log("Capability", capabilityExecutorProvider.getIfAvailable());
    }

    private static void log(String name, ThreadPoolTaskExecutor taskExecutor) {
        if (taskExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
