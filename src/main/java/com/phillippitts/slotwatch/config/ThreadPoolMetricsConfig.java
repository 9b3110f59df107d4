package com.phillippitts.slotwatch.config;

import io.micrometer.core.instrument.Gauge;
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
 * Exposes the notification pool through Micrometer.
 *
 * <ul>
 *   <li>notify.pool.size - Current number of threads in the pool</li>
 *   <li>notify.pool.active - Number of sends in progress</li>
 *   <li>notify.pool.queued - Number of sends waiting in the queue</li>
 *   <li>notify.pool.completed - Cumulative count of completed sends</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> notifyExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("notifyExecutor") ObjectProvider<ThreadPoolTaskExecutor> notifyExecutorProvider) {
        this.notifyExecutorProvider = notifyExecutorProvider;
    }

    @Bean
    public MeterBinder notifyExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.notifyExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("notify.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the notification pool")
                    .register(registry);

            Gauge.builder("notify.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of notification sends in progress")
                    .register(registry);

            Gauge.builder("notify.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of notification sends waiting in the queue")
                    .register(registry);

            Gauge.builder("notify.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed notification sends")
                    .register(registry);

            LOG.info("Notification pool metrics registered: notify.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.notifyExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Notify Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
