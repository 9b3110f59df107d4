package com.phillippitts.slotwatch.config;

import com.phillippitts.slotwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for notification sends.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.notify.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool that runs one task per recipient of a broadcast.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A full pool rejects the send;
     * the dispatcher logs it and moves on, so the monitor worker never runs sends itself.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (including the monitor {@code cycle})
     * from the submitting thread to the worker thread.
     *
     * @return configured executor for notification sends
     */
    @Bean(name = "notifyExecutor")
    public ThreadPoolTaskExecutor notifyExecutor() {
        ThreadPoolProperties.NotifyPoolProperties notifyProps = threadPoolProperties.getNotify();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifyProps.getCorePoolSize());
        executor.setMaxPoolSize(notifyProps.getMaxPoolSize());
        executor.setQueueCapacity(notifyProps.getQueueCapacity());
        executor.setThreadNamePrefix(notifyProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(notifyProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
