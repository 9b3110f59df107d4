package com.phillippitts.slotwatch.service.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Ties the {@link MonitorLoop} to the application context: starts it after the context is
 * refreshed (when auto-start is enabled) and stops and joins it on shutdown.
 */
public class MonitorLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(MonitorLifecycle.class);

    private final MonitorLoop loop;
    private final boolean autoStart;
    private final Duration shutdownTimeout;

    public MonitorLifecycle(MonitorLoop loop, boolean autoStart, Duration shutdownTimeout) {
        this.loop = loop;
        this.autoStart = autoStart;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void start() {
        LOG.info("Starting slot monitor");
        loop.start();
    }

    @Override
    public void stop() {
        loop.stop();
        if (!loop.join(shutdownTimeout)) {
            LOG.warn("Slot monitor still running after {}s; abandoning daemon worker", shutdownTimeout.toSeconds());
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return loop.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
