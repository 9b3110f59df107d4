package com.phillippitts.slotwatch.service.events;

import com.phillippitts.slotwatch.service.monitor.event.BackoffEvent;
import com.phillippitts.slotwatch.service.monitor.event.CooldownStartedEvent;
import com.phillippitts.slotwatch.service.monitor.event.ProbeFailureEvent;
import com.phillippitts.slotwatch.service.monitor.event.SlotsAvailableEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for monitor events. Repeated failures are throttled to avoid log spam
 * while the target keeps failing.
 */
@Component
class MonitorEventsListener {
    private static final Logger LOG = LogManager.getLogger(MonitorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProbeFailure(ProbeFailureEvent e) {
        String key = "probe-" + e.operation();
        if (shouldLog(key)) {
            LOG.warn("Probe keeps failing during {}: {}. Check the target URL and network access.",
                    e.operation(), e.message());
        }
    }

    @EventListener
    void onBackoff(BackoffEvent e) {
        if (shouldLog("backoff-" + e.reason())) {
            LOG.warn("Backing off after {} ({} consecutive failures, {}s)", e.reason(), e.failures(), e.seconds());
        }
    }

    @EventListener
    void onCooldown(CooldownStartedEvent e) {
        LOG.warn("Anti-bot check detected {} times in a row; pausing for {} min. Notified {} subscriber(s).",
                e.failures(), e.cooldownSeconds() / 60, e.recipients());
    }

    @EventListener
    void onSlotsAvailable(SlotsAvailableEvent e) {
        LOG.info("Possible availability ({}); notified {} subscriber(s) at {}", e.status(), e.recipients(), e.at());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
