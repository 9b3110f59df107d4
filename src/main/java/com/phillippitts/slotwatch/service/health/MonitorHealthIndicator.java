package com.phillippitts.slotwatch.service.health;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.service.monitor.MonitorLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the slot monitor.
 *
 * <ul>
 *   <li>UP: worker running, no recorded failures</li>
 *   <li>DEGRADED: worker running but failing or cooling down</li>
 *   <li>DOWN: worker not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class MonitorHealthIndicator implements HealthIndicator {

    private final MonitorLoop loop;

    public MonitorHealthIndicator(MonitorLoop loop) {
        this.loop = loop;
    }

    @Override
    public Health health() {
        MonitorSnapshot s = loop.snapshot();
        Health.Builder builder = new Health.Builder();

        if (!s.running()) {
            builder.down().withDetail("status", "Monitor not running");
        } else if (s.failures() > 0 || s.breakerOpen()) {
            builder.status("DEGRADED").withDetail("status", "Monitor running with failures");
        } else {
            builder.up().withDetail("status", "Monitor running");
        }

        return builder
                .withDetail("lastStatus", s.lastStatus() == null ? "unknown" : s.lastStatus().name())
                .withDetail("failures", s.failures() + "/" + s.threshold())
                .withDetail("subscribers", s.subscriberCount())
                .build();
    }
}
