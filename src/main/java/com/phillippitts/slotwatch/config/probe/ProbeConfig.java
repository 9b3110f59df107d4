package com.phillippitts.slotwatch.config.probe;

import com.phillippitts.slotwatch.config.properties.ProbeProperties;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import com.phillippitts.slotwatch.service.probe.HttpPageSource;
import com.phillippitts.slotwatch.service.probe.MarkerStatusClassifier;
import com.phillippitts.slotwatch.service.probe.PageProber;
import com.phillippitts.slotwatch.service.probe.PageSource;
import com.phillippitts.slotwatch.service.probe.Prober;
import com.phillippitts.slotwatch.service.probe.StaticPageSource;
import com.phillippitts.slotwatch.service.probe.StatusClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the prober and its page source. The page source is selected by {@code probe.backend}.
 */
@Configuration
public class ProbeConfig {

    private static final Logger LOG = LogManager.getLogger(ProbeConfig.class);
    static final String STATIC_LANDING_URL = "static://slotwatch/appointments";

    private final ProbeProperties probeProperties;

    public ProbeConfig(ProbeProperties probeProperties) {
        this.probeProperties = probeProperties;
    }

    @Bean
    public StatusClassifier statusClassifier() {
        return new MarkerStatusClassifier(
                probeProperties.getCaptchaMarkers(),
                probeProperties.getBlockMarkers(),
                probeProperties.getNegativePatterns());
    }

    /**
     * HTTP page source (default).
     */
    @Bean
    @ConditionalOnProperty(prefix = "probe", name = "backend", havingValue = "http", matchIfMissing = true)
    public PageSource httpPageSource() {
        LOG.info("Probe backend: http (timeout={}s)", probeProperties.getRequestTimeoutSeconds());
        return new HttpPageSource(
                Duration.ofSeconds(probeProperties.getRequestTimeoutSeconds()),
                probeProperties.getUserAgent());
    }

    /**
     * Static page source for offline dry runs.
     */
    @Bean
    @ConditionalOnProperty(prefix = "probe", name = "backend", havingValue = "static")
    public PageSource staticPageSource() {
        LOG.info("Probe backend: static");
        return new StaticPageSource(probeProperties.getStaticPage(), STATIC_LANDING_URL);
    }

    /**
     * Login polling always uses real waits; only the monitor's own waits end early on stop.
     */
    @Bean
    public Prober prober(PageSource pageSource, StatusClassifier statusClassifier) {
        return new PageProber(pageSource, statusClassifier, probeProperties, Clock.systemUTC(), Sleeper.SYSTEM);
    }
}
