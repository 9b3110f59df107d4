package com.phillippitts.slotwatch.service.probe;

import com.phillippitts.slotwatch.config.properties.ProbeProperties;
import com.phillippitts.slotwatch.domain.Status;
import com.phillippitts.slotwatch.domain.StatusSnapshot;
import com.phillippitts.slotwatch.exception.ProbeExceptionBuilder;
import com.phillippitts.slotwatch.service.limits.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Prober} that drives a {@link PageSource} and classifies its content.
 *
 * <p><b>Login:</b> {@link #ensureLoggedIn()} opens the login URL and then waits for the page to
 * navigate away from it (a URL without {@code /login}). The wait is bounded; when it runs out
 * the prober carries on and lets later reads show the real state of the page.
 *
 * <p><b>Caching:</b> a classified status is reused for {@code probe.status-cache-ttl-millis}
 * so that repeated reads within one cycle do not re-classify.
 */
public class PageProber implements Prober {

    private static final Logger LOG = LogManager.getLogger(PageProber.class);
    private static final String LOGIN_PATH = "/login";

    private final PageSource page;
    private final StatusClassifier classifier;
    private final String loginUrl;
    private final Duration loginWait;
    private final Duration loginPoll;
    private final Duration cacheTtl;
    private final Clock clock;
    private final Sleeper sleeper;

    private boolean loggedIn;
    private StatusSnapshot cached;

    public PageProber(PageSource page, StatusClassifier classifier, ProbeProperties props) {
        this(page, classifier, props, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public PageProber(PageSource page, StatusClassifier classifier, ProbeProperties props,
                      Clock clock, Sleeper sleeper) {
        this.page = Objects.requireNonNull(page, "page");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(props, "props");
        this.loginUrl = props.getLoginUrl();
        this.loginWait = Duration.ofSeconds(props.getLoginWaitSeconds());
        this.loginPoll = Duration.ofSeconds(props.getLoginPollSeconds());
        this.cacheTtl = props.getStatusCacheTtl();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void ensureLoggedIn() {
        if (loggedIn) {
            return;
        }
        LOG.info("Opening login page {}", loginUrl);
        try {
            page.open(loginUrl);
        } catch (RuntimeException e) {
            LOG.error("Could not open login page {}", loginUrl, e);
            throw ProbeExceptionBuilder.create("Could not open login page")
                    .operation("login")
                    .url(loginUrl)
                    .cause(e)
                    .build();
        }

        Instant deadline = clock.instant().plus(loginWait);
        while (clock.instant().isBefore(deadline)) {
            try {
                sleeper.sleep(loginPoll);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Login wait interrupted");
                return;
            }
            String url;
            try {
                url = page.currentUrl();
            } catch (RuntimeException e) {
                LOG.debug("Could not read current URL while waiting for login: {}", e.getMessage());
                continue;
            }
            if (url != null && !url.contains(LOGIN_PATH)) {
                loggedIn = true;
                LOG.info("Login confirmed at {}", url);
                return;
            }
        }
        LOG.warn("Login not confirmed within {}s; continuing anyway", loginWait.toSeconds());
    }

    @Override
    public void refresh() {
        try {
            page.refresh();
        } catch (RuntimeException e) {
            LOG.warn("Refresh failed ({}); trying to recover via login page", e.getMessage());
            loggedIn = false;
            try {
                page.open(loginUrl);
            } catch (RuntimeException recovery) {
                recovery.addSuppressed(e);
                throw ProbeExceptionBuilder.create("Refresh recovery failed")
                        .operation("refresh")
                        .url(loginUrl)
                        .cause(recovery)
                        .build();
            }
        }
    }

    @Override
    public Status readStatus() {
        Instant now = clock.instant();
        if (cached != null && cached.isFresh(now, cacheTtl)) {
            return cached.status();
        }
        String content;
        try {
            content = page.pageContent();
        } catch (RuntimeException e) {
            LOG.warn("Could not read page content; treating as BLOCKED: {}", e.getMessage());
            return Status.BLOCKED;
        }
        String text = content == null ? "" : content;
        Status status = classifier.classify(text);
        cached = new StatusSnapshot(status, now, text.length());
        LOG.debug("Classified page ({} chars) as {}", text.length(), status);
        return status;
    }

    @Override
    public void close() {
        loggedIn = false;
        cached = null;
        try {
            page.quit();
        } catch (RuntimeException e) {
            LOG.debug("Ignoring error while closing page: {}", e.getMessage());
        }
    }

    /**
     * @return the most recent classification, if any
     */
    public Optional<StatusSnapshot> lastSnapshot() {
        return Optional.ofNullable(cached);
    }

    boolean isLoggedIn() {
        return loggedIn;
    }
}
