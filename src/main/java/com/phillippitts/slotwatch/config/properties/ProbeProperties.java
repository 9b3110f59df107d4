package com.phillippitts.slotwatch.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for the probed page: where to log in, how to fetch it and which markers
 * classify its content.
 *
 * <p>Marker lists accept comma separated values; entries may additionally be separated by
 * {@code ;}. Matching is case-insensitive.
 */
@Validated
@ConfigurationProperties(prefix = "probe")
public class ProbeProperties {

    public enum Backend { HTTP, STATIC }

    private static final List<String> DEFAULT_NEGATIVE_PATTERNS = List.of(
            "no appointment", "not available", "no slots", "no appointments available");
    private static final List<String> DEFAULT_CAPTCHA_MARKERS = List.of(
            "verify", "captcha", "are you human", "robot check");
    private static final List<String> DEFAULT_BLOCK_MARKERS = List.of(
            "too many requests", "429", "temporarily blocked", "suspicious activity");

    @NotNull
    private final Backend backend;

    @NotBlank
    private final String loginUrl;

    @Min(0)
    @Max(3600)
    private final int loginWaitSeconds;

    @Min(1)
    @Max(60)
    private final int loginPollSeconds;

    /** How long a classified status is served from cache. */
    @Min(0)
    private final long statusCacheTtlMillis;

    @Min(1)
    @Max(300)
    private final int requestTimeoutSeconds;

    /** User agent sent by the HTTP backend. */
    private final String userAgent;

    /** Content served by the STATIC backend. */
    private final String staticPage;

    private final List<String> negativePatterns;
    private final List<String> captchaMarkers;
    private final List<String> blockMarkers;

    @ConstructorBinding
    public ProbeProperties(Backend backend,
                           String loginUrl,
                           Integer loginWaitSeconds,
                           Integer loginPollSeconds,
                           Long statusCacheTtlMillis,
                           Integer requestTimeoutSeconds,
                           String userAgent,
                           String staticPage,
                           List<String> negativePatterns,
                           List<String> captchaMarkers,
                           List<String> blockMarkers) {
        this.backend = backend == null ? Backend.HTTP : backend;
        this.loginUrl = (loginUrl == null || loginUrl.isBlank())
                ? "https://visas-de.tlscontact.com/en/ir/THR/login" : loginUrl;
        this.loginWaitSeconds = loginWaitSeconds == null ? 90 : loginWaitSeconds;
        this.loginPollSeconds = loginPollSeconds == null ? 2 : loginPollSeconds;
        this.statusCacheTtlMillis = statusCacheTtlMillis == null ? 2000L : statusCacheTtlMillis;
        this.requestTimeoutSeconds = requestTimeoutSeconds == null ? 30 : requestTimeoutSeconds;
        this.userAgent = (userAgent == null || userAgent.isBlank())
                ? "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) "
                        + "Chrome/124.0 Safari/537.36"
                : userAgent;
        this.staticPage = staticPage == null ? "<html>No appointment available</html>" : staticPage;
        this.negativePatterns = negativePatterns == null ? DEFAULT_NEGATIVE_PATTERNS : List.copyOf(negativePatterns);
        this.captchaMarkers = captchaMarkers == null ? DEFAULT_CAPTCHA_MARKERS : List.copyOf(captchaMarkers);
        this.blockMarkers = blockMarkers == null ? DEFAULT_BLOCK_MARKERS : List.copyOf(blockMarkers);
    }

    /**
     * Properties with every value at its default; convenient for tests.
     */
    public static ProbeProperties defaults() {
        return new ProbeProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public Backend getBackend() {
        return backend;
    }

    public String getLoginUrl() {
        return loginUrl;
    }

    public int getLoginWaitSeconds() {
        return loginWaitSeconds;
    }

    public int getLoginPollSeconds() {
        return loginPollSeconds;
    }

    public long getStatusCacheTtlMillis() {
        return statusCacheTtlMillis;
    }

    public Duration getStatusCacheTtl() {
        return Duration.ofMillis(statusCacheTtlMillis);
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getStaticPage() {
        return staticPage;
    }

    public List<String> getNegativePatterns() {
        return negativePatterns;
    }

    public List<String> getCaptchaMarkers() {
        return captchaMarkers;
    }

    public List<String> getBlockMarkers() {
        return blockMarkers;
    }
}
