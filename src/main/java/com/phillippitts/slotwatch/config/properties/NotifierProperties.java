package com.phillippitts.slotwatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the notification transport.
 * Binds to properties prefixed with "notifier".
 *
 * <p>Example application.properties:
 * <pre>
 * notifier.backend=telegram
 * notifier.telegram.token=${TELEGRAM_TOKEN}
 * notifier.telegram.api-base-url=https://api.telegram.org
 * </pre>
 *
 * @param backend  which notifier to wire; {@code log} only writes messages to the log
 * @param telegram Telegram Bot API settings, used when backend is {@code telegram}
 */
@ConfigurationProperties(prefix = "notifier")
@Validated
public record NotifierProperties(
        Backend backend,
        Telegram telegram
) {

    public enum Backend { TELEGRAM, LOG }

    public NotifierProperties {
        if (backend == null) {
            backend = Backend.LOG;
        }
        if (telegram == null) {
            telegram = new Telegram(null, null, null);
        }
    }

    /**
     * @param token         bot token issued by BotFather
     * @param apiBaseUrl    Bot API root, overridable for tests and proxies
     * @param timeoutSeconds connect and read timeout for sendMessage calls
     */
    public record Telegram(String token, String apiBaseUrl, Integer timeoutSeconds) {
        public Telegram {
            if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
                apiBaseUrl = "https://api.telegram.org";
            }
            if (timeoutSeconds == null || timeoutSeconds <= 0) {
                timeoutSeconds = 10;
            }
        }
    }
}
