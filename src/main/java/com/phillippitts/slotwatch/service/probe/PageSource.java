package com.phillippitts.slotwatch.service.probe;

/**
 * Minimal browser-like page abstraction used by {@link PageProber}.
 *
 * <p>Methods may throw unchecked exceptions on transport failures; {@link PageProber} decides
 * which of them are recoverable.
 */
public interface PageSource {

    /** Navigates to {@code url}. */
    void open(String url);

    /** Reloads the current page. */
    void refresh();

    /** @return URL of the page currently shown (after redirects) */
    String currentUrl();

    /** @return content of the page currently shown */
    String pageContent();

    /** Releases resources held by the page. */
    void quit();
}
