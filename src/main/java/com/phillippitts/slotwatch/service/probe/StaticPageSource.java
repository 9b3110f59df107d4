package com.phillippitts.slotwatch.service.probe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Page source that always serves the same content. Used for offline dry runs where no real
 * target should be contacted; navigation never leaves the landing URL, so login confirms at once.
 */
public class StaticPageSource implements PageSource {

    private static final Logger LOG = LogManager.getLogger(StaticPageSource.class);

    private final String content;
    private final String landingUrl;

    public StaticPageSource(String content, String landingUrl) {
        this.content = Objects.requireNonNull(content, "content");
        this.landingUrl = Objects.requireNonNull(landingUrl, "landingUrl");
    }

    @Override
    public void open(String url) {
        LOG.debug("Static page: ignoring navigation to {}", url);
    }

    @Override
    public void refresh() {
        // nothing to reload
    }

    @Override
    public String currentUrl() {
        return landingUrl;
    }

    @Override
    public String pageContent() {
        return content;
    }

    @Override
    public void quit() {
        LOG.debug("Static page closed");
    }
}
