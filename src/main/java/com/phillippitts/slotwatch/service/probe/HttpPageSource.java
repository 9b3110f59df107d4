package com.phillippitts.slotwatch.service.probe;

import com.phillippitts.slotwatch.exception.ProbeExceptionBuilder;
import com.phillippitts.slotwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link PageSource} backed by plain HTTP GETs through a {@link RestTemplate}.
 *
 * <p>Redirects are followed here rather than by the connection so that {@link #currentUrl()}
 * reports where the page actually landed; a redirect to the login page is how an expired
 * session shows up.
 *
 * <p>Not thread-safe; owned by the monitor worker through {@link PageProber}.
 */
public class HttpPageSource implements PageSource {

    private static final Logger LOG = LogManager.getLogger(HttpPageSource.class);
    static final int MAX_REDIRECTS = 5;

    private final RestTemplate restTemplate;
    private final String userAgent;

    private String currentUrl;
    private String content;

    public HttpPageSource(Duration timeout, String userAgent) {
        this(new RestTemplate(noRedirectFactory(timeout)), userAgent);
    }

    HttpPageSource(RestTemplate restTemplate, String userAgent) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    @Override
    public void open(String url) {
        fetch(url, "open");
    }

    @Override
    public void refresh() {
        if (currentUrl == null) {
            throw ProbeExceptionBuilder.create("No page open to refresh")
                    .operation("refresh")
                    .build();
        }
        fetch(currentUrl, "refresh");
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public String pageContent() {
        if (content == null) {
            throw ProbeExceptionBuilder.create("No page content available")
                    .operation("pageContent")
                    .build();
        }
        return content;
    }

    @Override
    public void quit() {
        currentUrl = null;
        content = null;
    }

    private void fetch(String url, String operation) {
        long start = System.nanoTime();
        String target = url;
        try {
            for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
                ResponseEntity<String> response = restTemplate.exchange(
                        target, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
                if (response.getStatusCode().is3xxRedirection()) {
                    URI location = response.getHeaders().getLocation();
                    if (location == null) {
                        break;
                    }
                    target = URI.create(target).resolve(location).toString();
                    LOG.debug("Following redirect to {}", target);
                    continue;
                }
                this.currentUrl = target;
                this.content = response.getBody() != null ? response.getBody() : "";
                LOG.debug("Fetched {} ({} chars) in {} ms", target, content.length(), TimeUtils.elapsedMillis(start));
                return;
            }
            throw ProbeExceptionBuilder.create("Too many redirects")
                    .operation(operation)
                    .url(url)
                    .metadata("maxRedirects", MAX_REDIRECTS)
                    .build();
        } catch (HttpStatusCodeException e) {
            throw ProbeExceptionBuilder.create("Page fetch failed")
                    .operation(operation)
                    .url(target)
                    .statusCode(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        } catch (RestClientException | IllegalArgumentException e) {
            throw ProbeExceptionBuilder.create("Page fetch failed")
                    .operation(operation)
                    .url(target)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.setAccept(List.of(MediaType.TEXT_HTML, MediaType.ALL));
        return headers;
    }

    private static SimpleClientHttpRequestFactory noRedirectFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
