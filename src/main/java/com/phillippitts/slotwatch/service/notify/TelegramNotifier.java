package com.phillippitts.slotwatch.service.notify;

import com.phillippitts.slotwatch.exception.DeliveryException;
import com.phillippitts.slotwatch.exception.InvalidConfigurationException;
import com.phillippitts.slotwatch.util.LogSanitizer;
import com.phillippitts.slotwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Sends messages through the Telegram Bot API {@code sendMessage} method.
 *
 * <p>Request body: {@code {"chat_id": <recipientId>, "text": <message>}}. A transport error,
 * a non-2xx status or a response whose {@code ok} field is false is reported as a
 * {@link DeliveryException}.
 *
 * <p>Thread-safe: {@link RestTemplate} is safe for concurrent use once configured, and the
 * notifier holds no other mutable state.
 */
public class TelegramNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(TelegramNotifier.class);
    private static final int PREVIEW_CHARS = 60;

    private final RestTemplate restTemplate;
    private final String sendMessageUrl;
    private final String maskedToken;

    public TelegramNotifier(RestTemplate restTemplate, String apiBaseUrl, String token) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        if (token == null || token.isBlank()) {
            throw new InvalidConfigurationException("notifier.telegram.token", "must not be blank");
        }
        String base = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.sendMessageUrl = base + "/bot" + token + "/sendMessage";
        this.maskedToken = LogSanitizer.mask(token);
        LOG.info("Telegram notifier ready (api={}, token={})", base, maskedToken);
    }

    @Override
    public void send(long recipientId, String text) {
        JSONObject body = new JSONObject()
                .put("chat_id", recipientId)
                .put("text", text);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        long start = System.nanoTime();
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(
                    sendMessageUrl, new HttpEntity<>(body.toString(), headers), String.class);
        } catch (RestClientException e) {
            throw new DeliveryException(recipientId, "Telegram request failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DeliveryException(recipientId, "Telegram returned HTTP " + response.getStatusCode().value());
        }
        if (!isOk(response.getBody())) {
            throw new DeliveryException(recipientId, "Telegram rejected message: "
                    + LogSanitizer.truncate(response.getBody(), 200));
        }
        LOG.debug("Delivered to {} in {} ms: {}", recipientId, TimeUtils.elapsedMillis(start),
                LogSanitizer.truncate(text, PREVIEW_CHARS));
    }

    private static boolean isOk(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return true;
        }
        try {
            return new JSONObject(responseBody).optBoolean("ok", true);
        } catch (JSONException e) {
            LOG.debug("Non-JSON Telegram response: {}", LogSanitizer.truncate(responseBody, 80));
            return true;
        }
    }
}
