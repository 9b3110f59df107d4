package com.phillippitts.slotwatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration properties for subscriber persistence and access.
 * Binds to properties prefixed with "subscribers".
 *
 * @param backend    {@code file} persists ids as a JSON array, {@code memory} keeps them in process
 * @param file       path of the JSON file used by the file backend
 * @param allowedIds ids allowed to subscribe; empty allows everyone
 */
@ConfigurationProperties(prefix = "subscribers")
@Validated
public record SubscriberProperties(
        Backend backend,
        String file,
        List<Long> allowedIds
) {

    public enum Backend { FILE, MEMORY }

    public SubscriberProperties {
        if (backend == null) {
            backend = Backend.FILE;
        }
        if (file == null || file.isBlank()) {
            file = "subscribers.json";
        }
        allowedIds = allowedIds == null ? List.of() : List.copyOf(allowedIds);
    }

    /**
     * @return true if {@code id} may subscribe
     */
    public boolean isAllowed(long id) {
        return allowedIds.isEmpty() || allowedIds.contains(id);
    }
}
