package com.phillippitts.slotwatch.presentation.controller;

import com.phillippitts.slotwatch.config.properties.SubscriberProperties;
import com.phillippitts.slotwatch.exception.SubscriptionNotAllowedException;
import com.phillippitts.slotwatch.service.subscriber.SubscriberStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Subscribe and unsubscribe recipients by id.
 *
 * <p>When {@code subscribers.allowed-ids} is set, only those ids may subscribe. Unsubscribing is
 * always allowed.
 */
@RestController
@RequestMapping("/api/subscribers")
class SubscriberController {

    private static final Logger LOG = LogManager.getLogger(SubscriberController.class);

    private final SubscriberStore store;
    private final SubscriberProperties props;

    SubscriberController(SubscriberStore store, SubscriberProperties props) {
        this.store = store;
        this.props = props;
    }

    @PostMapping("/{id}")
    ResponseEntity<Map<String, Object>> subscribe(@PathVariable("id") long id) {
        if (!props.isAllowed(id)) {
            LOG.warn("Rejected subscription for {}: not in allowlist", id);
            throw new SubscriptionNotAllowedException(id);
        }
        boolean added = store.add(id);
        return ResponseEntity.ok(Map.of(
                "id", id,
                "changed", added,
                "message", added ? "Subscribed to availability alerts" : "Already subscribed"
        ));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Map<String, Object>> unsubscribe(@PathVariable("id") long id) {
        boolean removed = store.remove(id);
        return ResponseEntity.ok(Map.of(
                "id", id,
                "changed", removed,
                "message", removed ? "Unsubscribed" : "Was not subscribed"
        ));
    }

    @GetMapping("/count")
    ResponseEntity<Map<String, Object>> count() {
        return ResponseEntity.ok(Map.of("subscribers", store.count()));
    }
}
