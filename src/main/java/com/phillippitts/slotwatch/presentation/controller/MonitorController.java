package com.phillippitts.slotwatch.presentation.controller;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.service.monitor.MonitorLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status query and start/stop control for the slot monitor.
 */
@RestController
@RequestMapping("/api")
class MonitorController {

    private static final Logger LOG = LogManager.getLogger(MonitorController.class);

    private final MonitorLoop loop;
    private final boolean statusEnabled;

    MonitorController(MonitorLoop loop,
                      @Value("${status.endpoint.enabled:true}") boolean statusEnabled) {
        this.loop = loop;
        this.statusEnabled = statusEnabled;
    }

    @GetMapping("/status")
    ResponseEntity<MonitorSnapshot> status() {
        if (!statusEnabled) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(loop.snapshot());
    }

    @PostMapping("/monitor/start")
    ResponseEntity<MonitorSnapshot> start() {
        LOG.info("Monitor start requested via API");
        loop.start();
        return ResponseEntity.accepted().body(loop.snapshot());
    }

    /**
     * Requests a stop; the worker finishes its current step in the background.
     */
    @PostMapping("/monitor/stop")
    ResponseEntity<MonitorSnapshot> stop() {
        LOG.info("Monitor stop requested via API");
        loop.stop();
        return ResponseEntity.accepted().body(loop.snapshot());
    }
}
