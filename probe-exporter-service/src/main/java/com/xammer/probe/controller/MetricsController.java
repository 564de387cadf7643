package com.xammer.probe.controller;

import com.xammer.probe.dto.ScrapeResult;
import com.xammer.probe.service.ProbeOrchestrator;
import com.xammer.probe.service.ScrapeRegistryFactory;
import com.xammer.probe.service.ScrapeTimeoutResolver;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
public class MetricsController {

    private static final Logger logger = LoggerFactory.getLogger(MetricsController.class);

    private static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType(TextFormat.CONTENT_TYPE_004);

    private final ProbeOrchestrator orchestrator;
    private final ScrapeRegistryFactory registryFactory;
    private final ScrapeTimeoutResolver timeoutResolver;

    public MetricsController(ProbeOrchestrator orchestrator,
                             ScrapeRegistryFactory registryFactory,
                             ScrapeTimeoutResolver timeoutResolver) {
        this.orchestrator = orchestrator;
        this.registryFactory = registryFactory;
        this.timeoutResolver = timeoutResolver;
    }

    /**
     * Runs one full probe round and returns what it measured. Probe failures
     * show up in the metrics, never as an HTTP error.
     */
    @GetMapping("/metrics")
    public ResponseEntity<String> scrape(@RequestParam(value = "timeout", required = false) String timeout) {
        Duration resolved = timeoutResolver.resolve(timeout);
        PrometheusMeterRegistry registry = registryFactory.newRegistry();
        try {
            ScrapeResult result = orchestrator.handleScrape(resolved, registry);
            logger.info("Scrape finished in {} (timeout {}), {} probe(s), successful={}",
                    result.getDuration(), resolved, result.getRuns().size(), result.isSuccessful());
            return ResponseEntity.ok()
                    .contentType(PROMETHEUS_TEXT)
                    .body(registry.scrape());
        } finally {
            registry.close();
        }
    }
}
