package io.kubestate.exporter.metrics;

import io.kubestate.exporter.engine.CollectorRegistry;
import io.kubestate.exporter.engine.MetricsAggregator;
import io.kubestate.exporter.model.StoreStatus;
import io.kubestate.exporter.output.TextExpositionWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Scrape endpoint for cluster state, plus the exporter's own telemetry and store status.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsAggregator aggregator;
    private final SelfMetrics selfMetrics;
    private final CollectorRegistry registry;
    private final TextExpositionWriter writer;

    @GetMapping(value = "/metrics", produces = TextExpositionWriter.CONTENT_TYPE)
    public String metrics() {
        return writer.write(aggregator.scrape());
    }

    @GetMapping(value = "/telemetry", produces = TextExpositionWriter.CONTENT_TYPE)
    public String telemetry() {
        return writer.write(selfMetrics.snapshot());
    }

    /**
     * Used by dashboards and debugging tools.
     */
    @GetMapping("/status")
    public List<StoreStatus> status() {
        return registry.statuses();
    }

    @GetMapping(value = "/healthz", produces = "text/plain")
    public String healthz() {
        return "ok";
    }
}
