package io.kubestate.exporter.metrics;

import io.kubestate.exporter.model.EventType;

import java.time.Duration;
import java.util.List;

/**
 * Lightweight metrics API about the exporter itself, used by the synchronization loops and the
 * aggregator and exposed via /telemetry.
 */
public interface SelfMetrics {

    void onListCompleted(String resource, int objects);

    void onWatchEvent(String resource, EventType type);

    void onStoreSizeUpdated(String resource, int size);

    void onSyncError(String resource, String reason);

    void onGeneratorError(String resource, String family);

    void onGenerationTimeout(String resource);

    /**
     * Generation of a whole resource kind failed; none of its families were produced this scrape.
     */
    void onGenerationFailed(String resource);

    void onScrapeCompleted(Duration duration);

    List<MetricFamily> snapshot();
}
