package io.kubestate.exporter.metrics;

import io.kubestate.exporter.model.EventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.kubestate.exporter.testutil.TestFactory.family;
import static io.kubestate.exporter.testutil.TestFactory.withLabel;
import static org.assertj.core.api.Assertions.assertThat;

public class SelfMetricsRegistryTest {

    private final SelfMetricsRegistry registry = new SelfMetricsRegistry();

    @Test
    void testEveryFamilyIsPresentBeforeAnyActivity() {
        List<MetricFamily> families = registry.snapshot();

        assertThat(families).extracting(MetricFamily::name).containsExactly(
                "kube_state_metrics_list_total",
                "kube_state_metrics_watch_events_total",
                "kube_state_metrics_sync_errors_total",
                "kube_state_metrics_generator_errors_total",
                "kube_state_metrics_generation_timeouts_total",
                "kube_state_metrics_generation_failures_total",
                "kube_state_metrics_store_objects",
                "kube_state_metrics_last_scrape_duration_seconds");
        assertThat(families).allMatch(f -> f.metrics().isEmpty());
    }

    @Test
    void testCountersAccumulatePerLabelSet() {
        registry.onWatchEvent("pods", EventType.ADDED);
        registry.onWatchEvent("pods", EventType.ADDED);
        registry.onWatchEvent("pods", EventType.DELETED);
        registry.onWatchEvent("deployments", EventType.ADDED);
        registry.onSyncError("pods", "expired");

        List<MetricFamily> families = registry.snapshot();
        List<Metric> events = family(families, "kube_state_metrics_watch_events_total").metrics();

        assertThat(events).hasSize(3);
        assertThat(events).filteredOn(m -> m.labelValues().equals(List.of("pods", "added")))
                .singleElement()
                .satisfies(m -> assertThat(m.value()).isEqualTo(2.0));
        assertThat(withLabel(events, "event", "deleted").value()).isEqualTo(1.0);
        assertThat(family(families, "kube_state_metrics_watch_events_total").type()).isEqualTo(MetricType.COUNTER);
        assertThat(withLabel(family(families, "kube_state_metrics_sync_errors_total").metrics(), "reason", "expired")
                .labelValues()).containsExactly("pods", "expired");
    }

    @Test
    void testGaugesHoldLatestValue() {
        registry.onListCompleted("pods", 12);
        registry.onStoreSizeUpdated("pods", 11);
        registry.onScrapeCompleted(Duration.ofMillis(250));

        List<MetricFamily> families = registry.snapshot();

        assertThat(withLabel(family(families, "kube_state_metrics_store_objects").metrics(), "resource", "pods").value())
                .isEqualTo(11.0);
        assertThat(family(families, "kube_state_metrics_list_total").metrics())
                .singleElement()
                .satisfies(m -> assertThat(m.value()).isEqualTo(1.0));
        assertThat(family(families, "kube_state_metrics_last_scrape_duration_seconds").metrics())
                .singleElement()
                .satisfies(m -> assertThat(m.value()).isEqualTo(0.25));
    }
}
