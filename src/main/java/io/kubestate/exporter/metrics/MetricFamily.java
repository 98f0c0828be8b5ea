package io.kubestate.exporter.metrics;

import java.util.List;

/**
 * All samples of one metric name collected during a scrape. Built fresh on every scrape.
 */
public record MetricFamily(String name, MetricType type, String help, List<Metric> metrics) {

    public MetricFamily {
        metrics = List.copyOf(metrics);
    }
}
