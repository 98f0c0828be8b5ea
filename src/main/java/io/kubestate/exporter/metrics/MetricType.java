package io.kubestate.exporter.metrics;

public enum MetricType {
    GAUGE,
    COUNTER
}
