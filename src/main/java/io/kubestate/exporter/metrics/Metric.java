package io.kubestate.exporter.metrics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One labeled sample. Keys and values are paired by position, and their order is the order
 * they are exposed in.
 */
public record Metric(List<String> labelKeys, List<String> labelValues, double value) {

    public Metric {
        labelKeys = List.copyOf(labelKeys);
        labelValues = List.copyOf(labelValues);
        if (labelKeys.size() != labelValues.size()) {
            throw new IllegalArgumentException("label keys " + labelKeys + " and values " + labelValues
                    + " differ in length");
        }
        Set<String> seen = new HashSet<>();
        for (String key : labelKeys) {
            if (!seen.add(key)) {
                throw new IllegalArgumentException("duplicate label key " + key + " in " + labelKeys);
            }
        }
    }

    public static Metric of(double value) {
        return new Metric(List.of(), List.of(), value);
    }

    public static Metric of(List<String> labelKeys, List<String> labelValues, double value) {
        return new Metric(labelKeys, labelValues, value);
    }

    /**
     * Copy of this sample with {@code keys}/{@code values} placed before its own labels.
     */
    public Metric withLeadingLabels(List<String> keys, List<String> values) {
        List<String> mergedKeys = new ArrayList<>(keys.size() + labelKeys.size());
        mergedKeys.addAll(keys);
        mergedKeys.addAll(labelKeys);
        List<String> mergedValues = new ArrayList<>(values.size() + labelValues.size());
        mergedValues.addAll(values);
        mergedValues.addAll(labelValues);
        return new Metric(mergedKeys, mergedValues, value);
    }
}
