package io.kubestate.exporter.metrics;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Encodings shared by all resource kinds for conditions, enumerated states and label maps.
 */
public final class StatusEncoding {

    public static final String CONDITION_TRUE = "True";
    public static final String CONDITION_FALSE = "False";
    public static final String CONDITION_UNKNOWN = "Unknown";

    /** Label value used when an optional reference is absent. */
    public static final String NONE = "<none>";

    private static final Pattern INVALID_LABEL_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private StatusEncoding() {
    }

    public static double boolValue(boolean b) {
        return b ? 1.0 : 0.0;
    }

    /**
     * A tri-state condition as three samples labeled {@code true}, {@code false} and
     * {@code unknown}. For a well-formed status exactly one of them is 1.
     */
    public static List<Metric> conditionMetrics(String labelKey, String status) {
        return List.of(
                Metric.of(List.of(labelKey), List.of("true"), boolValue(CONDITION_TRUE.equals(status))),
                Metric.of(List.of(labelKey), List.of("false"), boolValue(CONDITION_FALSE.equals(status))),
                Metric.of(List.of(labelKey), List.of("unknown"), boolValue(CONDITION_UNKNOWN.equals(status)))
        );
    }

    /**
     * One sample per entry, in declared order, valued by the entry's predicate.
     */
    public static <T> List<Metric> enumerationMetrics(String labelKey, List<StateEntry<T>> entries, T object) {
        List<Metric> metrics = new ArrayList<>(entries.size());
        for (StateEntry<T> entry : entries) {
            metrics.add(Metric.of(List.of(labelKey), List.of(entry.label()), boolValue(entry.matches().test(object))));
        }
        return metrics;
    }

    /**
     * One sample per recognized reason. A reason outside {@code recognized} yields all zeros.
     *
     * @param leadingKeys   labels placed before {@code reason}
     * @param leadingValues values of {@code leadingKeys}
     * @param actual        the observed reason, may be null
     */
    public static List<Metric> reasonMetrics(List<String> leadingKeys, List<String> leadingValues,
                                             List<String> recognized, String actual) {
        List<String> keys = new ArrayList<>(leadingKeys);
        keys.add("reason");
        List<Metric> metrics = new ArrayList<>(recognized.size());
        for (String reason : recognized) {
            List<String> values = new ArrayList<>(leadingValues);
            values.add(reason);
            metrics.add(Metric.of(keys, values, boolValue(reason.equals(actual))));
        }
        return metrics;
    }

    /**
     * Turn a map of cluster labels (or annotations) into exposition labels.
     * Keys are sanitized and prefixed, and sorted so the output is reproducible.
     * When two keys sanitize to the same name, the first in sort order wins.
     */
    public static LabelPairs mapToPrometheusLabels(String prefix, Map<String, String> source) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, String> entry : new TreeMap<>(source).entrySet()) {
                sanitized.putIfAbsent(prefix + sanitizeLabelName(entry.getKey()),
                        entry.getValue() == null ? "" : entry.getValue());
            }
        }
        return new LabelPairs(List.copyOf(sanitized.keySet()), List.copyOf(sanitized.values()));
    }

    public static LabelPairs kubeLabelsToPrometheusLabels(Map<String, String> labels) {
        return mapToPrometheusLabels("label_", labels);
    }

    public static LabelPairs kubeAnnotationsToPrometheusLabels(Map<String, String> annotations) {
        return mapToPrometheusLabels("annotation_", annotations);
    }

    public static String sanitizeLabelName(String name) {
        return INVALID_LABEL_CHARS.matcher(name).replaceAll("_");
    }

    /**
     * Creation time in Unix seconds, empty when the object carries no parseable timestamp.
     */
    public static Optional<Double> creationTimestampSeconds(HasMetadata object) {
        if (object.getMetadata() == null) {
            return Optional.empty();
        }
        return timestampSeconds(object.getMetadata().getCreationTimestamp());
    }

    public static Optional<Double> timestampSeconds(String rfc3339) {
        if (rfc3339 == null || rfc3339.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of((double) OffsetDateTime.parse(rfc3339).toEpochSecond());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Named predicate of a mutually exclusive state enumeration.
     */
    public record StateEntry<T>(String label, Predicate<T> matches) {
    }

    /**
     * Positionally paired label keys and values.
     */
    public record LabelPairs(List<String> keys, List<String> values) {

        public Metric toMetric(double value) {
            return Metric.of(keys, values, value);
        }
    }
}
