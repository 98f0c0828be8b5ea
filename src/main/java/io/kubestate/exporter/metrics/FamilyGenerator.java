package io.kubestate.exporter.metrics;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Declares one metric family of a resource kind and how to derive its samples from a single
 * object. The function must not keep state between calls.
 */
public record FamilyGenerator<T>(
        String name,
        MetricType type,
        String help,
        Function<T, List<Metric>> generateFunc
) {

    /**
     * Every exported metric name starts with this token.
     */
    public static final String NAMESPACE_PREFIX = "kube_";

    /**
     * Counters are exposed under a name ending in this suffix, so they must be declared with it.
     */
    public static final String COUNTER_SUFFIX = "_total";

    public FamilyGenerator {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(help, "help");
        Objects.requireNonNull(generateFunc, "generateFunc");
        if (!name.startsWith(NAMESPACE_PREFIX)) {
            throw new IllegalArgumentException("metric family " + name + " must start with " + NAMESPACE_PREFIX);
        }
        if (type == MetricType.COUNTER && !name.endsWith(COUNTER_SUFFIX)) {
            throw new IllegalArgumentException("counter " + name + " must end with " + COUNTER_SUFFIX);
        }
    }

    public static <T> FamilyGenerator<T> gauge(String name, String help, Function<T, List<Metric>> generateFunc) {
        return new FamilyGenerator<>(name, MetricType.GAUGE, help, generateFunc);
    }

    public List<Metric> generate(T object) {
        List<Metric> metrics = generateFunc.apply(object);
        return metrics != null ? metrics : List.of();
    }
}
