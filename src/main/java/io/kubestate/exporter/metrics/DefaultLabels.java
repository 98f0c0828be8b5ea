package io.kubestate.exporter.metrics;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Identity labels put in front of every sample of a resource kind.
 *
 * @param keys   label keys, in exposition order
 * @param values extracts the values matching {@code keys} from an object
 */
public record DefaultLabels<T>(List<String> keys, Function<T, List<String>> values) {

    public DefaultLabels {
        keys = List.copyOf(keys);
    }

    /**
     * {@code namespace} and {@code <kindLabel>} for namespaced kinds.
     */
    public static <T extends HasMetadata> DefaultLabels<T> namespaced(String kindLabel) {
        return new DefaultLabels<>(List.of("namespace", kindLabel),
                o -> List.of(nullToEmpty(o.getMetadata().getNamespace()), nullToEmpty(o.getMetadata().getName())));
    }

    /**
     * Only {@code <kindLabel>} for cluster scoped kinds.
     */
    public static <T extends HasMetadata> DefaultLabels<T> clusterScoped(String kindLabel) {
        return new DefaultLabels<>(List.of(kindLabel),
                o -> List.of(nullToEmpty(o.getMetadata().getName())));
    }

    /**
     * Wrap a generator so each of its samples carries these labels first.
     * No sample is added when the generator produces none.
     */
    public FamilyGenerator<T> wrap(FamilyGenerator<T> generator) {
        Function<T, List<Metric>> inner = generator.generateFunc();
        Function<T, List<Metric>> wrapped = object -> {
            List<Metric> metrics = inner.apply(object);
            if (metrics == null || metrics.isEmpty()) {
                return List.of();
            }
            List<String> identity = values.apply(object);
            List<Metric> labeled = new ArrayList<>(metrics.size());
            for (Metric metric : metrics) {
                labeled.add(metric.withLeadingLabels(keys, identity));
            }
            return labeled;
        };
        return new FamilyGenerator<>(generator.name(), generator.type(), generator.help(), wrapped);
    }

    public List<FamilyGenerator<T>> wrapAll(List<FamilyGenerator<T>> generators) {
        return generators.stream().map(this::wrap).toList();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
