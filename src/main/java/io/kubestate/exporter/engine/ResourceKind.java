package io.kubestate.exporter.engine;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubestate.exporter.metrics.DefaultLabels;
import io.kubestate.exporter.metrics.FamilyGenerator;
import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declares how one resource kind is turned into metrics: its Java type, identity labels and the
 * table of metric families. The families are wrapped with the default labels once, here.
 */
@Getter
public final class ResourceKind<T extends HasMetadata> {

    private final String resource;
    private final Class<T> type;
    private final DefaultLabels<T> defaultLabels;
    private final List<FamilyGenerator<T>> generators;

    public ResourceKind(String resource, Class<T> type, DefaultLabels<T> defaultLabels,
                        List<FamilyGenerator<T>> families) {
        Set<String> names = new HashSet<>();
        for (FamilyGenerator<T> family : families) {
            if (!names.add(family.name())) {
                throw new IllegalArgumentException("metric family " + family.name()
                        + " declared twice for " + resource);
            }
        }
        this.resource = resource;
        this.type = type;
        this.defaultLabels = defaultLabels;
        this.generators = defaultLabels.wrapAll(families);
    }
}
