package io.kubestate.exporter.engine;

import io.kubestate.exporter.metrics.FamilyGenerator;
import io.kubestate.exporter.model.StoreStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of watched resource kinds. Built once at startup and never changed afterwards.
 */
@Slf4j
public class CollectorRegistry {

    private final List<ResourceCollector<?>> collectors;
    private final Map<String, FamilyGenerator<?>> families;

    private CollectorRegistry(List<ResourceCollector<?>> collectors, Map<String, FamilyGenerator<?>> families) {
        this.collectors = List.copyOf(collectors);
        this.families = Collections.unmodifiableMap(families);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return collectors in registration order
     */
    public List<ResourceCollector<?>> collectors() {
        return collectors;
    }

    /**
     * @return one declaration per family name, in registration order
     */
    public Map<String, FamilyGenerator<?>> families() {
        return families;
    }

    public List<StoreStatus> statuses() {
        return collectors.stream().map(c -> c.store().status()).toList();
    }

    public static final class Builder {

        private final List<ResourceCollector<?>> collectors = new ArrayList<>();

        public Builder register(ResourceCollector<?> collector) {
            collectors.add(collector);
            return this;
        }

        public CollectorRegistry build() {
            Map<String, ResourceCollector<?>> byResource = new LinkedHashMap<>();
            Map<String, FamilyGenerator<?>> families = new LinkedHashMap<>();
            for (ResourceCollector<?> collector : collectors) {
                if (byResource.putIfAbsent(collector.resource(), collector) != null) {
                    throw new IllegalArgumentException("resource " + collector.resource() + " registered twice");
                }
                for (FamilyGenerator<?> family : collector.kind().getGenerators()) {
                    FamilyGenerator<?> existing = families.putIfAbsent(family.name(), family);
                    if (existing != null && existing.type() != family.type()) {
                        throw new IllegalArgumentException("metric family " + family.name()
                                + " declared as both " + existing.type() + " and " + family.type());
                    }
                }
            }
            log.info("Registered collectors {} with {} metric families", byResource.keySet(), families.size());
            return new CollectorRegistry(collectors, families);
        }
    }
}
