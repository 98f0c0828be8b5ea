package io.kubestate.exporter.engine;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubestate.exporter.consumer.ListWatcher;
import io.kubestate.exporter.consumer.ResourceStreamConsumer;
import io.kubestate.exporter.consumer.SyncSettings;
import io.kubestate.exporter.metrics.SelfMetrics;
import io.kubestate.exporter.state.ResourceStore;

/**
 * A resource kind bound to its store and to the source that keeps the store up to date.
 */
public record ResourceCollector<T extends HasMetadata>(
        ResourceKind<T> kind,
        ResourceStore<T> store,
        ListWatcher<T> listWatcher
) {

    public static <T extends HasMetadata> ResourceCollector<T> of(ResourceKind<T> kind, ListWatcher<T> listWatcher) {
        return new ResourceCollector<>(kind, new ResourceStore<>(kind.getResource()), listWatcher);
    }

    public String resource() {
        return kind.getResource();
    }

    /**
     * The synchronization loop owning this collector's store. Only one may run at a time.
     */
    public ResourceStreamConsumer<T> newConsumer(SyncSettings settings, SelfMetrics metrics) {
        return new ResourceStreamConsumer<>(resource(), kind.getType(), listWatcher, store, settings, metrics);
    }
}
