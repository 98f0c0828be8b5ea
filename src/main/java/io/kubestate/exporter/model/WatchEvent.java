package io.kubestate.exporter.model;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Objects;

/**
 * A single change received from a watch stream.
 */
public record WatchEvent<T extends HasMetadata>(EventType type, T object) {

    public WatchEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(object, "object");
    }

    public String resourceVersion() {
        return object.getMetadata() != null ? object.getMetadata().getResourceVersion() : null;
    }
}
