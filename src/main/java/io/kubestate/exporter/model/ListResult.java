package io.kubestate.exporter.model;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.List;

/**
 * Full listing of one resource kind together with the version the listing was taken at.
 */
public record ListResult<T extends HasMetadata>(List<T> items, String resourceVersion) {

    public ListResult {
        items = List.copyOf(items);
    }
}
