package io.kubestate.exporter.model;

import java.time.Instant;

/**
 * Read model describing the synchronization state of one resource store.
 *
 * Nulls indicate "not listed yet".
 */
public record StoreStatus(
        String resource,
        int objects,
        String resourceVersion,
        boolean synced,
        Instant lastListedAt
) {}
