package io.kubestate.exporter.consumer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubestate.exporter.model.ListResult;

import java.time.Duration;

/**
 * Source of objects of one resource kind: a full listing plus a change stream from a version.
 */
public interface ListWatcher<T extends HasMetadata> {

    /**
     * List every object of the kind.
     *
     * @throws ResourceSyncException if the listing cannot be obtained
     */
    ListResult<T> list(Duration timeout);

    /**
     * Open a change stream starting right after {@code fromVersion}. The stream is never
     * resumed behind the caller's back: once it ends, {@link WatchStream#next} reports it.
     *
     * @param timeout how long the server may keep the stream open
     * @throws ResourceSyncException if the stream cannot be opened
     */
    WatchStream watch(String fromVersion, Duration timeout);
}
