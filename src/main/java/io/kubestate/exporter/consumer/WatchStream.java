package io.kubestate.exporter.consumer;

import io.kubestate.exporter.model.WatchEvent;

import java.time.Duration;
import java.util.Optional;

/**
 * An open change stream. Closing it releases the underlying connection.
 * <p>
 * Events are not typed by kind: the wire may carry objects of another type, and the
 * synchronization loop checks each one before it reaches a store.
 */
public interface WatchStream extends AutoCloseable {

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the next event, or empty if none arrived in time
     * @throws ResourceSyncException once the stream has ended, failed or expired
     * @throws InterruptedException  if the waiting thread is interrupted
     */
    Optional<WatchEvent<?>> next(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
