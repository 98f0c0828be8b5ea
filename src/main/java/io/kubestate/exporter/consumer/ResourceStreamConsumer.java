package io.kubestate.exporter.consumer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubestate.exporter.metrics.SelfMetrics;
import io.kubestate.exporter.model.ListResult;
import io.kubestate.exporter.model.WatchEvent;
import io.kubestate.exporter.state.ResourceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps one {@link ResourceStore} synchronized with the cluster.
 * <p>
 * Protocol:
 * - list every object and replace the store content
 * - watch from the listed version and apply events as they arrive
 * - when the stream ends, breaks or its version expires, list again; an old watermark is
 *   never resumed
 * - list again every resync period even if the stream stays healthy
 * <p>
 * Failed calls are retried with backoff. Nothing here is fatal: while the kind cannot be
 * synchronized the store keeps serving its last known content.
 */
@Slf4j
public class ResourceStreamConsumer<T extends HasMetadata> implements Runnable {

    private final String resource;
    private final Class<T> type;
    private final ListWatcher<T> listWatcher;
    private final ResourceStore<T> store;
    private final SyncSettings settings;
    private final SelfMetrics metrics;
    private final Clock clock;

    private volatile boolean running = true;
    private BackOffExecution backOffExecution;

    public ResourceStreamConsumer(
            String resource,
            Class<T> type,
            ListWatcher<T> listWatcher,
            ResourceStore<T> store,
            SyncSettings settings,
            SelfMetrics metrics
    ) {
        this(resource, type, listWatcher, store, settings, metrics, Clock.systemUTC());
    }

    ResourceStreamConsumer(
            String resource,
            Class<T> type,
            ListWatcher<T> listWatcher,
            ResourceStore<T> store,
            SyncSettings settings,
            SelfMetrics metrics,
            Clock clock
    ) {
        this.resource = resource;
        this.type = type;
        this.listWatcher = listWatcher;
        this.store = store;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.backOffExecution = settings.backOff().start();
    }

    @Override
    public void run() {
        log.info("Starting synchronization of {} (resync every {})", resource, settings.resyncPeriod());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                listAndWatch();
            } catch (ResourceSyncException e) {
                metrics.onSyncError(resource, e.getReason().name().toLowerCase());
                if (e.isRelistImmediately()) {
                    log.info("Watch of {} ended ({}), listing again", resource, e.getMessage());
                } else {
                    long delay = nextBackOff();
                    log.warn("Synchronization of {} failed ({}), retrying in {} ms",
                            resource, e.getMessage(), delay, e);
                    pause(delay);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            } catch (RuntimeException e) {
                metrics.onSyncError(resource, "unexpected");
                long delay = nextBackOff();
                log.error("Unexpected error while synchronizing {}, retrying in {} ms", resource, delay, e);
                pause(delay);
            }
        }
        log.info("Stopped synchronization of {}", resource);
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One full cycle: list, then watch until the stream ends or the resync period elapses.
     */
    void listAndWatch() throws InterruptedException {
        ListResult<T> listing = list();
        store.replace(listing.items(), listing.resourceVersion());
        metrics.onListCompleted(resource, listing.items().size());
        backOffExecution = settings.backOff().start();
        log.debug("Listed {} {} at version {}", listing.items().size(), resource, listing.resourceVersion());

        Instant resyncAt = clock.instant().plus(settings.resyncPeriod());
        try (WatchStream stream = listWatcher.watch(listing.resourceVersion(), settings.resyncPeriod())) {
            while (running) {
                Duration remaining = Duration.between(clock.instant(), resyncAt);
                if (remaining.isNegative() || remaining.isZero()) {
                    log.debug("Resync period of {} elapsed, listing again", resource);
                    return;
                }
                Duration wait = remaining.compareTo(settings.pollInterval()) < 0 ? remaining : settings.pollInterval();
                Optional<WatchEvent<?>> event = stream.next(wait);
                if (event.isPresent()) {
                    apply(event.get());
                }
            }
        }
    }

    void apply(WatchEvent<?> event) {
        HasMetadata object = event.object();
        if (!type.isInstance(object)) {
            log.warn("Dropping {} event for {}: expected {} but got {}",
                    event.type(), resource, type.getSimpleName(), object.getClass().getName());
            return;
        }
        T typed = type.cast(object);
        switch (event.type()) {
            case ADDED, MODIFIED -> store.upsert(typed);
            case DELETED -> store.delete(typed);
            case BOOKMARK -> store.advanceWatermark(event.resourceVersion());
        }
        metrics.onWatchEvent(resource, event.type());
        metrics.onStoreSizeUpdated(resource, store.size());
    }

    private ListResult<T> list() {
        try {
            return listWatcher.list(settings.requestTimeout());
        } catch (ResourceSyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResourceSyncException(ResourceSyncException.Reason.LIST_FAILED,
                    "listing " + resource + " failed", e);
        }
    }

    private long nextBackOff() {
        long delay = backOffExecution.nextBackOff();
        if (delay == BackOffExecution.STOP) {
            backOffExecution = settings.backOff().start();
            delay = backOffExecution.nextBackOff();
        }
        return Math.max(0, delay);
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
