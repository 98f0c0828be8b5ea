package io.kubestate.exporter.consumer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.kubestate.exporter.model.EventType;
import io.kubestate.exporter.model.ListResult;
import io.kubestate.exporter.model.WatchEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * {@link ListWatcher} backed by the Kubernetes API through the fabric8 client.
 * <p>
 * The push-style fabric8 {@link Watcher} is bridged into a blocking queue so the
 * synchronization loop can pull events at its own pace.
 */
@Slf4j
public class KubernetesListWatcher<T extends HasMetadata> implements ListWatcher<T> {

    private static final int HTTP_GONE = 410;

    private final String resource;
    private final Function<ListOptions, ? extends KubernetesResourceList<T>> lister;
    private final BiFunction<ListOptions, Watcher<T>, Watch> watcher;

    public KubernetesListWatcher(
            String resource,
            Function<ListOptions, ? extends KubernetesResourceList<T>> lister,
            BiFunction<ListOptions, Watcher<T>, Watch> watcher
    ) {
        this.resource = resource;
        this.lister = lister;
        this.watcher = watcher;
    }

    /**
     * Pods in one namespace, or in all namespaces when {@code namespace} is blank.
     */
    public static KubernetesListWatcher<Pod> pods(KubernetesClient client, String namespace) {
        if (isAllNamespaces(namespace)) {
            return new KubernetesListWatcher<>("pods",
                    opts -> client.pods().inAnyNamespace().list(opts),
                    (opts, w) -> client.pods().inAnyNamespace().watch(opts, w));
        }
        return new KubernetesListWatcher<>("pods",
                opts -> client.pods().inNamespace(namespace).list(opts),
                (opts, w) -> client.pods().inNamespace(namespace).watch(opts, w));
    }

    /**
     * Deployments in one namespace, or in all namespaces when {@code namespace} is blank.
     */
    public static KubernetesListWatcher<Deployment> deployments(KubernetesClient client, String namespace) {
        if (isAllNamespaces(namespace)) {
            return new KubernetesListWatcher<>("deployments",
                    opts -> client.apps().deployments().inAnyNamespace().list(opts),
                    (opts, w) -> client.apps().deployments().inAnyNamespace().watch(opts, w));
        }
        return new KubernetesListWatcher<>("deployments",
                opts -> client.apps().deployments().inNamespace(namespace).list(opts),
                (opts, w) -> client.apps().deployments().inNamespace(namespace).watch(opts, w));
    }

    /**
     * Namespaces are cluster scoped, so a namespace restriction does not apply.
     */
    public static KubernetesListWatcher<Namespace> namespaces(KubernetesClient client) {
        return new KubernetesListWatcher<>("namespaces",
                opts -> client.namespaces().list(opts),
                (opts, w) -> client.namespaces().watch(opts, w));
    }

    @Override
    public ListResult<T> list(Duration timeout) {
        ListOptions options = new ListOptionsBuilder()
                .withTimeoutSeconds(Math.max(1L, timeout.toSeconds()))
                .build();
        try {
            KubernetesResourceList<T> list = lister.apply(options);
            String version = list.getMetadata() != null ? list.getMetadata().getResourceVersion() : null;
            List<T> items = list.getItems() != null ? list.getItems() : List.of();
            return new ListResult<>(items, version);
        } catch (KubernetesClientException e) {
            throw new ResourceSyncException(ResourceSyncException.Reason.LIST_FAILED,
                    "list " + resource + " returned " + e.getCode(), e);
        }
    }

    @Override
    public WatchStream watch(String fromVersion, Duration timeout) {
        ListOptions options = new ListOptionsBuilder()
                .withResourceVersion(fromVersion)
                .withAllowWatchBookmarks(true)
                .withTimeoutSeconds(Math.max(1L, timeout.toSeconds()))
                .build();
        QueueWatchStream<T> stream = new QueueWatchStream<>(resource);
        try {
            stream.attach(watcher.apply(options, stream));
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_GONE) {
                throw new ResourceSyncException(ResourceSyncException.Reason.EXPIRED,
                        "version " + fromVersion + " of " + resource + " expired", e);
            }
            throw new ResourceSyncException(ResourceSyncException.Reason.WATCH_FAILED,
                    "watch " + resource + " returned " + e.getCode(), e);
        }
        return stream;
    }

    /**
     * Client configuration this adapter relies on.
     * <p>
     * fabric8 reopens an ended watch from the last version it saw unless its reconnect limit
     * is zero. Resuming would skip the listing that repairs dropped events, so every end of a
     * stream has to reach {@link Watcher#onClose(WatcherException)} instead.
     */
    public static Config withoutWatchReconnect(Config config) {
        return new ConfigBuilder(config)
                .withWatchReconnectLimit(0)
                .build();
    }

    private static boolean isAllNamespaces(String namespace) {
        return namespace == null || namespace.isBlank();
    }

    /**
     * Queue fed by fabric8 callback threads and drained by the synchronization loop.
     * An end of the stream is queued behind the events received before it.
     */
    static final class QueueWatchStream<T extends HasMetadata> implements Watcher<T>, WatchStream {

        private final String resource;
        private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
        private volatile Watch watch;
        private volatile ResourceSyncException terminal;

        QueueWatchStream(String resource) {
            this.resource = resource;
        }

        void attach(Watch watch) {
            this.watch = watch;
        }

        @Override
        public void eventReceived(Action action, T object) {
            switch (action) {
                case ADDED -> queue.add(Signal.of(new WatchEvent<>(EventType.ADDED, object)));
                case MODIFIED -> queue.add(Signal.of(new WatchEvent<>(EventType.MODIFIED, object)));
                case DELETED -> queue.add(Signal.of(new WatchEvent<>(EventType.DELETED, object)));
                case BOOKMARK -> queue.add(Signal.of(new WatchEvent<>(EventType.BOOKMARK, object)));
                case ERROR -> queue.add(Signal.closing(new ResourceSyncException(ResourceSyncException.Reason.WATCH_FAILED,
                        "watch " + resource + " delivered an error event")));
            }
        }

        /**
         * Called once the stream is over and fabric8 will not reopen it.
         * <ul>
         *   <li>410 Gone: the version expired</li>
         *   <li>any other HTTP error status: the watch failed</li>
         *   <li>no status (the server or the connection ended the stream): a plain end</li>
         * </ul>
         */
        @Override
        public void onClose(WatcherException cause) {
            if (cause.isHttpGone()) {
                queue.add(Signal.closing(new ResourceSyncException(ResourceSyncException.Reason.EXPIRED,
                        "watch version of " + resource + " expired", cause)));
                return;
            }
            int code = Optional.ofNullable(cause.asClientException()).map(KubernetesClientException::getCode).orElse(0);
            if (code >= 400) {
                queue.add(Signal.closing(new ResourceSyncException(ResourceSyncException.Reason.WATCH_FAILED,
                        "watch " + resource + " closed with status " + code, cause)));
            } else {
                queue.add(Signal.closing(new ResourceSyncException(ResourceSyncException.Reason.STREAM_CLOSED,
                        "watch " + resource + " ended: " + cause.getMessage(), cause)));
            }
        }

        @Override
        public void onClose() {
            queue.add(Signal.closing(new ResourceSyncException(ResourceSyncException.Reason.STREAM_CLOSED,
                    "watch " + resource + " closed")));
        }

        @Override
        public Optional<WatchEvent<?>> next(Duration timeout) throws InterruptedException {
            if (terminal != null) {
                throw terminal;
            }
            Signal signal = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (signal == null) {
                return Optional.empty();
            }
            if (signal.end() != null) {
                terminal = signal.end();
                close();
                throw terminal;
            }
            return Optional.of(signal.event());
        }

        @Override
        public void close() {
            Watch current = watch;
            if (current != null) {
                try {
                    current.close();
                } catch (RuntimeException e) {
                    log.debug("Closing watch of {} failed", resource, e);
                }
            }
        }
    }

    /**
     * One queued item: an event, or the end of the stream.
     */
    private record Signal(WatchEvent<?> event, ResourceSyncException end) {

        static Signal of(WatchEvent<?> event) {
            return new Signal(event, null);
        }

        static Signal closing(ResourceSyncException end) {
            return new Signal(null, end);
        }
    }
}
