package io.kubestate.exporter.consumer;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubestate.exporter.metrics.MetricFamily;
import io.kubestate.exporter.metrics.NoOpSelfMetrics;
import io.kubestate.exporter.metrics.SelfMetrics;
import io.kubestate.exporter.metrics.SelfMetricsRegistry;
import io.kubestate.exporter.model.EventType;
import io.kubestate.exporter.state.ResourceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static io.kubestate.exporter.testutil.TestFactory.fastSync;
import static io.kubestate.exporter.testutil.TestFactory.namespace;
import static io.kubestate.exporter.testutil.TestFactory.pod;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

public class ResourceStreamConsumerTest {

    private final FakeListWatcher<Pod> cluster = new FakeListWatcher<>();
    private final ResourceStore<Pod> store = new ResourceStore<>("pods");
    private ResourceStreamConsumer<Pod> consumer;
    private Thread thread;

    private void start(Duration resyncPeriod) {
        start(resyncPeriod, new NoOpSelfMetrics());
    }

    private void start(Duration resyncPeriod, SelfMetrics metrics) {
        consumer = new ResourceStreamConsumer<>("pods", Pod.class, cluster, store, fastSync(resyncPeriod), metrics);
        thread = new Thread(consumer, "test-sync");
        thread.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (consumer != null) {
            consumer.stop();
            thread.interrupt();
            thread.join(2000);
        }
    }

    @Test
    void testInitialListPopulatesStore() {
        cluster.applySilently(EventType.ADDED, pod("default", "a", "Running"));
        cluster.applySilently(EventType.ADDED, pod("default", "b", "Pending"));

        start(Duration.ofMinutes(5));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(store.hasSynced()).isTrue();
            assertThat(store.size()).isEqualTo(2);
        });
    }

    @Test
    void testWatchLivesForTheResyncPeriod() {
        start(Duration.ofMinutes(7));

        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() == 1);
        assertThat(cluster.lastWatchTimeout()).isEqualTo(Duration.ofMinutes(7));
    }

    @Test
    void testWatchEventsAreApplied() {
        start(Duration.ofMinutes(5));
        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() == 1);

        cluster.apply(EventType.ADDED, pod("default", "a", "Pending"));
        cluster.apply(EventType.MODIFIED, pod("default", "a", "Running"));
        cluster.apply(EventType.ADDED, pod("default", "b", "Running"));
        cluster.apply(EventType.DELETED, pod("default", "b", "Running"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(store.snapshot()).extracting(p -> p.getMetadata().getName()).containsExactly("a");
            assertThat(store.get("uid-default-a").getStatus().getPhase()).isEqualTo("Running");
        });
    }

    @Test
    void testClosedStreamRestartsFromList() {
        start(Duration.ofMinutes(5));
        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() == 1);

        cluster.terminateWatch(ResourceSyncException.Reason.STREAM_CLOSED);

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(cluster.listCalls()).isEqualTo(2);
            assertThat(cluster.watchCalls()).isEqualTo(2);
        });
    }

    @Test
    void testListFailuresAreRetried() {
        cluster.applySilently(EventType.ADDED, pod("default", "a", "Running"));
        cluster.failNextLists(3);

        start(Duration.ofMinutes(5));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(cluster.listCalls()).isEqualTo(4);
            assertThat(store.size()).isEqualTo(1);
        });
        assertThat(consumer.isRunning()).isTrue();
    }

    @Test
    void testWatchFailureFallsBackToList() {
        cluster.failNextWatches(1);

        start(Duration.ofMinutes(5));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(cluster.listCalls()).isEqualTo(2);
            assertThat(cluster.watchCalls()).isEqualTo(2);
        });
    }

    /**
     * An event that never reached the watch is repaired by the periodic re-list.
     */
    @Test
    void testPeriodicResyncRepairsDroppedEvents() {
        start(Duration.ofMillis(200));
        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() >= 1);

        cluster.applySilently(EventType.ADDED, pod("default", "missed", "Running"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(store.get("uid-default-missed")).isNotNull());
    }

    @Test
    void testForeignObjectsAreDropped() {
        SelfMetricsRegistry metrics = new SelfMetricsRegistry();
        start(Duration.ofMinutes(5), metrics);
        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() == 1);

        Namespace foreign = namespace("kube-system");
        cluster.injectForeign(foreign);
        cluster.apply(EventType.ADDED, pod("default", "a", "Running"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(store.size()).isEqualTo(1));
        assertThat(store.snapshot()).allMatch(p -> p instanceof Pod);

        // the counter is bumped right after the store write
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            MetricFamily events = metrics.snapshot().stream()
                    .filter(f -> f.name().equals("kube_state_metrics_watch_events_total"))
                    .findFirst()
                    .orElseThrow();
            assertThat(events.metrics()).hasSize(1);
            assertThat(events.metrics().get(0).labelValues()).containsExactly("pods", "added");
            assertThat(events.metrics().get(0).value()).isEqualTo(1.0);
        });
    }

    @Test
    void testStopEndsTheLoop() throws InterruptedException {
        start(Duration.ofMinutes(5));
        await().atMost(5, TimeUnit.SECONDS).until(() -> cluster.watchCalls() == 1);

        consumer.stop();
        thread.join(5000);

        assertThat(thread.isAlive()).isFalse();
    }
}
