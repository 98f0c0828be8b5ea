package io.kubestate.exporter.state;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static io.kubestate.exporter.testutil.TestFactory.pod;
import static org.assertj.core.api.Assertions.assertThat;

public class ResourceStoreTest {

    private Pod versioned(String name, String resourceVersion, String phase) {
        return new PodBuilder(pod("default", name, phase))
                .editMetadata().withResourceVersion(resourceVersion).endMetadata()
                .build();
    }

    @Test
    void testReplaceSwapsWholeContent() {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        store.replace(List.of(versioned("a", "1", "Running"), versioned("b", "2", "Running")), "2");

        store.replace(List.of(versioned("c", "5", "Pending")), "5");

        assertThat(store.snapshot())
                .extracting(p -> p.getMetadata().getName())
                .containsExactly("c");
        assertThat(store.resourceVersion()).isEqualTo("5");
        assertThat(store.hasSynced()).isTrue();
    }

    @Test
    void testUpsertAndDelete() {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        store.replace(List.of(), "10");

        store.upsert(versioned("a", "11", "Pending"));
        store.upsert(versioned("a", "12", "Running"));
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("uid-default-a").getStatus().getPhase()).isEqualTo("Running");

        boolean removed = store.delete(versioned("a", "13", "Running"));

        assertThat(removed).isTrue();
        assertThat(store.size()).isZero();
        assertThat(store.resourceVersion()).isEqualTo("13");
    }

    /**
     * A replayed, older update must not overwrite what the store already has.
     */
    @Test
    void testStaleUpdateIsIgnored() {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        store.upsert(versioned("a", "20", "Running"));

        boolean stored = store.upsert(versioned("a", "19", "Pending"));

        assertThat(stored).isFalse();
        assertThat(store.get("uid-default-a").getStatus().getPhase()).isEqualTo("Running");
        assertThat(store.resourceVersion()).isEqualTo("20");
    }

    @Test
    void testWatermarkNeverMovesBackwards() {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        store.replace(List.of(), "50");

        store.advanceWatermark("40");
        assertThat(store.resourceVersion()).isEqualTo("50");

        store.advanceWatermark("60");
        assertThat(store.resourceVersion()).isEqualTo("60");
    }

    @Test
    void testObjectsWithoutUidAreKeyedByNamespaceAndName() {
        Pod pod = new PodBuilder().withNewMetadata().withNamespace("ns").withName("p").endMetadata().build();

        assertThat(ResourceStore.keyOf(pod)).isEqualTo("ns/p");
    }

    @Test
    void testSnapshotIsUnaffectedByLaterWrites() {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        store.replace(List.of(versioned("a", "1", "Running")), "1");

        List<Pod> snapshot = store.snapshot();
        store.upsert(versioned("b", "2", "Running"));
        store.delete(versioned("a", "3", "Running"));

        assertThat(snapshot).extracting(p -> p.getMetadata().getName()).containsExactly("a");
    }

    /**
     * Readers must see either all of a replace or none of it.
     */
    @Test
    void testConcurrentReadersNeverSeePartialReplace() throws Exception {
        ResourceStore<Pod> store = new ResourceStore<>("pods");
        List<Pod> even = List.of(versioned("a", "1", "Running"), versioned("b", "1", "Running"));
        List<Pod> odd = List.of(versioned("c", "2", "Running"), versioned("d", "2", "Running"),
                versioned("e", "2", "Running"));
        store.replace(even, "1");

        AtomicReference<Integer> unexpected = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            while (done.getCount() > 0) {
                int size = store.snapshot().size();
                if (size != 2 && size != 3) {
                    unexpected.set(size);
                }
            }
        });
        reader.start();
        for (int i = 0; i < 2000; i++) {
            store.replace(i % 2 == 0 ? odd : even, String.valueOf(i));
        }
        done.countDown();
        reader.join();

        assertThat(unexpected.get()).isNull();
    }
}
