package io.kubestate.exporter.metrics;

import io.kubestate.exporter.model.EventType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class SelfMetricsRegistry implements SelfMetrics {

    static final String PREFIX = "kube_state_metrics_";

    private final LabeledCounters lists = new LabeledCounters("resource");
    private final LabeledCounters watchEvents = new LabeledCounters("resource", "event");
    private final LabeledCounters syncErrors = new LabeledCounters("resource", "reason");
    private final LabeledCounters generatorErrors = new LabeledCounters("resource", "family");
    private final LabeledCounters generationTimeouts = new LabeledCounters("resource");
    private final LabeledCounters generationFailures = new LabeledCounters("resource");

    private final ConcurrentMap<String, AtomicLong> storeObjects = new ConcurrentSkipListMap<>();

    private final AtomicReference<Double> lastScrapeSeconds = new AtomicReference<>();

    @Override
    public void onListCompleted(String resource, int objects) {
        lists.increment(resource);
        onStoreSizeUpdated(resource, objects);
    }

    @Override
    public void onWatchEvent(String resource, EventType type) {
        watchEvents.increment(resource, type.label);
    }

    @Override
    public void onStoreSizeUpdated(String resource, int size) {
        storeObjects.computeIfAbsent(resource, r -> new AtomicLong()).set(size);
    }

    @Override
    public void onSyncError(String resource, String reason) {
        syncErrors.increment(resource, reason);
    }

    @Override
    public void onGeneratorError(String resource, String family) {
        generatorErrors.increment(resource, family);
    }

    @Override
    public void onGenerationTimeout(String resource) {
        generationTimeouts.increment(resource);
    }

    @Override
    public void onGenerationFailed(String resource) {
        generationFailures.increment(resource);
    }

    @Override
    public void onScrapeCompleted(Duration duration) {
        lastScrapeSeconds.set(duration.toNanos() / 1e9);
    }

    /* ---------- Snapshot ---------- */

    @Override
    public List<MetricFamily> snapshot() {
        List<MetricFamily> families = new ArrayList<>();
        families.add(lists.toFamily(PREFIX + "list_total", "Number of completed full listings per resource."));
        families.add(watchEvents.toFamily(PREFIX + "watch_events_total", "Number of applied watch events."));
        families.add(syncErrors.toFamily(PREFIX + "sync_errors_total",
                "Number of list/watch interruptions recovered by listing again."));
        families.add(generatorErrors.toFamily(PREFIX + "generator_errors_total",
                "Number of objects skipped because a metric family failed to generate."));
        families.add(generationTimeouts.toFamily(PREFIX + "generation_timeouts_total",
                "Number of scrapes in which a resource exceeded its generation timeout."));
        families.add(generationFailures.toFamily(PREFIX + "generation_failures_total",
                "Number of scrapes in which generating a whole resource failed."));

        List<Metric> sizes = new ArrayList<>();
        storeObjects.forEach((resource, size) ->
                sizes.add(Metric.of(List.of("resource"), List.of(resource), size.get())));
        families.add(new MetricFamily(PREFIX + "store_objects", MetricType.GAUGE,
                "Number of objects currently cached per resource.", sizes));

        Double seconds = lastScrapeSeconds.get();
        families.add(new MetricFamily(PREFIX + "last_scrape_duration_seconds", MetricType.GAUGE,
                "Duration of the most recent scrape.", seconds == null ? List.of() : List.of(Metric.of(seconds))));
        return families;
    }

    /**
     * Counters keyed by their label values; label values are joined with a separator that
     * cannot occur in resource or family names.
     */
    private static final class LabeledCounters {

        private static final String SEPARATOR = "\u0000";

        private final List<String> keys;
        private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

        LabeledCounters(String... keys) {
            this.keys = List.of(keys);
        }

        void increment(String... values) {
            counters.computeIfAbsent(String.join(SEPARATOR, values), k -> new AtomicLong()).incrementAndGet();
        }

        MetricFamily toFamily(String name, String help) {
            List<Metric> metrics = new ArrayList<>();
            new ConcurrentSkipListMap<>(counters).forEach((joined, count) ->
                    metrics.add(Metric.of(keys, List.of(joined.split(SEPARATOR, -1)), count.get())));
            return new MetricFamily(name, MetricType.COUNTER, help, metrics);
        }
    }
}
