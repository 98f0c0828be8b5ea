package io.kubestate.exporter.engine;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubestate.exporter.metrics.FamilyGenerator;
import io.kubestate.exporter.metrics.Metric;
import io.kubestate.exporter.metrics.MetricFamily;
import io.kubestate.exporter.metrics.SelfMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the metrics of one scrape from the current content of every store.
 * <p>
 * - each kind is generated on a worker, from a point-in-time snapshot of its store
 * - a failing family is skipped for that object only
 * - a kind running past its timeout (or past the scrape deadline) is left out of this scrape
 * - samples are grouped by family, in registration order
 */
@Slf4j
public class MetricsAggregator {

    private final CollectorRegistry registry;
    private final SelfMetrics metrics;
    private final Duration scrapeTimeout;
    private final Duration kindTimeout;
    private final ExecutorService executor;

    public MetricsAggregator(
            CollectorRegistry registry,
            SelfMetrics metrics,
            Duration scrapeTimeout,
            Duration kindTimeout,
            int generationThreads
    ) {
        this.registry = registry;
        this.metrics = metrics;
        this.scrapeTimeout = scrapeTimeout;
        this.kindTimeout = kindTimeout;
        this.executor = Executors.newFixedThreadPool(
                Math.max(1, generationThreads),
                daemonThreadFactory()
        );
        log.info("Initialized MetricsAggregator (scrape timeout {}, per resource timeout {}, {} threads)",
                scrapeTimeout, kindTimeout, generationThreads);
    }

    public List<MetricFamily> scrape() {
        long start = System.nanoTime();
        long deadline = start + scrapeTimeout.toNanos();

        Map<ResourceCollector<?>, Future<Map<String, List<Metric>>>> pending = new LinkedHashMap<>();
        for (ResourceCollector<?> collector : registry.collectors()) {
            pending.put(collector, executor.submit(() -> generate(collector)));
        }

        Map<String, List<Metric>> samples = new LinkedHashMap<>();
        registry.families().keySet().forEach(name -> samples.put(name, new ArrayList<>()));

        boolean interrupted = false;
        for (Map.Entry<ResourceCollector<?>, Future<Map<String, List<Metric>>>> entry : pending.entrySet()) {
            String resource = entry.getKey().resource();
            Future<Map<String, List<Metric>>> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                continue;
            }
            long wait = Math.min(start + kindTimeout.toNanos(), deadline) - System.nanoTime();
            try {
                Map<String, List<Metric>> generated = future.get(Math.max(0, wait), TimeUnit.NANOSECONDS);
                generated.forEach((name, list) -> samples.computeIfAbsent(name, n -> new ArrayList<>()).addAll(list));
            } catch (TimeoutException e) {
                future.cancel(true);
                metrics.onGenerationTimeout(resource);
                log.warn("Generating metrics for {} exceeded its timeout, leaving it out of this scrape", resource);
            } catch (ExecutionException e) {
                metrics.onGenerationFailed(resource);
                log.error("Generating metrics for {} failed, leaving it out of this scrape", resource, e.getCause());
            } catch (CancellationException e) {
                log.warn("Generating metrics for {} was cancelled", resource);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                interrupted = true;
            }
        }

        List<MetricFamily> families = new ArrayList<>(samples.size());
        samples.forEach((name, list) -> {
            FamilyGenerator<?> declaration = registry.families().get(name);
            families.add(new MetricFamily(name, declaration.type(), declaration.help(), list));
        });

        Duration took = Duration.ofNanos(System.nanoTime() - start);
        metrics.onScrapeCompleted(took);
        log.debug("Scrape produced {} families in {} ms", families.size(), took.toMillis());
        return families;
    }

    /**
     * Run every family of one kind over a snapshot of its store.
     */
    <T extends HasMetadata> Map<String, List<Metric>> generate(ResourceCollector<T> collector) {
        List<T> objects = collector.store().snapshot();
        Map<String, List<Metric>> generated = new LinkedHashMap<>();
        for (FamilyGenerator<T> family : collector.kind().getGenerators()) {
            List<Metric> familyMetrics = new ArrayList<>();
            for (T object : objects) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("generation of " + collector.resource() + " cancelled");
                }
                try {
                    familyMetrics.addAll(family.generate(object));
                } catch (RuntimeException e) {
                    metrics.onGeneratorError(collector.resource(), family.name());
                    log.warn("Skipping {} for {} {}: {}", family.name(), collector.resource(),
                            describe(object), e.toString(), e);
                }
            }
            generated.put(family.name(), familyMetrics);
        }
        return generated;
    }

    @PreDestroy
    public void close() {
        executor.shutdownNow();
    }

    private static String describe(HasMetadata object) {
        if (object.getMetadata() == null) {
            return "<no metadata>";
        }
        String namespace = object.getMetadata().getNamespace();
        String name = object.getMetadata().getName();
        return namespace == null || namespace.isEmpty() ? name : namespace + "/" + name;
    }

    private static CustomizableThreadFactory daemonThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("metrics-generation-");
        factory.setDaemon(true);
        return factory;
    }
}
