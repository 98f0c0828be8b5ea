package io.kubestate.exporter.consumer;

import io.kubestate.exporter.engine.CollectorRegistry;
import io.kubestate.exporter.engine.ResourceCollector;
import io.kubestate.exporter.metrics.SelfMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one synchronization loop per registered resource kind for the lifetime of the
 * application. Each store is written by its own loop only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SynchronizationService {

    private final CollectorRegistry registry;
    private final SyncSettings settings;
    private final SelfMetrics metrics;

    private final List<ResourceStreamConsumer<?>> consumers = new ArrayList<>();
    private ExecutorService executor;

    @PostConstruct
    public void start() {
        List<ResourceCollector<?>> collectors = registry.collectors();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("resource-sync-");
        threadFactory.setDaemon(true);
        executor = Executors.newFixedThreadPool(Math.max(1, collectors.size()), threadFactory);
        for (ResourceCollector<?> collector : collectors) {
            ResourceStreamConsumer<?> consumer = collector.newConsumer(settings, metrics);
            consumers.add(consumer);
            executor.submit(consumer);
        }
        log.info("Started {} synchronization loops", consumers.size());
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        consumers.forEach(ResourceStreamConsumer::stop);
        if (executor != null) {
            executor.shutdownNow();
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Synchronization loops did not stop within 10 seconds");
            }
        }
        log.info("Synchronization service stopped");
    }
}
