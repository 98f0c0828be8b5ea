package io.kubestate.exporter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.kubestate.exporter.collectors.DeploymentFamilies;
import io.kubestate.exporter.collectors.NamespaceFamilies;
import io.kubestate.exporter.collectors.PodFamilies;
import io.kubestate.exporter.consumer.KubernetesListWatcher;
import io.kubestate.exporter.consumer.SyncSettings;
import io.kubestate.exporter.engine.CollectorRegistry;
import io.kubestate.exporter.engine.MetricsAggregator;
import io.kubestate.exporter.engine.ResourceCollector;
import io.kubestate.exporter.metrics.SelfMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wiring of the collection pipeline.
 *
 * Key decisions:
 * - The collector registry is built once here and handed to the aggregator and the
 *   synchronization service, there is no global registry
 * - An unknown collector name fails start-up
 * - Namespaced kinds can be restricted to one namespace; namespaces are always cluster wide
 */
@Slf4j
@Configuration
public class ExporterConfig {

    public static final List<String> DEFAULT_COLLECTORS =
            List.of(PodFamilies.RESOURCE, DeploymentFamilies.RESOURCE, NamespaceFamilies.RESOURCE);

    @Value("${kube-state-metrics.collectors:pods,deployments,namespaces}")
    private List<String> collectors;

    @Value("${kube-state-metrics.namespace:}")
    private String namespace;

    @Value("${kube-state-metrics.resync-period:5m}")
    private Duration resyncPeriod;

    @Value("${kube-state-metrics.request-timeout:30s}")
    private Duration requestTimeout;

    @Value("${kube-state-metrics.backoff.initial-interval:1s}")
    private Duration initialBackOff;

    @Value("${kube-state-metrics.backoff.max-interval:30s}")
    private Duration maxBackOff;

    @Value("${kube-state-metrics.scrape.timeout:10s}")
    private Duration scrapeTimeout;

    @Value("${kube-state-metrics.scrape.kind-timeout:5s}")
    private Duration kindTimeout;

    @Value("${kube-state-metrics.scrape.generation-threads:4}")
    private int generationThreads;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        Config config = KubernetesListWatcher.withoutWatchReconnect(Config.autoConfigure(null));
        KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build();
        log.info("Using Kubernetes API at {}", client.getMasterUrl());
        return client;
    }

    @Bean
    public SyncSettings syncSettings() {
        return SyncSettings.of(resyncPeriod, requestTimeout, initialBackOff, maxBackOff);
    }

    @Bean
    public CollectorRegistry collectorRegistry(KubernetesClient client) {
        CollectorRegistry.Builder builder = CollectorRegistry.builder();
        for (String name : enabledCollectors(collectors)) {
            builder.register(collectorFor(name, client));
        }
        return builder.build();
    }

    @Bean
    public MetricsAggregator metricsAggregator(CollectorRegistry registry, SelfMetrics selfMetrics) {
        return new MetricsAggregator(registry, selfMetrics, scrapeTimeout, kindTimeout, generationThreads);
    }

    static Set<String> enabledCollectors(List<String> configured) {
        Set<String> enabled = new LinkedHashSet<>();
        if (configured != null) {
            configured.stream().map(String::trim).filter(s -> !s.isEmpty()).forEach(enabled::add);
        }
        if (enabled.isEmpty()) {
            log.info("No collectors configured, using defaults {}", DEFAULT_COLLECTORS);
            enabled.addAll(DEFAULT_COLLECTORS);
        }
        return enabled;
    }

    private ResourceCollector<?> collectorFor(String name, KubernetesClient client) {
        return switch (name) {
            case PodFamilies.RESOURCE ->
                    ResourceCollector.of(PodFamilies.kind(), KubernetesListWatcher.pods(client, namespace));
            case DeploymentFamilies.RESOURCE ->
                    ResourceCollector.of(DeploymentFamilies.kind(), KubernetesListWatcher.deployments(client, namespace));
            case NamespaceFamilies.RESOURCE ->
                    ResourceCollector.of(NamespaceFamilies.kind(), KubernetesListWatcher.namespaces(client));
            default -> throw new IllegalArgumentException(
                    "Unknown collector '" + name + "', available collectors: " + DEFAULT_COLLECTORS);
        };
    }
}
