package io.kubestate.exporter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the cluster state metrics exporter.
 *
 * This application keeps an in-memory copy of cluster objects through list/watch and turns
 * it into metrics whenever /metrics is scraped.
 */
@Slf4j
@SpringBootApplication
public class KubeStateMetricsApplication {

    public static void main(String[] args) {
        log.info("Starting kube-state-metrics...");
        SpringApplication.run(KubeStateMetricsApplication.class, args);
        log.info("kube-state-metrics started successfully");
    }
}
