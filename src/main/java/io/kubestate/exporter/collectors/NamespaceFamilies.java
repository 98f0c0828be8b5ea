package io.kubestate.exporter.collectors;

import io.fabric8.kubernetes.api.model.Namespace;
import io.kubestate.exporter.engine.ResourceKind;
import io.kubestate.exporter.metrics.DefaultLabels;
import io.kubestate.exporter.metrics.FamilyGenerator;
import io.kubestate.exporter.metrics.Metric;
import io.kubestate.exporter.metrics.StatusEncoding;
import io.kubestate.exporter.metrics.StatusEncoding.StateEntry;

import java.util.List;

/**
 * Metric families of namespaces. Namespaces are cluster scoped, so the only identity label is
 * the namespace name.
 */
public final class NamespaceFamilies {

    public static final String RESOURCE = "namespaces";

    static final List<StateEntry<Namespace>> PHASES = List.of(
            new StateEntry<>("Active", n -> "Active".equals(phase(n))),
            new StateEntry<>("Terminating", n -> "Terminating".equals(phase(n)))
    );

    static final List<FamilyGenerator<Namespace>> FAMILIES = List.of(
            FamilyGenerator.gauge("kube_namespace_labels", "Kubernetes labels converted to Prometheus labels.",
                    n -> List.of(StatusEncoding.kubeLabelsToPrometheusLabels(n.getMetadata().getLabels()).toMetric(1))),
            FamilyGenerator.gauge("kube_namespace_annotations", "Kubernetes annotations converted to Prometheus labels.",
                    n -> List.of(StatusEncoding.kubeAnnotationsToPrometheusLabels(n.getMetadata().getAnnotations()).toMetric(1))),
            FamilyGenerator.gauge("kube_namespace_created", "Unix creation timestamp",
                    n -> StatusEncoding.creationTimestampSeconds(n).map(t -> List.of(Metric.of(t))).orElse(List.of())),
            FamilyGenerator.gauge("kube_namespace_status_phase", "kubernetes namespace status phase.", n -> {
                if (phase(n) == null) {
                    return List.of();
                }
                return StatusEncoding.enumerationMetrics("phase", PHASES, n);
            })
    );

    private NamespaceFamilies() {
    }

    public static ResourceKind<Namespace> kind() {
        return new ResourceKind<>(RESOURCE, Namespace.class, DefaultLabels.clusterScoped("namespace"), FAMILIES);
    }

    private static String phase(Namespace n) {
        return n.getStatus() != null ? n.getStatus().getPhase() : null;
    }
}
