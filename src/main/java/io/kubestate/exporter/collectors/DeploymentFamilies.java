package io.kubestate.exporter.collectors;

import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.kubestate.exporter.engine.ResourceKind;
import io.kubestate.exporter.metrics.DefaultLabels;
import io.kubestate.exporter.metrics.FamilyGenerator;
import io.kubestate.exporter.metrics.Metric;
import io.kubestate.exporter.metrics.StatusEncoding;

import java.util.List;
import java.util.function.Function;

/**
 * Metric families of deployments.
 * <p>
 * Status counters left out of the API response are zero; a deployment without any status
 * block yet produces no status samples.
 */
public final class DeploymentFamilies {

    public static final String RESOURCE = "deployments";

    static final List<FamilyGenerator<Deployment>> FAMILIES = List.of(
            FamilyGenerator.gauge("kube_deployment_created", "Unix creation timestamp",
                    d -> StatusEncoding.creationTimestampSeconds(d).map(t -> List.of(Metric.of(t))).orElse(List.of())),
            FamilyGenerator.gauge("kube_deployment_status_replicas", "The number of replicas per deployment.",
                    status(DeploymentStatus::getReplicas)),
            FamilyGenerator.gauge("kube_deployment_status_replicas_available",
                    "The number of available replicas per deployment.",
                    status(DeploymentStatus::getAvailableReplicas)),
            FamilyGenerator.gauge("kube_deployment_status_replicas_unavailable",
                    "The number of unavailable replicas per deployment.",
                    status(DeploymentStatus::getUnavailableReplicas)),
            FamilyGenerator.gauge("kube_deployment_status_replicas_updated",
                    "The number of updated replicas per deployment.",
                    status(DeploymentStatus::getUpdatedReplicas)),
            FamilyGenerator.gauge("kube_deployment_status_observed_generation",
                    "The generation observed by the deployment controller.",
                    status(DeploymentStatus::getObservedGeneration)),
            FamilyGenerator.gauge("kube_deployment_spec_replicas", "Number of desired pods for a deployment.",
                    d -> d.getSpec() == null || d.getSpec().getReplicas() == null
                            ? List.of()
                            : List.of(Metric.of(d.getSpec().getReplicas()))),
            FamilyGenerator.gauge("kube_deployment_spec_paused",
                    "Whether the deployment is paused and will not be processed by the deployment controller.",
                    d -> d.getSpec() == null
                            ? List.of()
                            : List.of(Metric.of(StatusEncoding.boolValue(Boolean.TRUE.equals(d.getSpec().getPaused()))))),
            FamilyGenerator.gauge("kube_deployment_metadata_generation",
                    "Sequence number representing a specific generation of the desired state.",
                    d -> d.getMetadata().getGeneration() == null
                            ? List.of()
                            : List.of(Metric.of(d.getMetadata().getGeneration()))),
            FamilyGenerator.gauge("kube_deployment_labels", "Kubernetes labels converted to Prometheus labels.",
                    d -> List.of(StatusEncoding.kubeLabelsToPrometheusLabels(d.getMetadata().getLabels()).toMetric(1)))
    );

    private DeploymentFamilies() {
    }

    public static ResourceKind<Deployment> kind() {
        return new ResourceKind<>(RESOURCE, Deployment.class, DefaultLabels.namespaced("deployment"), FAMILIES);
    }

    private static Function<Deployment, List<Metric>> status(Function<DeploymentStatus, ? extends Number> field) {
        return d -> {
            DeploymentStatus status = d.getStatus();
            if (status == null) {
                return List.of();
            }
            Number value = field.apply(status);
            return List.of(Metric.of(value != null ? value.doubleValue() : 0));
        };
    }
}
