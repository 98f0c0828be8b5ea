package io.kubestate.exporter.collectors;

import io.fabric8.kubernetes.api.model.ContainerState;
import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStateWaiting;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.kubestate.exporter.engine.ResourceKind;
import io.kubestate.exporter.metrics.DefaultLabels;
import io.kubestate.exporter.metrics.FamilyGenerator;
import io.kubestate.exporter.metrics.Metric;
import io.kubestate.exporter.metrics.StatusEncoding;
import io.kubestate.exporter.metrics.StatusEncoding.StateEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static io.kubestate.exporter.metrics.StatusEncoding.NONE;
import static io.kubestate.exporter.metrics.StatusEncoding.nullToEmpty;

/**
 * Metric families of pods.
 */
public final class PodFamilies {

    public static final String RESOURCE = "pods";

    /** Reason set by the node lifecycle controller on pods of an unreachable node. */
    public static final String NODE_UNREACHABLE_POD_REASON = "NodeLost";

    public static final List<String> CONTAINER_WAITING_REASONS = List.of(
            "ContainerCreating", "CrashLoopBackOff", "CreateContainerConfigError", "ErrImagePull", "ImagePullBackOff");

    public static final List<String> CONTAINER_TERMINATED_REASONS = List.of(
            "OOMKilled", "Completed", "Error", "ContainerCannotRun");

    private static final List<String> OWNER_LABELS = List.of("owner_kind", "owner_name", "owner_is_controller");

    /*
     * Running and Unknown mirror the kubectl printer: a pod being deleted on an unreachable
     * node is shown as Unknown whatever its reported phase.
     */
    static final List<StateEntry<Pod>> PHASES = List.of(
            new StateEntry<>("Pending", p -> "Pending".equals(phase(p))),
            new StateEntry<>("Succeeded", p -> "Succeeded".equals(phase(p))),
            new StateEntry<>("Failed", p -> "Failed".equals(phase(p))),
            new StateEntry<>("Running", p -> "Running".equals(phase(p)) && !lostOnUnreachableNode(p)),
            new StateEntry<>("Unknown", p -> "Unknown".equals(phase(p)) || lostOnUnreachableNode(p))
    );

    static final List<FamilyGenerator<Pod>> FAMILIES = List.of(
            FamilyGenerator.gauge("kube_pod_info", "Information about pod.", PodFamilies::info),
            FamilyGenerator.gauge("kube_pod_labels", "Kubernetes labels converted to Prometheus labels.",
                    p -> List.of(StatusEncoding.kubeLabelsToPrometheusLabels(p.getMetadata().getLabels()).toMetric(1))),
            FamilyGenerator.gauge("kube_pod_created", "Unix creation timestamp",
                    p -> StatusEncoding.creationTimestampSeconds(p).map(t -> List.of(Metric.of(t))).orElse(List.of())),
            FamilyGenerator.gauge("kube_pod_owner", "Information about the Pod's owner.", PodFamilies::owners),
            FamilyGenerator.gauge("kube_pod_status_phase", "The pods current phase.", p -> {
                if (phase(p).isEmpty()) {
                    return List.of();
                }
                return StatusEncoding.enumerationMetrics("phase", PHASES, p);
            }),
            FamilyGenerator.gauge("kube_pod_status_ready", "Describes whether the pod is ready to serve requests.",
                    p -> conditions(p, "Ready")),
            FamilyGenerator.gauge("kube_pod_status_scheduled", "Describes the status of the scheduling process for the pod.",
                    p -> conditions(p, "PodScheduled")),
            FamilyGenerator.gauge("kube_pod_container_status_waiting_reason",
                    "Describes the reason the container is currently in waiting state.",
                    p -> containerReasons(p, CONTAINER_WAITING_REASONS, PodFamilies::waitingReason)),
            FamilyGenerator.gauge("kube_pod_container_status_terminated_reason",
                    "Describes the reason the container is currently in terminated state.",
                    p -> containerReasons(p, CONTAINER_TERMINATED_REASONS, cs -> terminatedReason(cs.getState()))),
            FamilyGenerator.gauge("kube_pod_container_status_last_terminated_reason",
                    "Describes the last reason the container was in terminated state.",
                    p -> containerReasons(p, CONTAINER_TERMINATED_REASONS, cs -> terminatedReason(cs.getLastState())))
    );

    private PodFamilies() {
    }

    public static ResourceKind<Pod> kind() {
        return new ResourceKind<>(RESOURCE, Pod.class, DefaultLabels.namespaced("pod"), FAMILIES);
    }

    private static List<Metric> info(Pod p) {
        PodStatus status = p.getStatus();
        PodSpec spec = p.getSpec();
        String createdByKind = NONE;
        String createdByName = NONE;
        OwnerReference controller = controllerOf(p);
        if (controller != null) {
            if (controller.getKind() != null && !controller.getKind().isEmpty()) {
                createdByKind = controller.getKind();
            }
            if (controller.getName() != null && !controller.getName().isEmpty()) {
                createdByName = controller.getName();
            }
        }
        return List.of(Metric.of(
                List.of("host_ip", "pod_ip", "uid", "node", "created_by_kind", "created_by_name"),
                List.of(
                        status != null ? nullToEmpty(status.getHostIP()) : "",
                        status != null ? nullToEmpty(status.getPodIP()) : "",
                        nullToEmpty(p.getMetadata().getUid()),
                        spec != null ? nullToEmpty(spec.getNodeName()) : "",
                        createdByKind,
                        createdByName
                ),
                1));
    }

    private static List<Metric> owners(Pod p) {
        List<OwnerReference> owners = p.getMetadata().getOwnerReferences();
        if (owners == null || owners.isEmpty()) {
            return List.of(Metric.of(OWNER_LABELS, List.of(NONE, NONE, NONE), 1));
        }
        List<Metric> metrics = new ArrayList<>(owners.size());
        for (OwnerReference owner : owners) {
            String isController = owner.getController() != null ? String.valueOf(owner.getController()) : "false";
            metrics.add(Metric.of(OWNER_LABELS,
                    List.of(nullToEmpty(owner.getKind()), nullToEmpty(owner.getName()), isController), 1));
        }
        return metrics;
    }

    private static List<Metric> conditions(Pod p, String conditionType) {
        if (p.getStatus() == null || p.getStatus().getConditions() == null) {
            return List.of();
        }
        List<Metric> metrics = new ArrayList<>();
        for (PodCondition condition : p.getStatus().getConditions()) {
            if (conditionType.equals(condition.getType())) {
                metrics.addAll(StatusEncoding.conditionMetrics("condition", condition.getStatus()));
            }
        }
        return metrics;
    }

    private static List<Metric> containerReasons(Pod p, List<String> reasons,
                                                 Function<ContainerStatus, String> actualReason) {
        if (p.getStatus() == null || p.getStatus().getContainerStatuses() == null) {
            return List.of();
        }
        List<Metric> metrics = new ArrayList<>();
        for (ContainerStatus cs : p.getStatus().getContainerStatuses()) {
            metrics.addAll(StatusEncoding.reasonMetrics(
                    List.of("container"), List.of(nullToEmpty(cs.getName())), reasons, actualReason.apply(cs)));
        }
        return metrics;
    }

    static OwnerReference controllerOf(Pod p) {
        List<OwnerReference> owners = p.getMetadata().getOwnerReferences();
        if (owners == null) {
            return null;
        }
        return owners.stream()
                .filter(o -> Boolean.TRUE.equals(o.getController()))
                .findFirst()
                .orElse(null);
    }

    private static String phase(Pod p) {
        return p.getStatus() != null ? nullToEmpty(p.getStatus().getPhase()) : "";
    }

    private static boolean lostOnUnreachableNode(Pod p) {
        return p.getMetadata().getDeletionTimestamp() != null
                && p.getStatus() != null
                && NODE_UNREACHABLE_POD_REASON.equals(p.getStatus().getReason());
    }

    private static String waitingReason(ContainerStatus cs) {
        ContainerState state = cs.getState();
        ContainerStateWaiting waiting = state != null ? state.getWaiting() : null;
        return waiting != null ? waiting.getReason() : null;
    }

    private static String terminatedReason(ContainerState state) {
        ContainerStateTerminated terminated = state != null ? state.getTerminated() : null;
        return terminated != null ? terminated.getReason() : null;
    }
}
