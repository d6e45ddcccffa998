package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.k8s.ClusterNode;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Links each instance to the node whose provider id contains the instance id.
 * Substring matching can in theory pair a short id with an unrelated provider id; real EC2 ids
 * ({@code i-} plus 8 or 17 hex digits) make that unlikely.
 */
@Component
public class NodeInstanceCorrelator {

    public List<ComputeInstance> correlate(List<ClusterNode> nodes, List<ComputeInstance> instances) {
        if (instances == null || instances.isEmpty()) {
            return Collections.emptyList();
        }
        List<ClusterNode> candidates = nodes != null ? nodes : Collections.emptyList();
        return instances.stream()
                .map(instance -> findNode(candidates, instance.getInstanceId())
                        .map(node -> instance.toBuilder().mappedNode(node).build())
                        .orElse(instance))
                .collect(Collectors.toList());
    }

    Optional<ClusterNode> findNode(List<ClusterNode> nodes, String instanceId) {
        if (instanceId == null || instanceId.isEmpty()) {
            return Optional.empty();
        }
        return nodes.stream()
                .filter(node -> {
                    String providerId = node.getProviderId();
                    return providerId != null
                            && (providerId.endsWith(instanceId) || providerId.contains(instanceId));
                })
                .findFirst();
    }
}
