package com.clusterscope.cloud.dto.k8s;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * A member node of the orchestration cluster, as read from the kubeconfig context.
 */
@Value
@Builder
public class ClusterNode {
    String name;
    String providerId;
    @Builder.Default
    Map<String, String> labels = Collections.emptyMap();
    String creationTimestamp;
}
