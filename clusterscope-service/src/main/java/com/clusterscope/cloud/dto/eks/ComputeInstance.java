package com.clusterscope.cloud.dto.eks;

import com.clusterscope.cloud.dto.k8s.ClusterNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * An EC2 instance backing (or sitting next to) the cluster.
 * {@code mappedNode} is filled in after the node correlation step and is only a reference.
 */
@Value
@Builder(toBuilder = true)
public class ComputeInstance {
    String instanceId;
    String name;
    String instanceType;
    String state;
    String privateIpAddress;
    String vpcId;
    String availabilityZone;
    Instant launchTime;
    @Builder.Default
    Map<String, String> tags = Collections.emptyMap();
    ClusterNode mappedNode;

    public String getMappedNodeName() {
        return mappedNode != null ? mappedNode.getName() : "";
    }
}
