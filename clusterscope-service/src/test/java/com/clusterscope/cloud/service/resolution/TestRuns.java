package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.k8s.ClusterNode;
import com.clusterscope.cloud.service.ClusterCloudGateway;

import java.time.Duration;
import java.util.Map;

final class TestRuns {

    private TestRuns() {
    }

    static ResolutionRun run(ClusterCloudGateway gateway, String context) {
        return run(gateway, context, false);
    }

    static ResolutionRun run(ClusterCloudGateway gateway, String context, boolean freshCredentials) {
        return new ResolutionRun(1, context, freshCredentials, gateway, Runnable::run, Duration.ofSeconds(5), () -> 1L);
    }

    static ClusterNode node(String name, String providerId) {
        return ClusterNode.builder().name(name).providerId(providerId).build();
    }

    static ClusterNode node(String name, String providerId, Map<String, String> labels) {
        return ClusterNode.builder().name(name).providerId(providerId).labels(labels).build();
    }
}
