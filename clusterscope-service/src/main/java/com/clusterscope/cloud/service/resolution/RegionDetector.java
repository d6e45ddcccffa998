package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.k8s.ClusterNode;
import com.clusterscope.cloud.exception.RegionUnknownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Works out the AWS region from the first node: provider id first, topology labels second.
 */
@Component
public class RegionDetector {

    private static final Logger logger = LoggerFactory.getLogger(RegionDetector.class);

    static final List<String> REGION_LABELS = List.of(
            "topology.kubernetes.io/region",
            "failure-domain.beta.kubernetes.io/region");

    public String detect(List<ClusterNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new RegionUnknownException("No nodes found in cluster. Cannot determine AWS region.");
        }
        ClusterNode node = nodes.get(0);

        Optional<String> fromProviderId = ProviderIds.region(node.getProviderId());
        if (fromProviderId.isPresent()) {
            logger.info("Detected region {} from provider id of node {}", fromProviderId.get(), node.getName());
            return fromProviderId.get();
        }

        Map<String, String> labels = node.getLabels();
        if (labels != null) {
            for (String key : REGION_LABELS) {
                String value = labels.get(key);
                if (value != null && !value.isEmpty()) {
                    logger.info("Detected region {} from label {} of node {}", value, key, node.getName());
                    return value;
                }
            }
        }
        throw new RegionUnknownException("Could not detect AWS Region from nodes.");
    }
}
