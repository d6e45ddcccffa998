package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.ManagedClusterRecord;
import com.clusterscope.cloud.dto.k8s.ClusterNode;
import com.clusterscope.cloud.dto.resolution.CandidateAttempt;
import com.clusterscope.cloud.dto.resolution.ClusterIdentity;
import com.clusterscope.cloud.exception.CloudResolutionException;
import com.clusterscope.cloud.exception.ClusterIdentityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the EKS cluster behind a kubeconfig context by probing candidate names in order:
 * the owning-cluster tag of the first node's instance, the context name, the context name
 * with the managed-cluster suffix.
 */
@Component
public class ClusterIdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(ClusterIdentityResolver.class);

    static final String EKS_CLUSTER_NAME_TAG = "eks:cluster-name";
    static final String EKSCTL_CLUSTER_NAME_TAG = "alpha.eksctl.io/cluster-name";
    static final String CLUSTER_TAG_PREFIX = "kubernetes.io/cluster/";

    private final String clusterNameSuffix;

    public ClusterIdentityResolver(@Value("${clusterscope.resolution.cluster-name-suffix:-eks}") String clusterNameSuffix) {
        this.clusterNameSuffix = clusterNameSuffix;
    }

    public ClusterIdentity resolve(ResolutionRun run, String region, ClusterNode firstNode) {
        String context = run.getClusterContext();
        String vpcId = null;
        String tagName = null;

        Optional<String> instanceId = ProviderIds.instanceId(firstNode != null ? firstNode.getProviderId() : null);
        if (instanceId.isPresent()) {
            try {
                Optional<ComputeInstance> instance = run.call("get instance details",
                        () -> run.gateway().getInstanceDetails(region, instanceId.get()));
                if (instance.isPresent()) {
                    vpcId = instance.get().getVpcId();
                    tagName = owningClusterName(instance.get().getTags()).orElse(null);
                    if (tagName != null) {
                        logger.info("Derived EKS cluster name from instance tags: {}", tagName);
                    }
                }
            } catch (CloudResolutionException e) {
                logger.warn("Failed to get instance details for {}: {}", instanceId.get(), e.getMessage());
            }
            run.ensureCurrent();
        }

        List<String> candidates = candidates(tagName, context);
        List<CandidateAttempt> attempts = new ArrayList<>();
        for (String name : candidates) {
            logger.info("Trying EKS cluster name: {}", name);
            Optional<ManagedClusterRecord> record;
            try {
                record = run.call("get EKS cluster", () -> run.gateway().getManagedCluster(region, name));
            } catch (CloudResolutionException e) {
                logger.warn("Failed to get EKS cluster with name '{}': {}", name, e.getMessage());
                attempts.add(CandidateAttempt.failed(name, e.getMessage(), e.isCredentialRelated()));
                run.ensureCurrent();
                continue;
            }
            if (record.isPresent()) {
                attempts.add(CandidateAttempt.found(name));
                if (vpcId == null && record.get().getVpcId() != null) {
                    vpcId = record.get().getVpcId();
                }
                logger.info("Successfully found EKS cluster with name: {}", name);
                return ClusterIdentity.builder()
                        .cluster(record.get())
                        .candidates(candidates)
                        .attempts(attempts)
                        .resolvedName(name)
                        .tagDerivedName(tagName)
                        .vpcId(vpcId)
                        .build();
            }
            attempts.add(CandidateAttempt.notFound(name));
            run.ensureCurrent();
        }

        logger.warn("Could not find EKS cluster. Tried names: {}", String.join(", ", candidates));
        throw new ClusterIdentityNotFoundException(region, attempts);
    }

    /** Ordered, duplicate-free candidate names. */
    List<String> candidates(String tagName, String context) {
        Set<String> names = new LinkedHashSet<>();
        if (tagName != null && !tagName.isEmpty()) {
            names.add(tagName);
        }
        names.add(context);
        names.add(context + clusterNameSuffix);
        return List.copyOf(names);
    }

    static Optional<String> owningClusterName(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Optional.empty();
        }
        String value = tags.get(EKS_CLUSTER_NAME_TAG);
        if (value != null && !value.isEmpty()) {
            return Optional.of(value);
        }
        value = tags.get(EKSCTL_CLUSTER_NAME_TAG);
        if (value != null && !value.isEmpty()) {
            return Optional.of(value);
        }
        return tags.keySet().stream()
                .filter(key -> key.startsWith(CLUSTER_TAG_PREFIX) && key.length() > CLUSTER_TAG_PREFIX.length())
                .map(key -> key.substring(CLUSTER_TAG_PREFIX.length()))
                .findFirst();
    }
}
