package com.clusterscope.cloud.dto.resolution;

import com.clusterscope.cloud.dto.eks.ManagedClusterRecord;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * The managed-cluster record a context resolved to, with the names that were tried to get there.
 */
@Value
@Builder
public class ClusterIdentity {
    ManagedClusterRecord cluster;
    @Builder.Default
    List<String> candidates = Collections.emptyList();
    @Builder.Default
    List<CandidateAttempt> attempts = Collections.emptyList();
    String resolvedName;
    /** Name read from the owning-cluster tag of the first node's instance, if any. */
    String tagDerivedName;
    /** VPC known after resolution: from the instance first, else from the cluster record. */
    String vpcId;
}
