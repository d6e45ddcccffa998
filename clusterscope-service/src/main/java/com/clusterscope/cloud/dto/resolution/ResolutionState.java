package com.clusterscope.cloud.dto.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import com.clusterscope.cloud.dto.k8s.ClusterNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of one resolution run. A run publishes a new snapshot per stage;
 * consumers only ever see whole snapshots.
 */
@Value
@Builder(toBuilder = true)
public class ResolutionState {
    long generation;
    ResolutionStatus status;
    String clusterContext;
    @Builder.Default
    AuthStatus authStatus = AuthStatus.CHECKING;
    String callerIdentity;
    String region;
    ClusterIdentity identity;
    String vpcId;
    VpcRecord vpc;
    @Builder.Default
    List<ClusterNode> nodes = Collections.emptyList();
    @Builder.Default
    List<SubnetRecord> subnets = Collections.emptyList();
    @Builder.Default
    List<ComputeInstance> instances = Collections.emptyList();
    @Builder.Default
    List<WorkloadIdentityBinding> workloadIdentityBindings = Collections.emptyList();
    @Builder.Default
    Map<ResourceCategory, CategoryFailure> categoryFailures = Collections.emptyMap();
    @Builder.Default
    Set<ResourceCategory> skippedCategories = Collections.emptySet();
    ResolutionError error;
    Instant startedAt;
    Instant updatedAt;

    public static ResolutionState initial() {
        return ResolutionState.builder()
                .generation(0)
                .status(ResolutionStatus.IDLE)
                .updatedAt(Instant.now())
                .build();
    }

    public static ResolutionState idle(long generation, String clusterContext) {
        Instant now = Instant.now();
        return ResolutionState.builder()
                .generation(generation)
                .status(ResolutionStatus.IDLE)
                .clusterContext(clusterContext)
                .startedAt(now)
                .updatedAt(now)
                .build();
    }

    public Remediation getRemediation() {
        if (status == ResolutionStatus.UNAUTHENTICATED) {
            return Remediation.RETRY_OR_RESTART;
        }
        if (status == ResolutionStatus.ERROR && error != null && error.isCredentialRelated()) {
            return Remediation.RETRY_OR_RESTART;
        }
        return Remediation.NONE;
    }
}
