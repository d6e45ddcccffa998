package com.clusterscope.cloud.dto.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class AggregatedResources {
    VpcRecord vpc;
    @Builder.Default
    List<SubnetRecord> subnets = Collections.emptyList();
    @Builder.Default
    List<ComputeInstance> instances = Collections.emptyList();
    @Builder.Default
    List<WorkloadIdentityBinding> workloadIdentityBindings = Collections.emptyList();
    @Builder.Default
    Map<ResourceCategory, CategoryFailure> failures = Collections.emptyMap();
    @Builder.Default
    Set<ResourceCategory> skipped = Collections.emptySet();
}
