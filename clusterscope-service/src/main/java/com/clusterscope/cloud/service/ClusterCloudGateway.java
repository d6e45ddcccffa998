package com.clusterscope.cloud.service;

import com.clusterscope.cloud.dto.eks.AuthCheckResult;
import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.ManagedClusterRecord;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import com.clusterscope.cloud.dto.k8s.ClusterNode;

import java.util.List;
import java.util.Optional;

/**
 * Everything the resolution pipeline needs from the cluster API and the cloud provider.
 * Failures other than "not found" surface as {@link com.clusterscope.cloud.exception.ProviderException}.
 */
public interface ClusterCloudGateway {

    List<ClusterNode> listNodes(String clusterContext);

    /** Drops cached clients and credentials so the next call resolves credentials again. */
    void clearCredentialCache();

    AuthCheckResult checkAuth(String region);

    Optional<ComputeInstance> getInstanceDetails(String region, String instanceId);

    /** Empty when no managed cluster with that name exists in the region. */
    Optional<ManagedClusterRecord> getManagedCluster(String region, String name);

    Optional<VpcRecord> getVpcDetails(String region, String vpcId);

    List<SubnetRecord> listSubnets(String region, String vpcId);

    List<ComputeInstance> listComputeInstances(String region, String vpcId, String clusterName);

    List<WorkloadIdentityBinding> listWorkloadIdentityBindings(String region, String clusterName);

    void restartApplicationProcess();
}
