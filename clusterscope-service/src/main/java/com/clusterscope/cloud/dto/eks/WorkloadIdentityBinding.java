package com.clusterscope.cloud.dto.eks;

import lombok.Builder;
import lombok.Value;

/**
 * EKS Pod Identity association between a service account and an IAM role.
 */
@Value
@Builder(toBuilder = true)
public class WorkloadIdentityBinding {
    String associationId;
    String associationArn;
    String clusterName;
    String namespace;
    String serviceAccount;
    String roleArn;
}
