package com.clusterscope.cloud.dto.resolution;

public enum ResourceCategory {
    VPC("getVpcDetails", true),
    SUBNETS("listSubnets", true),
    COMPUTE_INSTANCES("listComputeInstances", true),
    WORKLOAD_IDENTITY_BINDINGS("listWorkloadIdentityBindings", false);

    private final String operation;
    private final boolean requiresVpc;

    ResourceCategory(String operation, boolean requiresVpc) {
        this.operation = operation;
        this.requiresVpc = requiresVpc;
    }

    public String getOperation() {
        return operation;
    }

    public boolean isRequiresVpc() {
        return requiresVpc;
    }
}
