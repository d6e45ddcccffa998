package com.clusterscope.cloud.dto.resolution;

public enum ErrorKind {
    REGION_UNKNOWN,
    AUTH_REQUIRED,
    CLUSTER_IDENTITY_NOT_FOUND,
    PROVIDER_ERROR
}
