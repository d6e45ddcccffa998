package com.clusterscope.cloud.dto.resolution;

public enum ResolutionStatus {
    IDLE,
    DETECTING_REGION,
    CHECKING_AUTH,
    UNAUTHENTICATED,
    RESOLVING_IDENTITY,
    AGGREGATING,
    READY,
    ERROR
}
