package com.clusterscope.cloud.dto.resolution;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
@Builder
public class ResolutionError {
    ErrorKind kind;
    String message;
    /** Candidate cluster names tried, in order; only set for CLUSTER_IDENTITY_NOT_FOUND. */
    @Builder.Default
    List<String> candidates = Collections.emptyList();
    boolean credentialRelated;
}
