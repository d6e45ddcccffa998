package com.clusterscope.cloud.dto.resolution;

import lombok.Value;

/**
 * A failed fetch for one resource section. Never promoted to the top-level error.
 */
@Value
public class CategoryFailure {
    ResourceCategory category;
    String message;
    boolean credentialRelated;
}
