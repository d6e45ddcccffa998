package com.clusterscope.cloud.dto.resolution;

/**
 * {@code CHECKING} covers both "probe not run yet" and "probe in flight".
 */
public enum AuthStatus {
    CHECKING,
    AUTHENTICATED,
    UNAUTHENTICATED
}
