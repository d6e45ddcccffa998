package com.clusterscope.cloud.dto.resolution;

public enum Remediation {
    NONE,
    /** Clear the credential cache and rerun, or restart the application. */
    RETRY_OR_RESTART
}
