package com.clusterscope.cloud.exception;

import com.clusterscope.cloud.dto.resolution.ErrorKind;

public class AuthRequiredException extends CloudResolutionException {

    private final String region;
    private final String reason;

    public AuthRequiredException(String region, String reason) {
        super("Not authenticated to AWS in region " + region + (reason != null ? ": " + reason : ""));
        this.region = region;
        this.reason = reason;
    }

    public String getRegion() {
        return region;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.AUTH_REQUIRED;
    }

    @Override
    public boolean isCredentialRelated() {
        return true;
    }
}
