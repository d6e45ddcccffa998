package com.clusterscope.cloud.exception;

import com.clusterscope.cloud.dto.resolution.ErrorKind;

public class RegionUnknownException extends CloudResolutionException {

    public RegionUnknownException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.REGION_UNKNOWN;
    }

    @Override
    public boolean isCredentialRelated() {
        return false;
    }
}
