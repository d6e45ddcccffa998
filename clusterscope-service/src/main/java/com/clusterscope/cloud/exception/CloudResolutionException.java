package com.clusterscope.cloud.exception;

import com.clusterscope.cloud.dto.resolution.ErrorKind;
import com.clusterscope.cloud.dto.resolution.ResolutionError;

import java.util.Collections;
import java.util.List;

/**
 * Base of the failures that end a resolution run before the aggregation stage.
 */
public abstract class CloudResolutionException extends RuntimeException {

    protected CloudResolutionException(String message) {
        super(message);
    }

    protected CloudResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    public abstract boolean isCredentialRelated();

    public List<String> getCandidates() {
        return Collections.emptyList();
    }

    public ResolutionError toResolutionError() {
        return ResolutionError.builder()
                .kind(getKind())
                .message(getMessage())
                .candidates(getCandidates())
                .credentialRelated(isCredentialRelated())
                .build();
    }
}
