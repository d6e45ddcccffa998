package com.clusterscope.cloud.exception;

import com.clusterscope.cloud.dto.resolution.ErrorKind;

import java.time.Duration;

/**
 * Any gateway failure that is not one of the typed resolution outcomes.
 */
public class ProviderException extends CloudResolutionException {

    private final boolean credentialRelated;

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.credentialRelated = CredentialErrorClassifier.isCredentialRelated(message)
                || CredentialErrorClassifier.isCredentialRelated(cause);
    }

    public ProviderException(String message) {
        this(message, null);
    }

    public static ProviderException from(String operation, Throwable cause) {
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        return new ProviderException("Failed to " + operation + ": " + cause.getMessage(), cause);
    }

    public static ProviderException timeout(String operation, Duration timeout) {
        return new ProviderException(operation + " timed out after " + timeout.toMillis() + " ms");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PROVIDER_ERROR;
    }

    @Override
    public boolean isCredentialRelated() {
        return credentialRelated;
    }
}
