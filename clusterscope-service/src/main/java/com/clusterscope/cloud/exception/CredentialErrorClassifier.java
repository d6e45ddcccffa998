package com.clusterscope.cloud.exception;

import java.util.List;

/**
 * Decides whether a provider failure is about expired or invalid credentials.
 * AWS only reports these as free text, so this is the one place that matches on message substrings.
 */
public final class CredentialErrorClassifier {

    static final List<String> CREDENTIAL_MARKERS = List.of(
            "ExpiredToken",
            "security token",
            "credentials",
            "401");

    private CredentialErrorClassifier() {
    }

    public static boolean isCredentialRelated(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        return CREDENTIAL_MARKERS.stream().anyMatch(message::contains);
    }

    public static boolean isCredentialRelated(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (isCredentialRelated(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
