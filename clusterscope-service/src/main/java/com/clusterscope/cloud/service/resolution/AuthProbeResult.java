package com.clusterscope.cloud.service.resolution;

import lombok.Value;

@Value
public class AuthProbeResult {

    public enum Outcome {
        AUTHENTICATED,
        UNAUTHENTICATED,
        /** The probe itself could not be carried out. */
        PROBE_ERROR
    }

    Outcome outcome;
    String reason;
    String identity;
    String account;
    boolean credentialRelated;

    static AuthProbeResult authenticated(String identity, String account) {
        return new AuthProbeResult(Outcome.AUTHENTICATED, null, identity, account, false);
    }

    static AuthProbeResult unauthenticated(String reason) {
        return new AuthProbeResult(Outcome.UNAUTHENTICATED, reason, null, null, true);
    }

    static AuthProbeResult probeError(String reason, boolean credentialRelated) {
        return new AuthProbeResult(Outcome.PROBE_ERROR, reason, null, null, credentialRelated);
    }
}
