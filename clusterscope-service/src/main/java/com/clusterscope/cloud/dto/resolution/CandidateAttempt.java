package com.clusterscope.cloud.dto.resolution;

import lombok.Value;

@Value
public class CandidateAttempt {

    public enum Outcome {
        FOUND,
        NOT_FOUND,
        FAILED
    }

    String name;
    Outcome outcome;
    String message;
    boolean credentialRelated;

    public static CandidateAttempt found(String name) {
        return new CandidateAttempt(name, Outcome.FOUND, null, false);
    }

    public static CandidateAttempt notFound(String name) {
        return new CandidateAttempt(name, Outcome.NOT_FOUND, null, false);
    }

    public static CandidateAttempt failed(String name, String message, boolean credentialRelated) {
        return new CandidateAttempt(name, Outcome.FAILED, message, credentialRelated);
    }
}
