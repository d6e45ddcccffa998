package com.clusterscope.cloud.exception;

import com.clusterscope.cloud.dto.resolution.CandidateAttempt;
import com.clusterscope.cloud.dto.resolution.ErrorKind;

import java.util.List;
import java.util.stream.Collectors;

public class ClusterIdentityNotFoundException extends CloudResolutionException {

    private final String region;
    private final List<CandidateAttempt> attempts;

    public ClusterIdentityNotFoundException(String region, List<CandidateAttempt> attempts) {
        super(String.format("Cannot find EKS cluster in %s. Tried: %s. "
                        + "Please ensure your AWS credentials have access to this region and account.",
                region, attempts.stream().map(CandidateAttempt::getName).collect(Collectors.joining(", "))));
        this.region = region;
        this.attempts = List.copyOf(attempts);
    }

    public String getRegion() {
        return region;
    }

    public List<CandidateAttempt> getAttempts() {
        return attempts;
    }

    @Override
    public List<String> getCandidates() {
        return attempts.stream().map(CandidateAttempt::getName).collect(Collectors.toList());
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CLUSTER_IDENTITY_NOT_FOUND;
    }

    @Override
    public boolean isCredentialRelated() {
        return attempts.stream().anyMatch(CandidateAttempt::isCredentialRelated);
    }
}
