package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.AuthCheckResult;
import com.clusterscope.cloud.exception.CloudResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AuthProbe {

    private static final Logger logger = LoggerFactory.getLogger(AuthProbe.class);

    public AuthProbeResult probe(ResolutionRun run, String region) {
        if (run.isFreshCredentials()) {
            logger.info("Clearing credential cache before auth probe (run {})", run.getGeneration());
            run.gateway().clearCredentialCache();
        }
        AuthCheckResult result;
        try {
            result = run.call("check AWS auth", () -> run.gateway().checkAuth(region));
        } catch (CloudResolutionException e) {
            logger.error("Auth probe in region {} could not run: {}", region, e.getMessage());
            return AuthProbeResult.probeError(e.getMessage(), e.isCredentialRelated());
        }
        if (result == null) {
            return AuthProbeResult.probeError("Auth check returned no result", false);
        }
        if (!result.isAuthenticated()) {
            logger.warn("AWS auth check failed in region {}: {}", region, result.getReason());
            return AuthProbeResult.unauthenticated(result.getReason());
        }
        return AuthProbeResult.authenticated(result.getIdentity(), result.getAccount());
    }
}
