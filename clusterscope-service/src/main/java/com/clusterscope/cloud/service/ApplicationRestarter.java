package com.clusterscope.cloud.service;

import com.clusterscope.cloud.ClusterScopeApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the application context, which is the only way to drop credentials the SDK
 * caches outside the client cache.
 */
@Component
public class ApplicationRestarter {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationRestarter.class);

    public void restart() {
        logger.info("Restarting application");
        ClusterScopeApplication.restart();
    }
}
