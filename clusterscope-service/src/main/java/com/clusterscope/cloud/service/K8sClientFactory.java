package com.clusterscope.cloud.service;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class K8sClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(K8sClientFactory.class);

    /**
     * Create a Kubernetes client for a context of the local kubeconfig.
     */
    public KubernetesClient createForContext(String contextName) {
        logger.info("Creating Kubernetes client for context {}", contextName);
        Config config = Config.autoConfigure(contextName);
        return new KubernetesClientBuilder()
                .withConfig(config)
                .build();
    }
}
