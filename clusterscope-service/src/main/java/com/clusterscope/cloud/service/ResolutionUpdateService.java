package com.clusterscope.cloud.service;

import com.clusterscope.cloud.dto.resolution.ResolutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes resolution snapshots to dashboard clients over STOMP.
 */
@Service
public class ResolutionUpdateService {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionUpdateService.class);

    public static final String RESOLUTION_TOPIC = "/topic/eks/resolution";

    private final SimpMessagingTemplate messagingTemplate;

    public ResolutionUpdateService(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void sendUpdate(ResolutionState state) {
        if (state == null) {
            logger.warn("Resolution state is null. Skipping WebSocket update.");
            return;
        }
        try {
            logger.debug("Sending resolution update (generation {}, status {})", state.getGeneration(), state.getStatus());
            messagingTemplate.convertAndSend(RESOLUTION_TOPIC, state);
        } catch (RuntimeException e) {
            // a dropped push is recovered by the next snapshot or a GET
            logger.error("Failed to send resolution update to {}", RESOLUTION_TOPIC, e);
        }
    }
}
