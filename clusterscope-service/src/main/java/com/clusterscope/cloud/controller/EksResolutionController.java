package com.clusterscope.cloud.controller;

import com.clusterscope.cloud.dto.resolution.ResolutionState;
import com.clusterscope.cloud.service.resolution.CloudResolutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/clusterscope")
public class EksResolutionController {

    private final CloudResolutionService resolutionService;

    public EksResolutionController(CloudResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @GetMapping("/eks/resolution")
    public ResponseEntity<ResolutionState> getState() {
        return ResponseEntity.ok(resolutionService.getState());
    }

    /**
     * Starts a new resolution for the context; progress is pushed on the resolution topic.
     */
    @PostMapping("/eks/resolution/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@RequestParam("context") String context) {
        resolutionService.refresh(context);
        return accepted(context);
    }

    @PostMapping("/eks/resolution/retry")
    public ResponseEntity<Map<String, Object>> retry() {
        resolutionService.retryWithClearedCredentials();
        ResolutionState state = resolutionService.getState();
        return accepted(state.getClusterContext());
    }

    @PostMapping("/app/restart")
    public ResponseEntity<Map<String, String>> restart() {
        resolutionService.restartApplication();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("message", "Application restart initiated."));
    }

    private ResponseEntity<Map<String, Object>> accepted(String context) {
        ResolutionState state = resolutionService.getState();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "context", context != null ? context : "",
                "generation", state.getGeneration()));
    }
}
