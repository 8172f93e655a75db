package com.purchasingpower.genki.api;

import com.purchasingpower.genki.configuration.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * GET /health - liveness plus whether a username is configured.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "Am I Genki? Badge Service";

    private final AppProperties props;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("ok")
                .service(SERVICE_NAME)
                .configured(props.getMonitoring().isConfigured())
                .timestamp(clock.instant())
                .build());
    }
}
