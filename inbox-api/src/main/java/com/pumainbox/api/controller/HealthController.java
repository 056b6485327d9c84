package com.pumainbox.api.controller;

import com.pumainbox.api.dto.ErrorResponse;
import com.pumainbox.api.dto.HealthResponse;
import com.pumainbox.api.exception.DatabaseErrors;
import com.pumainbox.api.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        try {
            healthService.checkDatabase();
            return ResponseEntity.ok(HealthResponse.connected());
        } catch (Exception e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of(DatabaseErrors.message(e)));
        }
    }
}
