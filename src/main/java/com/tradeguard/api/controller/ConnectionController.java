package com.tradeguard.api.controller;

import com.tradeguard.connection.ConnectionHealth;
import com.tradeguard.connection.ConnectionMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/connection/health -- current venue stream telemetry.
 */
@RestController
@RequestMapping("/api/connection")
public class ConnectionController {

    private final ConnectionMonitor connectionMonitor;

    public ConnectionController(ConnectionMonitor connectionMonitor) {
        this.connectionMonitor = connectionMonitor;
    }

    @GetMapping("/health")
    public ResponseEntity<ConnectionHealth> getHealth() {
        return ResponseEntity.ok(connectionMonitor.snapshot());
    }
}
