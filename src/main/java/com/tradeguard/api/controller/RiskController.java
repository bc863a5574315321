package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.CircuitBreakerRequest;
import com.tradeguard.api.dto.request.KillSwitchActivateRequest;
import com.tradeguard.api.dto.request.KillSwitchClearRequest;
import com.tradeguard.domain.enums.KillSwitchReason;
import com.tradeguard.exception.BusinessException;
import com.tradeguard.risk.KillSwitchAuditEntry;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskManager;
import com.tradeguard.risk.RiskStatus;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state: status, limits, kill switch and circuit breakers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status -- drawdown, daily PnL, kill switch and breakers</li>
 *   <li>GET /api/risk/limits -- configured limits</li>
 *   <li>POST /api/risk/kill-switch -- manual activation (requires "CONFIRM")</li>
 *   <li>POST /api/risk/kill-switch/clear -- audited manual clear</li>
 *   <li>GET /api/risk/kill-switch/audit -- activation and clear history</li>
 *   <li>POST /api/risk/circuit-breaker -- engage a manual breaker</li>
 *   <li>POST /api/risk/circuit-breaker/release -- release a breaker</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskManager riskManager;

    public RiskController(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @GetMapping("/status")
    public ResponseEntity<RiskStatus> getStatus() {
        return ResponseEntity.ok(riskManager.getStatus());
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getLimits() {
        return ResponseEntity.ok(riskManager.getRiskLimits());
    }

    @PostMapping("/kill-switch")
    public ResponseEntity<Map<String, Object>> activateKillSwitch(@Valid @RequestBody KillSwitchActivateRequest request) {
        String detail = request.getReason() != null && !request.getReason().isBlank()
                ? request.getReason()
                : "Manual activation via API";
        log.error("KILL SWITCH ACTIVATION REQUESTED by {}: {}", request.getOperator(), detail);
        boolean activated = riskManager.activateKillSwitch(KillSwitchReason.MANUAL, request.getOperator() + ": " + detail);
        return ResponseEntity.ok(Map.of("activated", activated, "killSwitchActive", riskManager.isKillSwitchActive()));
    }

    /**
     * Clears the kill switch. This is the only way trading resumes after any activation.
     */
    @PostMapping("/kill-switch/clear")
    public ResponseEntity<Map<String, Object>> clearKillSwitch(@Valid @RequestBody KillSwitchClearRequest request) {
        boolean cleared = riskManager.clearKillSwitch(request.getOperator(), request.getNote());
        return ResponseEntity.ok(Map.of("cleared", cleared, "killSwitchActive", riskManager.isKillSwitchActive()));
    }

    @GetMapping("/kill-switch/audit")
    public ResponseEntity<List<KillSwitchAuditEntry>> getKillSwitchAudit() {
        return ResponseEntity.ok(riskManager.getKillSwitchAudit());
    }

    @PostMapping("/circuit-breaker")
    public ResponseEntity<RiskStatus> engageCircuitBreaker(@Valid @RequestBody CircuitBreakerRequest request) {
        if (request.getReason() == null || request.getReason().isBlank()) {
            throw new BusinessException("Engaging a circuit breaker requires a reason");
        }
        log.warn("Manual circuit breaker on {} by {}: {}", request.getScope(), request.getOperator(), request.getReason());
        riskManager.engageCircuitBreaker(request.getScope(), request.getReason(), false);
        return ResponseEntity.ok(riskManager.getStatus());
    }

    @PostMapping("/circuit-breaker/release")
    public ResponseEntity<Map<String, Object>> releaseCircuitBreaker(@Valid @RequestBody CircuitBreakerRequest request) {
        boolean released = request.getReason() == null || request.getReason().isBlank()
                ? riskManager.releaseCircuitBreaker(request.getScope(), request.getOperator())
                : riskManager.releaseCircuitBreaker(request.getScope(), request.getReason(), request.getOperator());
        return ResponseEntity.ok(Map.of("released", released));
    }
}
