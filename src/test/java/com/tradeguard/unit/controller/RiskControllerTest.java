package com.tradeguard.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradeguard.api.controller.RiskController;
import com.tradeguard.config.ApiResponseAdvice;
import com.tradeguard.domain.enums.KillSwitchReason;
import com.tradeguard.exception.GlobalExceptionHandler;
import com.tradeguard.risk.RiskManager;
import com.tradeguard.risk.RiskStatus;
import com.tradeguard.support.CoreHarness;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController.
 */
@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskController(riskManager))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/status returns the risk snapshot")
    void getStatus() throws Exception {
        when(riskManager.getStatus()).thenReturn(RiskStatus.builder()
                .killSwitchActive(true)
                .killSwitchReason(KillSwitchReason.MAX_DD_EXCEEDED)
                .drawdownPct(new BigDecimal("0.051"))
                .dailyPnl(new BigDecimal("-510"))
                .currentEquity(new BigDecimal("9490"))
                .peakEquity(new BigDecimal("10000"))
                .openExposure(BigDecimal.ZERO)
                .circuitBreakers(List.of())
                .build());

        mockMvc.perform(get("/api/risk/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.killSwitchActive").value(true))
                .andExpect(jsonPath("$.data.killSwitchReason").value("MAX_DD_EXCEEDED"))
                .andExpect(jsonPath("$.data.drawdownPct").value(0.051))
                .andExpect(jsonPath("$.data.dailyPnl").value(-510));
    }

    @Test
    @DisplayName("GET /api/risk/limits returns the configured limits")
    void getLimits() throws Exception {
        when(riskManager.getRiskLimits()).thenReturn(CoreHarness.defaultLimits());

        mockMvc.perform(get("/api/risk/limits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.maxPositionPct").value(0.10))
                .andExpect(jsonPath("$.data.maxLeverage").value(3))
                .andExpect(jsonPath("$.data.maxConsecutiveErrors").value(5));
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch activates with MANUAL reason when confirmed")
    void activateKillSwitch() throws Exception {
        when(riskManager.activateKillSwitch(KillSwitchReason.MANUAL, "alice: exchange incident")).thenReturn(true);
        when(riskManager.isKillSwitchActive()).thenReturn(true);

        mockMvc.perform(post("/api/risk/kill-switch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "confirm": "CONFIRM", "operator": "alice", "reason": "exchange incident" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.activated").value(true))
                .andExpect(jsonPath("$.data.killSwitchActive").value(true));
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch without CONFIRM is rejected before reaching the risk manager")
    void activateKillSwitch_requiresConfirm() throws Exception {
        mockMvc.perform(post("/api/risk/kill-switch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "confirm": "yes", "operator": "alice" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.confirm").value("must be CONFIRM"));

        verify(riskManager, never()).activateKillSwitch(any(), anyString());
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch/clear passes operator and note through")
    void clearKillSwitch() throws Exception {
        when(riskManager.clearKillSwitch("bob", "venue recovered")).thenReturn(true);

        mockMvc.perform(post("/api/risk/kill-switch/clear")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "operator": "bob", "note": "venue recovered" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.cleared").value(true))
                .andExpect(jsonPath("$.data.killSwitchActive").value(false));
    }

    @Test
    @DisplayName("POST /api/risk/kill-switch/clear without a note is a validation error")
    void clearKillSwitch_requiresNote() throws Exception {
        mockMvc.perform(post("/api/risk/kill-switch/clear")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "operator": "bob" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.note").exists());

        verify(riskManager, never()).clearKillSwitch(anyString(), anyString());
    }

    @Test
    @DisplayName("POST /api/risk/circuit-breaker engages a manual breaker on the scope")
    void engageBreaker() throws Exception {
        when(riskManager.getStatus()).thenReturn(RiskStatus.builder().circuitBreakers(List.of()).build());

        mockMvc.perform(post("/api/risk/circuit-breaker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "scope": "ETHUSDT", "operator": "alice", "reason": "listing volatility" }
                                """))
                .andExpect(status().isOk());

        verify(riskManager).engageCircuitBreaker("ETHUSDT", "listing volatility", false);
    }

    @Test
    @DisplayName("POST /api/risk/circuit-breaker without a reason is refused")
    void engageBreaker_requiresReason() throws Exception {
        mockMvc.perform(post("/api/risk/circuit-breaker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "scope": "ETHUSDT", "operator": "alice" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

        verify(riskManager, never()).engageCircuitBreaker(anyString(), anyString(), anyBoolean());
    }

    @Test
    @DisplayName("POST /api/risk/circuit-breaker/release reports whether anything was released")
    void releaseBreaker() throws Exception {
        when(riskManager.releaseCircuitBreaker("*", "alice")).thenReturn(false);

        mockMvc.perform(post("/api/risk/circuit-breaker/release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "scope": "*", "operator": "alice" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.released").value(false));
    }

    @Test
    @DisplayName("POST /api/risk/circuit-breaker/release with a reason lifts only that reason")
    void releaseBreaker_singleReason() throws Exception {
        when(riskManager.releaseCircuitBreaker("*", "venue_errors", "alice")).thenReturn(true);

        mockMvc.perform(post("/api/risk/circuit-breaker/release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "scope": "*", "operator": "alice", "reason": "venue_errors" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.released").value(true));

        verify(riskManager, never()).releaseCircuitBreaker("*", "alice");
    }
}
