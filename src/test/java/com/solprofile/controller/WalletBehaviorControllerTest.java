package com.solprofile.controller;

import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.exception.BehaviorAnalysisException;
import com.solprofile.service.BehaviorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WalletBehaviorController.class)
@DisplayName("WalletBehaviorController Tests")
class WalletBehaviorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BehaviorService behaviorService;

    @Test
    @DisplayName("Analysis returns the metrics")
    void analyze() throws Exception {
        BehavioralMetrics metrics = BehavioralMetrics.builder().totalTradeCount(7).tradingStyle("FLIPPER (BALANCED)").build();
        when(behaviorService.analyzeWalletBehavior("w1", 10L, 20L)).thenReturn(metrics);

        mockMvc.perform(get("/api/wallets/w1/behavior").param("startTs", "10").param("endTs", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTradeCount").value(7))
                .andExpect(jsonPath("$.tradingStyle").value("FLIPPER (BALANCED)"));
    }

    @Test
    @DisplayName("Inverted range is a bad request")
    void invertedRange() throws Exception {
        mockMvc.perform(get("/api/wallets/w1/behavior").param("startTs", "20").param("endTs", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad request"));

        verify(behaviorService, never()).analyzeWalletBehavior(any(), any(), any());
    }

    @Test
    @DisplayName("Analysis failures carry wallet and stage")
    void analysisFailure() throws Exception {
        when(behaviorService.analyzeWalletBehavior("w1", null, null))
                .thenThrow(new BehaviorAnalysisException("w1", "load_swaps", "connection refused",
                        new IllegalStateException("connection refused")));

        mockMvc.perform(get("/api/wallets/w1/behavior"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.wallet").value("w1"))
                .andExpect(jsonPath("$.stage").value("load_swaps"));
    }

    @Test
    @DisplayName("Missing profile is 404")
    void missingProfile() throws Exception {
        when(behaviorService.getProfile("w1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/wallets/w1/behavior/profile"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Exit prediction is returned, or 404 when none can be made")
    void exitPrediction() throws Exception {
        WalletTokenPrediction prediction = new WalletTokenPrediction("w1", "M", 0L, 1800L, 0.5, 2.0, 1.5,
                7200L, RiskLevel.MEDIUM, 0.8, 0.5);
        when(behaviorService.predictTokenExit("w1", "M", 1800L)).thenReturn(prediction);
        when(behaviorService.predictTokenExit("w1", "X", null)).thenReturn(null);

        mockMvc.perform(get("/api/wallets/w1/tokens/M/exit-prediction").param("asOf", "1800"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskLevel").value("MEDIUM"))
                .andExpect(jsonPath("$.estimatedExitTimestamp").value(7200));
        mockMvc.perform(get("/api/wallets/w1/tokens/X/exit-prediction"))
                .andExpect(status().isNotFound());
    }
}
