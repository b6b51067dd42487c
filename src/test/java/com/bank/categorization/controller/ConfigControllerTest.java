package com.bank.categorization.controller;

import com.bank.categorization.config.RoutingConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RoutingConfig routingConfig;

    private void defaults() {
        when(routingConfig.getAutoApplyThreshold()).thenReturn(80);
        when(routingConfig.getInferenceTimeoutMs()).thenReturn(30000L);
        when(routingConfig.getSplitToleranceCents()).thenReturn(1L);
        when(routingConfig.isPatternShortCircuitEnabled()).thenReturn(false);
        when(routingConfig.getPatternShortCircuitMinSupport()).thenReturn(5);
        when(routingConfig.getPatternShortCircuitBaseConfidence()).thenReturn(70);
    }

    @Test
    void getRouting_success() throws Exception {
        defaults();

        mockMvc.perform(get("/api/v1/config/routing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoApplyThreshold").value(80))
                .andExpect(jsonPath("$.inferenceTimeoutMs").value(30000))
                .andExpect(jsonPath("$.patternShortCircuitEnabled").value(false));
    }

    @Test
    void updateRouting_success() throws Exception {
        defaults();

        mockMvc.perform(put("/api/v1/config/routing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "autoApplyThreshold", 85,
                                "patternShortCircuitEnabled", true))))
                .andExpect(status().isOk());

        verify(routingConfig).setAutoApplyThreshold(85);
        verify(routingConfig).setPatternShortCircuitEnabled(true);
    }

    @Test
    void updateRouting_thresholdOutOfRange_returns400() throws Exception {
        defaults();

        mockMvc.perform(put("/api/v1/config/routing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("autoApplyThreshold", 101))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("autoApplyThreshold"));

        verify(routingConfig, never()).setAutoApplyThreshold(anyInt());
    }

    @Test
    void updateRouting_nonPositiveTimeout_returns400() throws Exception {
        defaults();

        mockMvc.perform(put("/api/v1/config/routing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("inferenceTimeoutMs", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("inferenceTimeoutMs"));
    }
}
