package com.bank.categorization.controller;

import com.bank.categorization.config.RoutingConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime routing configuration")
public class ConfigController {

    private final RoutingConfig routingConfig;

    public ConfigController(RoutingConfig routingConfig) {
        this.routingConfig = routingConfig;
    }

    @Operation(summary = "Get routing configuration")
    @GetMapping("/routing")
    public ResponseEntity<Map<String, Object>> getRouting() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("autoApplyThreshold", routingConfig.getAutoApplyThreshold());
        body.put("inferenceTimeoutMs", routingConfig.getInferenceTimeoutMs());
        body.put("splitToleranceCents", routingConfig.getSplitToleranceCents());
        body.put("patternShortCircuitEnabled", routingConfig.isPatternShortCircuitEnabled());
        body.put("patternShortCircuitMinSupport", routingConfig.getPatternShortCircuitMinSupport());
        body.put("patternShortCircuitBaseConfidence", routingConfig.getPatternShortCircuitBaseConfidence());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update routing configuration",
            description = "Changes apply immediately but reset on restart. Tenant thresholds override the global one.")
    @PutMapping("/routing")
    public ResponseEntity<?> updateRouting(@RequestBody Map<String, Object> body) {
        int threshold = toInt(body, "autoApplyThreshold", routingConfig.getAutoApplyThreshold());
        long timeout = toLong(body, "inferenceTimeoutMs", routingConfig.getInferenceTimeoutMs());
        long tolerance = toLong(body, "splitToleranceCents", routingConfig.getSplitToleranceCents());
        boolean shortCircuit = toBoolean(body, "patternShortCircuitEnabled", routingConfig.isPatternShortCircuitEnabled());
        int minSupport = toInt(body, "patternShortCircuitMinSupport", routingConfig.getPatternShortCircuitMinSupport());
        int baseConfidence = toInt(body, "patternShortCircuitBaseConfidence",
                routingConfig.getPatternShortCircuitBaseConfidence());

        if (threshold < 0 || threshold > 100) return badRequest("autoApplyThreshold must be in [0, 100]", "autoApplyThreshold");
        if (timeout <= 0) return badRequest("inferenceTimeoutMs must be > 0", "inferenceTimeoutMs");
        if (tolerance < 0) return badRequest("splitToleranceCents must be >= 0", "splitToleranceCents");
        if (minSupport < 1) return badRequest("patternShortCircuitMinSupport must be >= 1", "patternShortCircuitMinSupport");
        if (baseConfidence < 0 || baseConfidence > 100) {
            return badRequest("patternShortCircuitBaseConfidence must be in [0, 100]", "patternShortCircuitBaseConfidence");
        }

        routingConfig.setAutoApplyThreshold(threshold);
        routingConfig.setInferenceTimeoutMs(timeout);
        routingConfig.setSplitToleranceCents(tolerance);
        routingConfig.setPatternShortCircuitEnabled(shortCircuit);
        routingConfig.setPatternShortCircuitMinSupport(minSupport);
        routingConfig.setPatternShortCircuitBaseConfidence(baseConfidence);

        return getRouting();
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
