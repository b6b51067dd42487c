package com.bank.categorization.controller;

import com.bank.categorization.model.Correction;
import com.bank.categorization.model.CorrectionRequest;
import com.bank.categorization.model.CorrectionResult;
import com.bank.categorization.service.CorrectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
@Tag(name = "Corrections", description = "Record human overrides of decisions")
public class CorrectionController {

    private final CorrectionService correctionService;

    public CorrectionController(CorrectionService correctionService) {
        this.correctionService = correctionService;
    }

    @Operation(summary = "Correct a decision",
            description = "Stores the correction, feeds the pattern learner and dispatches learning feedback in the " +
                    "background. Re-submitting the same correction returns the original outcome with replayed=true.")
    @PostMapping("/decisions/{decisionId}/correction")
    public ResponseEntity<CorrectionResult> correct(@PathVariable String tenantId,
                                                    @PathVariable String decisionId,
                                                    @RequestBody CorrectionRequest request) {
        return ResponseEntity.ok(correctionService.recordCorrection(tenantId, decisionId, request));
    }

    @Operation(summary = "List recent corrections, newest first")
    @GetMapping("/corrections")
    public ResponseEntity<List<Correction>> listCorrections(@PathVariable String tenantId,
                                                            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(correctionService.listCorrections(tenantId, limit));
    }
}
