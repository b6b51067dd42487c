package com.bank.categorization.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A stored reasoning chain ranked by similarity to a query")
public record SimilarRationale(String decisionId, String text, double similarity) {}
