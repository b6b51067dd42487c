package com.bank.categorization.model;

public enum MatchType {
    EXACT_SIGNATURE,
    PARTIAL_SIGNATURE,
    KEYWORD,
    DESCRIPTION
}
