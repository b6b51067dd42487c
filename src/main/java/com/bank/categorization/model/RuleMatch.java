package com.bank.categorization.model;

public record RuleMatch(LearnedRule rule, double matchScore, MatchType matchType) {}
