package com.bank.categorization.model;

/**
 * Correction votes for one signature within a tenant.
 *
 * @param newVote   false when the decision had already voted
 * @param agreeing  votes for the same account code as this correction
 * @param total     all votes for the signature
 */
public record VoteTally(boolean newVote, int agreeing, int total) {}
