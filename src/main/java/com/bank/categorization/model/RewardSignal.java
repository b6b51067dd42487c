package com.bank.categorization.model;

import java.util.Map;

/**
 * Single graded update sent to a reinforcement-learning sink.
 */
public record RewardSignal(Map<String, Object> context, String action, double reward, boolean done) {}
