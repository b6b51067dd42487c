package com.bank.categorization.model;

import java.util.Map;

public record TrajectoryStep(Map<String, Object> state, String action, double reward) {}
