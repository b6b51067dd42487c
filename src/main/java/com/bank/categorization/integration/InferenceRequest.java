package com.bank.categorization.integration;

import com.bank.categorization.model.AgentType;

/**
 * What the inference subsystem is asked to categorize.
 */
public record InferenceRequest(String transactionId,
                               String inputText,
                               long amountCents,
                               boolean credit,
                               AgentType agentType) {
}
