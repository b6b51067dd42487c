package com.bank.categorization.integration;

import com.bank.categorization.model.RewardSignal;

/**
 * Receiver of graded correction rewards. Any number of sinks may be registered as beans, including none.
 */
public interface RewardSink {

    void recordReward(RewardSignal signal);

    default String name() {
        return getClass().getSimpleName();
    }
}
