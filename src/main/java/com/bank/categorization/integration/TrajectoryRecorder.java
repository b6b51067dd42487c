package com.bank.categorization.integration;

import com.bank.categorization.model.TrajectoryStep;

/**
 * Continual-learning recorder. Optional; absent unless a bean is registered.
 */
public interface TrajectoryRecorder {

    String beginTrajectory(float[] embedding);

    void addStep(String trajectoryId, TrajectoryStep step);

    void endTrajectory(String trajectoryId, double quality);

    default String name() {
        return getClass().getSimpleName();
    }
}
