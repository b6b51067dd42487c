package com.bank.categorization.service;

import com.bank.categorization.config.LearningConfig;
import com.bank.categorization.config.MetricsConfig;
import com.bank.categorization.integration.RewardSink;
import com.bank.categorization.integration.TrajectoryRecorder;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.CorrectionSeverity;
import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.FeedbackData;
import com.bank.categorization.model.FeedbackResult;
import com.bank.categorization.model.FeedbackSignal;
import com.bank.categorization.model.RewardSignal;
import com.bank.categorization.model.TrajectoryStep;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Propagates a graded reward for every correction to the registered learning
 * back ends. Each target runs as its own task on the learning pool and is caught
 * on its own, so one failing or slow target is invisible to the others.
 *
 * This is the only place rewards are sent. Corrections themselves are stored by
 * {@link CorrectionService}, never here.
 */
@Service
public class FeedbackLoopService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLoopService.class);

    static final String TRAJECTORY_TARGET = "trajectory";

    private final ObjectProvider<RewardSink> rewardSinks;
    private final ObjectProvider<TrajectoryRecorder> trajectoryRecorders;
    private final ThreadPoolTaskExecutor learningExecutor;
    private final LearningConfig learningConfig;
    private final MetricsConfig metrics;
    private final ObjectMapper objectMapper;

    public FeedbackLoopService(ObjectProvider<RewardSink> rewardSinks,
                               ObjectProvider<TrajectoryRecorder> trajectoryRecorders,
                               @Qualifier("learningExecutor") ThreadPoolTaskExecutor learningExecutor,
                               LearningConfig learningConfig,
                               MetricsConfig metrics) {
        this.rewardSinks = rewardSinks;
        this.trajectoryRecorders = trajectoryRecorders;
        this.learningExecutor = learningExecutor;
        this.learningConfig = learningConfig;
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Dispatch the correction to every target. The returned future completes once
     * all targets have finished or failed and never completes exceptionally.
     */
    public CompletableFuture<FeedbackResult> processFeedback(FeedbackData data) {
        FeedbackSignal signal = computeSignal(data);

        Map<String, CompletableFuture<Void>> dispatches = new LinkedHashMap<>();
        for (RewardSink sink : rewardSinks.orderedStream().toList()) {
            RewardSignal reward = rewardFor(signal, data);
            dispatches.put(sink.name(), submit(() -> sink.recordReward(reward)));
        }
        for (TrajectoryRecorder recorder : trajectoryRecorders.orderedStream().toList()) {
            dispatches.put(TRAJECTORY_TARGET + ":" + recorder.name(), submit(() -> recordTrajectory(recorder, data)));
        }

        if (dispatches.isEmpty()) {
            log.debug("No learning targets configured, feedback for decision {} is a no-op", data.getDecisionId());
            return CompletableFuture.completedFuture(FeedbackResult.builder().processed(true).build());
        }

        List<CompletableFuture<Void>> settled = new ArrayList<>();
        FeedbackResult result = FeedbackResult.builder().processed(true).build();
        dispatches.forEach((target, future) -> settled.add(future.handle((ignored, error) -> {
            synchronized (result) {
                if (error == null) {
                    result.getTargets().add(target);
                } else {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    result.getErrors().put(target, String.valueOf(cause.getMessage()));
                    log.warn("Feedback dispatch to {} failed for decision {}: {}",
                            target, data.getDecisionId(), cause.getMessage());
                }
            }
            metrics.recordFeedbackDispatch(target, error == null ? "success" : "error");
            return null;
        })));

        return CompletableFuture.allOf(settled.toArray(new CompletableFuture[0])).thenApply(v -> result);
    }

    /**
     * Grades a correction. Account codes sharing their leading category digits make
     * a partial correction; anything else, including values that are not category
     * values, is standard.
     */
    public FeedbackSignal computeSignal(FeedbackData data) {
        CorrectionSeverity severity = classify(data.getOriginalValue(), data.getCorrectedValue());
        double reward = severity == CorrectionSeverity.PARTIAL
                ? learningConfig.getPartialPenalty()
                : learningConfig.getStandardPenalty();
        DecisionSource action = data.getOriginalSource() != null ? data.getOriginalSource() : DecisionSource.HYBRID;
        return FeedbackSignal.builder()
                .tenantId(data.getTenantId())
                .decisionId(data.getDecisionId())
                .agentType(AgentType.resolve(data.getAgentType()))
                .action(action.name())
                .severity(severity)
                .reward(reward)
                .build();
    }

    CorrectionSeverity classify(Object original, Object corrected) {
        if (!(original instanceof CategoryValue from) || !(corrected instanceof CategoryValue to)) {
            return CorrectionSeverity.STANDARD;
        }
        String fromCode = from.normalizedCode();
        String toCode = to.normalizedCode();
        int prefix = learningConfig.getCategoryPrefixLength();
        if (fromCode.length() < prefix || toCode.length() < prefix) {
            return CorrectionSeverity.STANDARD;
        }
        return fromCode.substring(0, prefix).equals(toCode.substring(0, prefix))
                ? CorrectionSeverity.PARTIAL
                : CorrectionSeverity.STANDARD;
    }

    private RewardSignal rewardFor(FeedbackSignal signal, FeedbackData data) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("tenantId", signal.getTenantId());
        context.put("agentType", signal.getAgentType().name().toLowerCase(Locale.ROOT));
        context.put("decisionId", signal.getDecisionId());
        context.put("severity", signal.getSeverity().name());
        if (data.getOriginalConfidence() != null) {
            context.put("originalConfidence", data.getOriginalConfidence());
        }
        return new RewardSignal(context, signal.getAction(), signal.getReward(), true);
    }

    private void recordTrajectory(TrajectoryRecorder recorder, FeedbackData data) {
        String trajectoryId = recorder.beginTrajectory(new float[learningConfig.getTrajectoryEmbeddingDimensions()]);

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("tenantId", data.getTenantId());
        state.put("decisionId", data.getDecisionId());
        state.put("agentType", AgentType.resolve(data.getAgentType()).name().toLowerCase(Locale.ROOT));
        state.put("originalValue", data.getOriginalValue());

        recorder.addStep(trajectoryId,
                new TrajectoryStep(state, toJson(data.getCorrectedValue()), learningConfig.getTrajectoryStepReward()));
        recorder.endTrajectory(trajectoryId, learningConfig.getTrajectoryQuality());
    }

    private CompletableFuture<Void> submit(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, learningExecutor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            return String.valueOf(value);
        }
    }
}
