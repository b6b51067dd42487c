package com.bank.categorization.service;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.DecisionStatus;
import com.bank.categorization.model.MatchType;
import com.bank.categorization.model.RuleMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.bank.categorization.testutil.TestDataFactory.category;
import static com.bank.categorization.testutil.TestDataFactory.createRule;
import static org.assertj.core.api.Assertions.assertThat;

class DecisionScoringServiceTest {

    private RoutingConfig config;
    private DecisionScoringService service;

    @BeforeEach
    void setUp() {
        config = new RoutingConfig();
        service = new DecisionScoringService(config);
    }

    private static Optional<RuleMatch> exact(String target, int boost, int support) {
        return Optional.of(new RuleMatch(createRule("ACME SUPPLY", target, boost, support), 100, MatchType.EXACT_SIGNATURE));
    }

    @Test
    void noRule_keepsInferenceConfidence() {
        ScoredDecision scored = service.score(category("5200", "Office"), 79, Optional.empty(), 80);

        assertThat(scored.confidence()).isEqualTo(79);
        assertThat(scored.source()).isEqualTo(DecisionSource.INFERENCE);
        assertThat(scored.status()).isEqualTo(DecisionStatus.REVIEW_REQUIRED);
    }

    @Test
    void thresholdIsInclusive() {
        assertThat(service.score(category("5200", "Office"), 80, Optional.empty(), 80).status())
                .isEqualTo(DecisionStatus.AUTO_APPLIED);
    }

    @Test
    void agreeingRule_boostIsClampedAt100() {
        ScoredDecision scored = service.score(category("5200", "Office"), 95, exact("5200", 15, 3), 80);

        assertThat(scored.confidence()).isEqualTo(100);
        assertThat(scored.source()).isEqualTo(DecisionSource.HYBRID);
    }

    @Test
    void agreementIgnoresCodeCase() {
        ScoredDecision scored = service.score(category("ab-1", "Office"), 60, exact("AB-1", 10, 3), 80);

        assertThat(scored.confidence()).isEqualTo(70);
        assertThat(scored.source()).isEqualTo(DecisionSource.HYBRID);
    }

    @Test
    void outOfRangeInferenceConfidence_isClamped() {
        assertThat(service.score(category("5200", "Office"), 140, Optional.empty(), 80).confidence()).isEqualTo(100);
        assertThat(service.score(category("5200", "Office"), -5, Optional.empty(), 80).confidence()).isZero();
    }

    @Test
    void shortCircuit_disabledByDefault() {
        assertThat(service.shortCircuit(exact("5200", 15, 10), 80)).isEmpty();
    }

    @Test
    void shortCircuit_requiresExactMatchAndSupport() {
        config.setPatternShortCircuitEnabled(true);

        assertThat(service.shortCircuit(exact("5200", 15, 4), 80)).isEmpty();
        assertThat(service.shortCircuit(Optional.of(new RuleMatch(createRule("ACME", "5200", 15, 9), 80,
                MatchType.PARTIAL_SIGNATURE)), 80)).isEmpty();

        Optional<ScoredDecision> scored = service.shortCircuit(exact("5200", 15, 5), 80);
        assertThat(scored).isPresent();
        assertThat(scored.get().source()).isEqualTo(DecisionSource.PATTERN);
        assertThat(scored.get().confidence()).isEqualTo(85);
        assertThat(scored.get().status()).isEqualTo(DecisionStatus.AUTO_APPLIED);
    }
}
