package com.bank.categorization.service;

import com.bank.categorization.config.LearningConfig;
import com.bank.categorization.model.*;
import com.bank.categorization.repository.CorrectionVoteRepository;
import com.bank.categorization.repository.LearnedRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.bank.categorization.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatternLearningServiceTest {

    @Mock
    private CorrectionVoteRepository voteRepository;

    @Mock
    private LearnedRuleRepository ruleRepository;

    private PatternLearningService service;

    @BeforeEach
    void setUp() {
        service = new PatternLearningService(voteRepository, ruleRepository, new LearningConfig());
    }

    private static Decision decision(String id) {
        return createDecision(id, "ACME SUPPLY", category("6100", "Travel"), DecisionSource.INFERENCE, 70);
    }

    @Test
    void belowThreshold_doesNotCreateRule() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d1", "5200")).thenReturn(new VoteTally(true, 2, 2));

        PatternResult result = service.learn(tenant(), decision("d1"), category("5200", "Office Supplies"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.BELOW_THRESHOLD);
        assertThat(result.getAgreeingCorrections()).isEqualTo(2);
        verify(ruleRepository, never()).createIfAbsent(any());
    }

    @Test
    void thirdAgreeingCorrection_createsRule() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d3", "5200")).thenReturn(new VoteTally(true, 3, 3));
        when(ruleRepository.createIfAbsent(any())).thenReturn(true);

        PatternResult result = service.learn(tenant(), decision("d3"), category(" 5200 ", "Office Supplies"));

        assertThat(result.isPatternCreated()).isTrue();
        ArgumentCaptor<LearnedRule> captor = ArgumentCaptor.forClass(LearnedRule.class);
        verify(ruleRepository).createIfAbsent(captor.capture());
        LearnedRule rule = captor.getValue();
        assertThat(rule.getSignature()).isEqualTo("ACME SUPPLY");
        assertThat(rule.getTarget().getAccountCode()).isEqualTo("5200");
        assertThat(rule.getBoost()).isEqualTo(15);
        assertThat(rule.getSupportCount()).isEqualTo(3);
        assertThat(rule.getRuleId()).isEqualTo(LearnedRuleRepository.ruleIdFor(TENANT_ID, "ACME SUPPLY"));
        assertThat(rule.getKeywords()).containsExactly("STATIONERY");
    }

    @Test
    void splitVotes_scaleBoost() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d5", "5200")).thenReturn(new VoteTally(true, 3, 5));
        when(ruleRepository.createIfAbsent(any())).thenReturn(true);

        PatternResult result = service.learn(tenant(), decision("d5"), category("5200", "Office Supplies"));

        assertThat(result.getRule().getBoost()).isEqualTo(9);
    }

    @Test
    void existingRuleWithSameTarget_isRuleExists() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d4", "5200")).thenReturn(new VoteTally(true, 4, 4));
        when(ruleRepository.findBySignature(TENANT_ID, "ACME SUPPLY")).thenReturn(createRule("ACME SUPPLY", "5200", 15, 3));

        PatternResult result = service.learn(tenant(), decision("d4"), category("5200", "Office Supplies"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.RULE_EXISTS);
        verify(ruleRepository, never()).createIfAbsent(any());
    }

    @Test
    void existingRuleWithOtherTarget_isConflictAndRuleUntouched() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d4", "6100")).thenReturn(new VoteTally(true, 1, 4));
        LearnedRule existing = createRule("ACME SUPPLY", "5200", 15, 3);
        when(ruleRepository.findBySignature(TENANT_ID, "ACME SUPPLY")).thenReturn(existing);

        PatternResult result = service.learn(tenant(), decision("d4"), category("6100", "Travel"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.CONFLICT);
        assertThat(result.getConflictingRule()).isSameAs(existing);
        verify(ruleRepository, never()).createIfAbsent(any());
        verify(ruleRepository, never()).delete(any(), any());
    }

    @Test
    void repeatedVote_isDuplicate() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d1", "5200")).thenReturn(new VoteTally(false, 3, 3));

        PatternResult result = service.learn(tenant(), decision("d1"), category("5200", "Office Supplies"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.DUPLICATE);
        verifyNoInteractions(ruleRepository);
    }

    @Test
    void blankSignature_isNotLearned() {
        Decision decision = decision("d1");
        decision.setSignature("");

        PatternResult result = service.learn(tenant(), decision, category("5200", "Office Supplies"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.NO_SIGNATURE);
        verifyNoInteractions(voteRepository, ruleRepository);
    }

    @Test
    void lostCreateRace_comparesWithWinner() {
        when(voteRepository.recordVote(TENANT_ID, "ACME SUPPLY", "d3", "5200")).thenReturn(new VoteTally(true, 3, 3));
        when(ruleRepository.findBySignature(TENANT_ID, "ACME SUPPLY"))
                .thenReturn(null, createRule("ACME SUPPLY", "5200", 15, 3));
        when(ruleRepository.createIfAbsent(any())).thenReturn(false);

        PatternResult result = service.learn(tenant(), decision("d3"), category("5200", "Office Supplies"));

        assertThat(result.getOutcome()).isEqualTo(PatternOutcome.RULE_EXISTS);
    }

    @Test
    void boostFor_isClampedToBase() {
        assertThat(service.boostFor(3, 3)).isEqualTo(15);
        assertThat(service.boostFor(1, 100)).isEqualTo(1);
        assertThat(service.boostFor(0, 0)).isEqualTo(15);
    }
}
