package com.bank.categorization.service;

import com.bank.categorization.model.AccuracyStats;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.repository.DecisionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.bank.categorization.testutil.TestDataFactory.TENANT_ID;
import static com.bank.categorization.testutil.TestDataFactory.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    @Mock
    private TenantService tenantService;

    @Mock
    private DecisionRepository decisionRepository;

    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        service = new AnalyticsService(tenantService, decisionRepository);
        when(tenantService.requireTenant(TENANT_ID)).thenReturn(tenant());
    }

    @Test
    void accuracy_isRoundedPercentageOfReviewed() {
        when(decisionRepository.countReviewOutcomes(TENANT_ID, AgentType.CATEGORIZER)).thenReturn(new long[]{10, 3, 2});

        AccuracyStats stats = service.getAccuracy(TENANT_ID, "categorizer");

        assertThat(stats.getAgentType()).isEqualTo(AgentType.CATEGORIZER);
        assertThat(stats.getTotalDecisions()).isEqualTo(10);
        assertThat(stats.getReviewedDecisions()).isEqualTo(3);
        assertThat(stats.getAccuracyRate()).isEqualTo(67);
    }

    @Test
    void accuracy_withoutReviewsIsZero() {
        when(decisionRepository.countReviewOutcomes(TENANT_ID, null)).thenReturn(new long[]{4, 0, 0});

        AccuracyStats stats = service.getAccuracy(TENANT_ID, null);

        assertThat(stats.getAgentType()).isNull();
        assertThat(stats.getAccuracyRate()).isZero();
    }

    @Test
    void blankAgentType_coversAllAgents() {
        when(decisionRepository.countReviewOutcomes(eq(TENANT_ID), (AgentType) isNull())).thenReturn(new long[]{2, 2, 2});

        assertThat(service.getAccuracy(TENANT_ID, " ").getAccuracyRate()).isEqualTo(100);
    }
}
