package com.bank.categorization.service;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.config.TenantConfig;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.exception.UnknownTenantException;
import com.bank.categorization.model.Tenant;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TenantServiceTest {

    @Mock
    private TenantRepository tenantRepository;

    private TenantConfig tenantConfig;
    private TenantService service;

    @BeforeEach
    void setUp() {
        tenantConfig = new TenantConfig();
        service = new TenantService(tenantRepository, tenantConfig, new RoutingConfig());
    }

    private static Tenant stored(String id, Integer threshold, boolean active) {
        return Tenant.builder().tenantId(id).name(id).autoApplyThreshold(threshold).active(active).build();
    }

    @Test
    void requireTenant_usesTenantThreshold() {
        when(tenantRepository.findById("tenant-001")).thenReturn(stored("tenant-001", 90, true));

        TenantContext context = service.requireTenant("tenant-001");

        assertThat(context.autoApplyThreshold()).isEqualTo(90);
        assertThat(context.reasoningPartition().setName()).isEqualTo("reasoning-tenant-001");
    }

    @Test
    void requireTenant_fallsBackToGlobalThreshold() {
        when(tenantRepository.findById("tenant-001")).thenReturn(stored("tenant-001", null, true));

        assertThat(service.requireTenant("tenant-001").autoApplyThreshold()).isEqualTo(80);
    }

    @Test
    void requireTenant_rejectsMissingInactiveAndMalformed() {
        when(tenantRepository.findById("sleepy")).thenReturn(stored("sleepy", null, false));

        assertThatThrownBy(() -> service.requireTenant("sleepy")).isInstanceOf(UnknownTenantException.class);
        assertThatThrownBy(() -> service.requireTenant("ghost")).isInstanceOf(UnknownTenantException.class);
        assertThatThrownBy(() -> service.requireTenant("../other")).isInstanceOf(UnknownTenantException.class);
        assertThatThrownBy(() -> service.requireTenant(null)).isInstanceOf(UnknownTenantException.class);
        verify(tenantRepository, never()).findById("../other");
    }

    @Test
    void register_validatesThreshold() {
        assertThatThrownBy(() -> service.register("tenant-001", stored(null, 101, true)))
                .isInstanceOf(InvalidRequestException.class);
        verify(tenantRepository, never()).save(any());
    }

    @Test
    void register_keepsCreationTimeOnUpdate() {
        Tenant existing = stored("tenant-001", 80, true);
        existing.setCreatedAt(java.time.Instant.parse("2024-01-01T00:00:00Z"));
        when(tenantRepository.findById("tenant-001")).thenReturn(existing);

        Tenant updated = service.register("tenant-001", stored(null, 70, true));

        assertThat(updated.getCreatedAt()).isEqualTo(existing.getCreatedAt());
        assertThat(updated.getAutoApplyThreshold()).isEqualTo(70);
        assertThat(updated.getName()).isEqualTo("tenant-001");
    }

    @Test
    void bootstrap_registersOnlyMissingValidTenants() {
        tenantConfig.setBootstrap(List.of("tenant-001", "tenant-002", "bad id"));
        when(tenantRepository.findById("tenant-001")).thenReturn(stored("tenant-001", null, true));

        service.registerBootstrapTenants();

        ArgumentCaptor<Tenant> saved = ArgumentCaptor.forClass(Tenant.class);
        verify(tenantRepository, times(1)).save(saved.capture());
        assertThat(saved.getValue().getTenantId()).isEqualTo("tenant-002");
        assertThat(saved.getValue().isActive()).isTrue();
    }
}
