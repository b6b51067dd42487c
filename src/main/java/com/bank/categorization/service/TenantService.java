package com.bank.categorization.service;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.config.TenantConfig;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.exception.UnknownTenantException;
import com.bank.categorization.model.Tenant;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.TenantRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tenant registry and the single place where a {@link TenantContext} is created.
 */
@Service
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-]{1,48}");

    private final TenantRepository tenantRepository;
    private final TenantConfig tenantConfig;
    private final RoutingConfig routingConfig;

    public TenantService(TenantRepository tenantRepository,
                         TenantConfig tenantConfig,
                         RoutingConfig routingConfig) {
        this.tenantRepository = tenantRepository;
        this.tenantConfig = tenantConfig;
        this.routingConfig = routingConfig;
    }

    @PostConstruct
    public void registerBootstrapTenants() {
        for (String tenantId : tenantConfig.getBootstrap()) {
            if (!isValidId(tenantId)) {
                log.warn("Skipping bootstrap tenant with invalid id: {}", tenantId);
                continue;
            }
            if (tenantRepository.findById(tenantId) == null) {
                tenantRepository.save(Tenant.builder()
                        .tenantId(tenantId)
                        .name(tenantId)
                        .active(true)
                        .createdAt(Instant.now())
                        .build());
                log.info("Bootstrap tenant registered: {}", tenantId);
            }
        }
    }

    /**
     * Resolve a caller-supplied tenant id.
     * @throws UnknownTenantException if the tenant is missing or inactive
     */
    public TenantContext requireTenant(String tenantId) {
        if (!isValidId(tenantId)) {
            throw new UnknownTenantException(tenantId);
        }
        Tenant tenant = tenantRepository.findById(tenantId);
        if (tenant == null || !tenant.isActive()) {
            throw new UnknownTenantException(tenantId);
        }
        int threshold = tenant.getAutoApplyThreshold() != null
                ? tenant.getAutoApplyThreshold()
                : routingConfig.getAutoApplyThreshold();
        return new TenantContext(tenant.getTenantId(), threshold);
    }

    public Tenant register(String tenantId, Tenant request) {
        if (!isValidId(tenantId)) {
            throw new InvalidRequestException("tenantId must match " + TENANT_ID.pattern());
        }
        Integer threshold = request.getAutoApplyThreshold();
        if (threshold != null && (threshold < 0 || threshold > 100)) {
            throw new InvalidRequestException("autoApplyThreshold must be between 0 and 100");
        }

        Tenant existing = tenantRepository.findById(tenantId);
        Tenant tenant = Tenant.builder()
                .tenantId(tenantId)
                .name(request.getName() != null ? request.getName() : tenantId)
                .autoApplyThreshold(threshold)
                .active(request.isActive())
                .createdAt(existing != null ? existing.getCreatedAt() : Instant.now())
                .build();
        tenantRepository.save(tenant);
        log.info("Tenant {}: id={}, active={}, threshold={}",
                existing == null ? "registered" : "updated", tenantId, tenant.isActive(), threshold);
        return tenant;
    }

    public Tenant getTenant(String tenantId) {
        Tenant tenant = isValidId(tenantId) ? tenantRepository.findById(tenantId) : null;
        if (tenant == null) {
            throw new UnknownTenantException(tenantId);
        }
        return tenant;
    }

    public List<Tenant> listTenants() {
        return tenantRepository.findAll();
    }

    static boolean isValidId(String tenantId) {
        return tenantId != null && TENANT_ID.matcher(tenantId).matches();
    }
}
