package com.bank.categorization.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.categorization.config.AerospikeConfig;
import com.bank.categorization.model.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class TenantRepository {

    private static final Logger log = LoggerFactory.getLogger(TenantRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public TenantRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(Tenant tenant) {
        Key key = new Key(namespace, AerospikeConfig.SET_TENANTS, tenant.getTenantId());
        client.put(writePolicy, key,
                new Bin("tenantId", tenant.getTenantId()),
                new Bin("name", tenant.getName()),
                tenant.getAutoApplyThreshold() == null
                        ? Bin.asNull("autoApplyThr")
                        : new Bin("autoApplyThr", tenant.getAutoApplyThreshold()),
                new Bin("active", tenant.isActive()),
                new Bin("createdAt", tenant.getCreatedAt().toEpochMilli()));
    }

    public Tenant findById(String tenantId) {
        Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_TENANTS, tenantId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Tenant> findAll() {
        List<Tenant> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TENANTS,
                (key, record) -> {
                    try {
                        Tenant tenant = mapRecord(record);
                        synchronized (results) {
                            results.add(tenant);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read tenant record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparing(Tenant::getTenantId));
        return results;
    }

    private Tenant mapRecord(Record record) {
        Object threshold = record.getValue("autoApplyThr");
        Object active = record.getValue("active");
        return Tenant.builder()
                .tenantId(record.getString("tenantId"))
                .name(record.getString("name"))
                .autoApplyThreshold(threshold == null ? null : ((Number) threshold).intValue())
                .active(active == null || (active instanceof Boolean b ? b : ((Number) active).longValue() != 0))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .build();
    }
}
