package com.bank.categorization.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.categorization.config.AerospikeConfig;
import com.bank.categorization.model.LearnedRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Learned rules, one per (tenant, signature). The rule id is derived from both, so
 * the record key doubles as the uniqueness constraint.
 */
@Repository
public class LearnedRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(LearnedRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    // Rules grouped by tenant, refreshed periodically and after every change
    private final AtomicReference<Map<String, List<LearnedRule>>> cachedRules = new AtomicReference<>(Map.of());

    public LearnedRuleRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
    }

    public static String ruleIdFor(String tenantId, String signature) {
        return UUID.nameUUIDFromBytes((tenantId + ":" + signature).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public void startCacheRefresh(int intervalSeconds) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "learned-rule-cache-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshCache, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void refreshCache() {
        try {
            Map<String, List<LearnedRule>> byTenant = new HashMap<>();
            for (LearnedRule rule : scanAll(null)) {
                byTenant.computeIfAbsent(rule.getTenantId(), t -> new ArrayList<>()).add(rule);
            }
            byTenant.replaceAll((tenant, rules) -> List.copyOf(rules));
            cachedRules.set(Map.copyOf(byTenant));
            log.debug("Learned rule cache refreshed, {} tenants", byTenant.size());
        } catch (Exception e) {
            log.error("Failed to refresh learned rule cache", e);
        }
    }

    /**
     * Rules of one tenant from the in-memory cache.
     */
    public List<LearnedRule> findByTenantCached(String tenantId) {
        return cachedRules.get().getOrDefault(tenantId, List.of());
    }

    public List<LearnedRule> findByTenant(String tenantId) {
        return scanAll(tenantId);
    }

    public LearnedRule findById(String tenantId, String ruleId) {
        Record record = client.get(readPolicy, key(tenantId, ruleId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public LearnedRule findBySignature(String tenantId, String signature) {
        return findById(tenantId, ruleIdFor(tenantId, signature));
    }

    /**
     * Insert the rule unless one already exists for its signature.
     * @return false if another writer created a rule for the same signature first
     */
    public boolean createIfAbsent(LearnedRule rule) {
        Key key = key(rule.getTenantId(), rule.getRuleId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("tenantId", rule.getTenantId()),
                    new Bin("ruleId", rule.getRuleId()),
                    new Bin("signature", rule.getSignature()),
                    new Bin("keywords", JsonBinCodec.write(rule.getKeywords())),
                    new Bin("target", JsonBinCodec.write(rule.getTarget())),
                    new Bin("boost", rule.getBoost()),
                    new Bin("supportCount", rule.getSupportCount()),
                    new Bin("createdAt", rule.getCreatedAt().toEpochMilli()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
        refreshCache();
        return true;
    }

    public boolean delete(String tenantId, String ruleId) {
        boolean deleted = client.delete(writePolicy, key(tenantId, ruleId));
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<LearnedRule> scanAll(String tenantId) {
        List<LearnedRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_LEARNED_RULES,
                (key, record) -> {
                    try {
                        if (tenantId != null && !tenantId.equals(record.getString("tenantId"))) return;
                        LearnedRule rule = mapRecord(record);
                        synchronized (rules) {
                            rules.add(rule);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize learned rule record: {}", e.getMessage());
                    }
                });
        return rules;
    }

    private Key key(String tenantId, String ruleId) {
        return new Key(namespace, AerospikeConfig.SET_LEARNED_RULES, tenantId + ":" + ruleId);
    }

    private LearnedRule mapRecord(Record record) {
        return LearnedRule.builder()
                .tenantId(record.getString("tenantId"))
                .ruleId(record.getString("ruleId"))
                .signature(record.getString("signature"))
                .keywords(JsonBinCodec.readList(record.getString("keywords")))
                .target(JsonBinCodec.readCategory(record.getString("target")))
                .boost(record.getInt("boost"))
                .supportCount(record.getInt("supportCount"))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .build();
    }
}
