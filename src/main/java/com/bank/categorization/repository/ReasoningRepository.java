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
import com.bank.categorization.model.ReasoningPartition;
import com.bank.categorization.model.ReasoningRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Semantic memory of rationale text. Every operation addresses one tenant's own
 * set, named by its {@link ReasoningPartition}; there is no way to address
 * another set through this class.
 */
@Repository
public class ReasoningRepository {

    private static final Logger log = LoggerFactory.getLogger(ReasoningRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public ReasoningRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Append a record. Existing records are never overwritten.
     * @return false if the decision already has a stored rationale
     */
    public boolean insert(ReasoningPartition partition, ReasoningRecord record) {
        Key key = new Key(namespace, partition.setName(), record.getDecisionId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("tenantId", partition.tenantId()),
                    new Bin("decisionId", record.getDecisionId()),
                    new Bin("chain", record.getChain()),
                    new Bin("embedding", JsonBinCodec.write(record.getEmbedding())),
                    new Bin("storedAt", record.getStoredAt().toEpochMilli()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public ReasoningRecord findByDecisionId(ReasoningPartition partition, String decisionId) {
        Record record = client.get(readPolicy, new Key(namespace, partition.setName(), decisionId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<ReasoningRecord> scan(ReasoningPartition partition) {
        List<ReasoningRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, partition.setName(),
                (key, record) -> {
                    try {
                        ReasoningRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read reasoning record in {}: {}", partition, e.getMessage());
                    }
                });
        return results;
    }

    private ReasoningRecord mapRecord(Record record) {
        return ReasoningRecord.builder()
                .tenantId(record.getString("tenantId"))
                .decisionId(record.getString("decisionId"))
                .chain(record.getString("chain"))
                .embedding(JsonBinCodec.readVector(record.getString("embedding")))
                .storedAt(Instant.ofEpochMilli(record.getLong("storedAt")))
                .build();
    }
}
