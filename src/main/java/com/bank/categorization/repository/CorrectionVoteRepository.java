package com.bank.categorization.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.MapOperation;
import com.aerospike.client.cdt.MapOrder;
import com.aerospike.client.cdt.MapPolicy;
import com.aerospike.client.cdt.MapWriteFlags;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.categorization.config.AerospikeConfig;
import com.bank.categorization.model.VoteTally;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Map;

/**
 * Per-signature ledger of corrected targets, one map entry per decision. The map
 * entry is written create-only, so replaying a correction never counts twice.
 */
@Repository
public class CorrectionVoteRepository {

    private static final String VOTES_BIN = "votes";
    private static final MapPolicy CREATE_ONLY_ENTRY =
            new MapPolicy(MapOrder.UNORDERED, MapWriteFlags.CREATE_ONLY);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public CorrectionVoteRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Record that {@code decisionId} was corrected to {@code targetCode} and tally the
     * votes for the signature afterwards.
     */
    public VoteTally recordVote(String tenantId, String signature, String decisionId, String targetCode) {
        Key key = key(tenantId, signature);
        Map<?, ?> votes;
        boolean newVote;
        try {
            Record record = client.operate(writePolicy, key,
                    MapOperation.put(CREATE_ONLY_ENTRY, VOTES_BIN, Value.get(decisionId), Value.get(targetCode)),
                    Operation.get(VOTES_BIN));
            votes = record == null ? Map.of() : record.getMap(VOTES_BIN);
            newVote = true;
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.ELEMENT_EXISTS) {
                throw e;
            }
            Record record = client.get(readPolicy, key);
            votes = record == null ? Map.of() : record.getMap(VOTES_BIN);
            newVote = false;
        }
        return tally(votes, targetCode, newVote);
    }

    static VoteTally tally(Map<?, ?> votes, String targetCode, boolean newVote) {
        if (votes == null) {
            return new VoteTally(newVote, 0, 0);
        }
        int agreeing = 0;
        for (Object value : votes.values()) {
            if (targetCode.equals(value)) agreeing++;
        }
        return new VoteTally(newVote, agreeing, votes.size());
    }

    private Key key(String tenantId, String signature) {
        return new Key(namespace, AerospikeConfig.SET_CORRECTION_VOTES, tenantId + ":" + signature);
    }
}
