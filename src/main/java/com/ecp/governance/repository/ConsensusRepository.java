package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.ClassifierScore;
import com.ecp.governance.model.ConsensusRecord;
import com.ecp.governance.model.PairwiseDivergence;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;

/**
 * One overwritable consensus record per event.
 */
@Repository
public class ConsensusRepository {

    private static final Logger log = LoggerFactory.getLogger(ConsensusRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ConsensusRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ConsensusRecord record) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONSENSUS, record.getEventId());

        Bin eventIdBin = new Bin("eventId", record.getEventId());
        Bin tsBin = new Bin("ts", record.getTimestamp());
        Bin countBin = new Bin("count", record.getClassificationCount());
        Bin meanBin = new Bin("meanDiv", record.getDivergenceScore());
        Bin maxBin = new Bin("maxDiv", record.getMaxPairwiseDivergence());
        Bin aggregationBin = new Bin("aggregation", record.getAggregation());
        Bin thresholdBin = new Bin("threshold", record.getThreshold());
        Bin reviewBin = new Bin("review", record.isRequiresHumanReview());
        Bin reasonBin = new Bin("reason", record.getTriggerReason());
        Bin pairsBin = new Bin("pairs", serialize(record.getPairwiseDivergences()));
        Bin breakdownBin = new Bin("breakdown", serialize(record.getPerClassifierBreakdown()));

        client.put(writePolicy, key,
                eventIdBin, tsBin, countBin, meanBin, maxBin, aggregationBin,
                thresholdBin, reviewBin, reasonBin, pairsBin, breakdownBin);
    }

    public ConsensusRecord findByEventId(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONSENSUS, eventId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return ConsensusRecord.builder()
                .eventId(record.getString("eventId"))
                .timestamp(record.getLong("ts"))
                .classificationCount(record.getInt("count"))
                .divergenceScore(record.getDouble("meanDiv"))
                .maxPairwiseDivergence(record.getDouble("maxDiv"))
                .aggregation(record.getString("aggregation"))
                .threshold(record.getDouble("threshold"))
                .requiresHumanReview(record.getBoolean("review"))
                .triggerReason(record.getString("reason"))
                .pairwiseDivergences(deserialize(record.getString("pairs"),
                        new TypeReference<List<PairwiseDivergence>>() {}))
                .perClassifierBreakdown(deserialize(record.getString("breakdown"),
                        new TypeReference<List<ClassifierScore>>() {}))
                .build();
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize consensus detail", e);
            return "[]";
        }
    }

    private <T> List<T> deserialize(String json, TypeReference<List<T>> type) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize consensus detail", e);
            return Collections.emptyList();
        }
    }
}
