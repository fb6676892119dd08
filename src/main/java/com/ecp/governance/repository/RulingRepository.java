package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.HumanRuling;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * At most one ruling per event, written create-only. Rulings that created a
 * precedent are also cached in memory for escalation matching.
 */
@Repository
public class RulingRepository {

    private static final Logger log = LoggerFactory.getLogger(RulingRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    private final List<HumanRuling> precedents = new CopyOnWriteArrayList<>();

    public RulingRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @PostConstruct
    public void loadPrecedents() {
        try {
            List<HumanRuling> all = findAll();
            for (HumanRuling ruling : all) {
                if (ruling.isPrecedentCreated()) {
                    precedents.add(ruling);
                }
            }
            log.info("Loaded {} precedent rulings", precedents.size());
        } catch (Exception e) {
            log.error("Failed to load precedent rulings", e);
        }
    }

    /**
     * @return false if the event already has a ruling
     */
    public boolean createIfAbsent(HumanRuling ruling) {
        Key key = new Key(namespace, AerospikeConfig.SET_RULINGS, ruling.getEventId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("eventId", ruling.getEventId()),
                    new Bin("issuedBy", ruling.getIssuedBy()),
                    new Bin("assessment", ruling.getFinalAssessment().name()),
                    new Bin("reasoning", ruling.getReasoning()),
                    new Bin("precedent", ruling.isPrecedentCreated()),
                    new Bin("eventTypes", serializeTypes(ruling.getApplicableEventTypes())),
                    new Bin("validityDays", ruling.getValidityDays()),
                    new Bin("issuedAt", ruling.getIssuedAt()),
                    new Bin("expiresAt", ruling.getExpiresAt()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }

        if (ruling.isPrecedentCreated()) {
            precedents.add(ruling);
        }
        return true;
    }

    public HumanRuling findByEventId(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_RULINGS, eventId);
        Record record = client.get(readPolicy, key);
        return record == null ? null : mapRecord(record);
    }

    /** Cached precedent rulings, oldest first. Includes expired ones. */
    public List<HumanRuling> findPrecedents() {
        List<HumanRuling> copy = new ArrayList<>(precedents);
        copy.sort(Comparator.comparingLong(HumanRuling::getIssuedAt));
        return copy;
    }

    public List<HumanRuling> findAll() {
        List<HumanRuling> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RULINGS,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read ruling record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparingLong(HumanRuling::getIssuedAt));
        return results;
    }

    private String serializeTypes(List<String> types) {
        try {
            return objectMapper.writeValueAsString(types != null ? types : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize applicable event types", e);
            return "[]";
        }
    }

    private HumanRuling mapRecord(Record record) {
        List<String> types = Collections.emptyList();
        String typesJson = record.getString("eventTypes");
        if (typesJson != null && !typesJson.isEmpty()) {
            try {
                types = objectMapper.readValue(typesJson, new TypeReference<List<String>>() {});
            } catch (Exception e) {
                log.warn("Failed to deserialize applicable event types: {}", e.getMessage());
            }
        }

        return HumanRuling.builder()
                .eventId(record.getString("eventId"))
                .issuedBy(record.getString("issuedBy"))
                .finalAssessment(EthicalStatus.valueOf(record.getString("assessment")))
                .reasoning(record.getString("reasoning"))
                .precedentCreated(record.getBoolean("precedent"))
                .applicableEventTypes(types)
                .validityDays(record.getInt("validityDays"))
                .issuedAt(record.getLong("issuedAt"))
                .expiresAt(record.getLong("expiresAt"))
                .build();
    }
}
