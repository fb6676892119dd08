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
import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.EscalationSource;
import com.ecp.governance.model.EscalationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class EscalationRepository {

    private static final Logger log = LoggerFactory.getLogger(EscalationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public EscalationRepository(AerospikeClient client,
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

    /**
     * @return false if an escalation with the same id already exists
     */
    public boolean createIfAbsent(Escalation escalation) {
        Key key = new Key(namespace, AerospikeConfig.SET_ESCALATIONS, escalation.getEscalationId());
        try {
            client.put(createOnlyPolicy, key, toBins(escalation));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public Escalation findById(String escalationId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ESCALATIONS, escalationId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Move an escalation out of AWAITING_HUMAN_REVIEW. Only updates if the
     * current status is still awaiting review.
     * @return true if updated, false if missing or already resolved
     */
    public boolean resolve(String escalationId, EscalationStatus status, String resolvedBy, String precedentEventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ESCALATIONS, escalationId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String currentStatus = record.getString("status");
        if (!EscalationStatus.AWAITING_HUMAN_REVIEW.name().equals(currentStatus)) {
            log.debug("Escalation {} already has status {}, skipping update", escalationId, currentStatus);
            return false;
        }

        client.put(writePolicy, key,
                new Bin("status", status.name()),
                new Bin("resolvedAt", System.currentTimeMillis()),
                new Bin("resolvedBy", resolvedBy),
                new Bin("precedentId", precedentEventId != null ? precedentEventId : ""));
        return true;
    }

    public List<Escalation> findByStatus(EscalationStatus status) {
        List<Escalation> results = new ArrayList<>();
        for (Escalation escalation : findAll()) {
            if (status == null || escalation.getStatus() == status) {
                results.add(escalation);
            }
        }
        return results;
    }

    public List<Escalation> findAll() {
        List<Escalation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ESCALATIONS,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read escalation record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparingLong(Escalation::getCreatedAt).reversed());
        return results;
    }

    private Bin[] toBins(Escalation e) {
        return new Bin[] {
                new Bin("escalationId", e.getEscalationId()),
                new Bin("source", e.getSource().name()),
                new Bin("referenceId", e.getReferenceId()),
                new Bin("reason", e.getReason() != null ? e.getReason() : ""),
                new Bin("status", e.getStatus().name()),
                new Bin("createdAt", e.getCreatedAt()),
                new Bin("resolvedAt", e.getResolvedAt()),
                new Bin("resolvedBy", e.getResolvedBy() != null ? e.getResolvedBy() : ""),
                new Bin("precedentId", e.getPrecedentEventId() != null ? e.getPrecedentEventId() : "")
        };
    }

    private Escalation mapRecord(Record record) {
        String resolvedBy = record.getString("resolvedBy");
        String precedentId = record.getString("precedentId");
        return Escalation.builder()
                .escalationId(record.getString("escalationId"))
                .source(EscalationSource.valueOf(record.getString("source")))
                .referenceId(record.getString("referenceId"))
                .reason(record.getString("reason"))
                .status(EscalationStatus.valueOf(record.getString("status")))
                .createdAt(record.getLong("createdAt"))
                .resolvedAt(record.getLong("resolvedAt"))
                .resolvedBy(resolvedBy != null && !resolvedBy.isEmpty() ? resolvedBy : null)
                .precedentEventId(precedentId != null && !precedentId.isEmpty() ? precedentId : null)
                .build();
    }
}
