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
import com.ecp.governance.model.EventReservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index from event id to the ledger sequence holding the event. The record is
 * created before the ledger append (sequence -1 while pending), which makes the
 * create-only put the replay check.
 */
@Repository
public class DecisionEventRepository {

    private static final Logger log = LoggerFactory.getLogger(DecisionEventRepository.class);

    public static final long PENDING_SEQUENCE = -1L;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public DecisionEventRepository(AerospikeClient client,
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
     * Claim an event id.
     * @return false if the id is already claimed
     */
    public boolean reserve(String eventId, String agentId, String eventType) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("eventId", eventId),
                    new Bin("seq", PENDING_SEQUENCE),
                    new Bin("agentId", agentId),
                    new Bin("eventType", eventType),
                    new Bin("reservedAt", System.currentTimeMillis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public void bindSequence(String eventId, long sequence) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        client.put(writePolicy, key, new Bin("seq", sequence));
    }

    /** Undo a reservation whose event never reached the ledger. */
    public void release(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        client.delete(writePolicy, key);
    }

    public boolean exists(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        return client.exists(readPolicy, key);
    }

    /** @return ledger sequence of the event, or null if unknown or still pending */
    public Long findSequence(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        long seq = record.getLong("seq");
        return seq == PENDING_SEQUENCE ? null : seq;
    }

    /** @return the reservation, pending or bound, or null if the event id was never claimed */
    public EventReservation findReservation(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        Record record = client.get(readPolicy, key);
        return record == null ? null : mapReservation(record);
    }

    /** @return event type recorded at admission, or null if the event is unknown */
    public String findEventType(String eventId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_EVENTS, eventId);
        Record record = client.get(readPolicy, key);
        return record == null ? null : record.getString("eventType");
    }

    /** All indexed events as eventId -> sequence. Used by the consistency audit only. */
    public Map<String, Long> scanAll() {
        Map<String, Long> index = new HashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISION_EVENTS,
                (key, record) -> {
                    try {
                        synchronized (index) {
                            index.put(record.getString("eventId"), record.getLong("seq"));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read decision event index record: {}", e.getMessage());
                    }
                });
        return index;
    }

    /** Reservations whose ledger entry was never bound. */
    public List<EventReservation> scanPending() {
        List<EventReservation> pending = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISION_EVENTS,
                (key, record) -> {
                    try {
                        if (record.getLong("seq") == PENDING_SEQUENCE) {
                            synchronized (pending) {
                                pending.add(mapReservation(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read decision event index record: {}", e.getMessage());
                    }
                });
        return pending;
    }

    private EventReservation mapReservation(Record record) {
        return new EventReservation(
                record.getString("eventId"),
                record.getLong("seq"),
                record.getString("agentId"),
                record.getString("eventType"),
                record.getLong("reservedAt"));
    }
}
