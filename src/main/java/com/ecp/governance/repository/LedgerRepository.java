package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.service.LedgerHasher;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One record per ledger sequence number, written create-only, plus a single
 * head record pointing at the newest sequence.
 */
@Repository
public class LedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(LedgerRepository.class);

    private static final String HEAD_KEY = "head";
    private static final int BATCH_SIZE = 500;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public LedgerRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Persist a new entry. Fails with a KEY_EXISTS_ERROR if the sequence is
     * already taken, so an entry can never be overwritten through this path.
     */
    public void save(LedgerEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_LEDGER_ENTRIES, entry.getSequence());

        Bin entryIdBin = new Bin("entryId", entry.getEntryId());
        Bin seqBin = new Bin("seq", entry.getSequence());
        Bin tsBin = new Bin("ts", entry.getTimestamp());
        Bin typeBin = new Bin("entryType", entry.getEntryType());
        Bin payloadBin = new Bin("payload", LedgerHasher.canonicalize(objectMapper, entry.getPayload()));
        Bin prevHashBin = new Bin("prevHash", entry.getPreviousHash());
        Bin hashBin = new Bin("hash", entry.getHash());

        client.put(createOnlyPolicy, key,
                entryIdBin, seqBin, tsBin, typeBin, payloadBin, prevHashBin, hashBin);

        Key headKey = new Key(namespace, AerospikeConfig.SET_LEDGER_HEAD, HEAD_KEY);
        client.put(writePolicy, headKey,
                new Bin("seq", entry.getSequence()),
                new Bin("hash", entry.getHash()));
    }

    public LedgerEntry findBySequence(long sequence) {
        Key key = new Key(namespace, AerospikeConfig.SET_LEDGER_ENTRIES, sequence);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Newest entry. The head record can trail the entries by one write after a
     * crash or a failed write, so read forward from it until the next sequence is absent.
     */
    public LedgerEntry findLast() {
        Key headKey = new Key(namespace, AerospikeConfig.SET_LEDGER_HEAD, HEAD_KEY);
        Record head = client.get(readPolicy, headKey);
        long seq = head == null ? -1 : head.getLong("seq");

        LedgerEntry last = seq >= 0 ? findBySequence(seq) : null;
        LedgerEntry next = findBySequence(seq + 1);
        while (next != null) {
            last = next;
            seq++;
            next = findBySequence(seq + 1);
        }
        return last;
    }

    /**
     * Entries with sequence in [fromSequence, fromSequence + limit), in order.
     * Missing sequences are skipped, so callers must check continuity themselves.
     */
    public List<LedgerEntry> findRange(long fromSequence, int limit) {
        if (limit <= 0) return Collections.emptyList();
        Key[] keys = new Key[limit];
        for (int i = 0; i < limit; i++) {
            keys[i] = new Key(namespace, AerospikeConfig.SET_LEDGER_ENTRIES, fromSequence + i);
        }
        Record[] records = client.get(null, keys);
        List<LedgerEntry> entries = new ArrayList<>(limit);
        for (Record record : records) {
            if (record != null) {
                entries.add(mapRecord(record));
            }
        }
        return entries;
    }

    /** Every entry up to and including {@code lastSequence}, in sequence order. */
    public List<LedgerEntry> findAllUpTo(long lastSequence) {
        List<LedgerEntry> entries = new ArrayList<>();
        for (long from = 0; from <= lastSequence; from += BATCH_SIZE) {
            int size = (int) Math.min(BATCH_SIZE, lastSequence - from + 1);
            entries.addAll(findRange(from, size));
        }
        return entries;
    }

    private LedgerEntry mapRecord(Record record) {
        return LedgerEntry.builder()
                .entryId(record.getString("entryId"))
                .sequence(record.getLong("seq"))
                .timestamp(record.getLong("ts"))
                .entryType(record.getString("entryType"))
                .payload(deserializePayload(record.getString("payload")))
                .previousHash(record.getString("prevHash"))
                .hash(record.getString("hash"))
                .build();
    }

    private Map<String, Object> deserializePayload(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            // surfaces as a hash mismatch on the next verification
            log.error("Failed to deserialize ledger payload", e);
            return Collections.emptyMap();
        }
    }
}
