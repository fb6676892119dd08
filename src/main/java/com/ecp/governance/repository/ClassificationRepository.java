package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.RiskEstimate;
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
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live classifications keyed by (eventId, classifierId) and an archive of superseded
 * versions keyed by (eventId, classifierId, version). An in-memory index maps each
 * event to its classifier ids so reads never scan the set.
 */
@Repository
public class ClassificationRepository {

    private static final Logger log = LoggerFactory.getLogger(ClassificationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // eventId -> classifierIds with a live classification
    private final Map<String, Set<String>> classifiersByEvent = new ConcurrentHashMap<>();

    public ClassificationRepository(AerospikeClient client,
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

    @PostConstruct
    public void rebuildIndex() {
        classifiersByEvent.clear();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CLASSIFICATIONS,
                (key, record) -> {
                    try {
                        indexClassifier(record.getString("eventId"), record.getString("classifierId"));
                    } catch (Exception e) {
                        log.warn("Failed to index classification record: {}", e.getMessage());
                    }
                });
        log.info("Classification index rebuilt, {} events indexed", classifiersByEvent.size());
    }

    public static String liveKey(String eventId, String classifierId) {
        return eventId + "::" + classifierId;
    }

    public static String archiveKey(String eventId, String classifierId, int version) {
        return eventId + ":" + classifierId + ":v" + version;
    }

    public void save(Classification classification) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLASSIFICATIONS,
                liveKey(classification.getEventId(), classification.getClassifierId()));
        client.put(writePolicy, key, toBins(classification));
        indexClassifier(classification.getEventId(), classification.getClassifierId());
    }

    /** Archived versions are permanent; re-archiving the same version fails. */
    public void archive(Classification superseded) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLASSIFICATION_ARCHIVE,
                archiveKey(superseded.getEventId(), superseded.getClassifierId(), superseded.getVersion()));
        client.put(createOnlyPolicy, key, toBins(superseded));
    }

    public Classification find(String eventId, String classifierId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLASSIFICATIONS, liveKey(eventId, classifierId));
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Classification> findByEventId(String eventId) {
        Set<String> classifierIds = classifiersByEvent.getOrDefault(eventId, Collections.emptySet());
        if (classifierIds.isEmpty()) return Collections.emptyList();

        List<String> ids = new ArrayList<>(classifierIds);
        Key[] keys = new Key[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            keys[i] = new Key(namespace, AerospikeConfig.SET_CLASSIFICATIONS, liveKey(eventId, ids.get(i)));
        }
        Record[] records = client.get(null, keys);

        List<Classification> results = new ArrayList<>();
        for (Record record : records) {
            if (record != null) {
                results.add(mapRecord(record));
            }
        }
        results.sort(Comparator.comparing(Classification::getClassifierId));
        return results;
    }

    /** Superseded versions 1..(currentVersion - 1), oldest first. */
    public List<Classification> findArchived(String eventId, String classifierId, int currentVersion) {
        if (currentVersion <= 1) return Collections.emptyList();
        Key[] keys = new Key[currentVersion - 1];
        for (int v = 1; v < currentVersion; v++) {
            keys[v - 1] = new Key(namespace, AerospikeConfig.SET_CLASSIFICATION_ARCHIVE,
                    archiveKey(eventId, classifierId, v));
        }
        Record[] records = client.get(null, keys);
        List<Classification> results = new ArrayList<>();
        for (Record record : records) {
            if (record != null) {
                results.add(mapRecord(record));
            }
        }
        return results;
    }

    /** Snapshot of the index, eventId -> classifierIds. */
    public Map<String, Set<String>> indexSnapshot() {
        Map<String, Set<String>> copy = new ConcurrentHashMap<>();
        classifiersByEvent.forEach((eventId, ids) -> copy.put(eventId, Set.copyOf(ids)));
        return copy;
    }

    private void indexClassifier(String eventId, String classifierId) {
        if (eventId == null || classifierId == null) return;
        classifiersByEvent.computeIfAbsent(eventId, k -> ConcurrentHashMap.newKeySet()).add(classifierId);
    }

    private Bin[] toBins(Classification c) {
        return new Bin[] {
                new Bin("eventId", c.getEventId()),
                new Bin("classifierId", c.getClassifierId()),
                new Bin("status", c.getEthicalStatus().name()),
                new Bin("confidence", c.getConfidence()),
                new Bin("risk", c.getRiskEstimate().name()),
                new Bin("reasoning", c.getReasoning() != null ? c.getReasoning() : ""),
                new Bin("constraints", serializeList(c.getConstraints())),
                new Bin("selfClass", c.isSelfClassification()),
                new Bin("version", c.getVersion()),
                new Bin("ts", c.getTimestamp()),
                new Bin("archivedAt", c.getArchivedAt())
        };
    }

    private Classification mapRecord(Record record) {
        String reasoning = record.getString("reasoning");
        return Classification.builder()
                .eventId(record.getString("eventId"))
                .classifierId(record.getString("classifierId"))
                .ethicalStatus(EthicalStatus.valueOf(record.getString("status")))
                .confidence(record.getDouble("confidence"))
                .riskEstimate(RiskEstimate.valueOf(record.getString("risk")))
                .reasoning(reasoning != null && !reasoning.isEmpty() ? reasoning : null)
                .constraints(deserializeList(record.getString("constraints")))
                .selfClassification(record.getBoolean("selfClass"))
                .version(record.getInt("version"))
                .timestamp(record.getLong("ts"))
                .archivedAt(record.getLong("archivedAt"))
                .build();
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize list", e);
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize list", e);
            return Collections.emptyList();
        }
    }
}
