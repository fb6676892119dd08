package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.Severity;
import com.ecp.governance.model.Violation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Violations are written create-only and never updated. Query indexes by
 * severity, agent and type are held in memory and rebuilt from a scan at startup.
 * A failed scan is retried on a fixed delay until one succeeds.
 */
@Repository
public class ViolationRepository {

    private static final Logger log = LoggerFactory.getLogger(ViolationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    private final Map<String, Violation> byId = new ConcurrentHashMap<>();
    private final Map<Severity, List<Violation>> bySeverity = new ConcurrentHashMap<>();
    private final Map<String, List<Violation>> byAgent = new ConcurrentHashMap<>();
    private final Map<String, List<Violation>> byType = new ConcurrentHashMap<>();

    private volatile boolean indexesLoaded;

    public ViolationRepository(AerospikeClient client,
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
    public void loadIndexes() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        List<Violation> loaded = new ArrayList<>();

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_VIOLATIONS,
                    (key, record) -> {
                        try {
                            synchronized (loaded) {
                                loaded.add(mapRecord(record));
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read violation record: {}", e.getMessage());
                        }
                    });
        } catch (Exception e) {
            log.error("Failed to load violation indexes, retrying on the next refresh", e);
            return;
        }

        // merges with violations saved since startup; index() skips ids already present
        loaded.sort(Comparator.comparingLong(Violation::getTimestamp));
        loaded.forEach(this::index);
        indexesLoaded = true;
        log.info("Violation indexes loaded, {} violations", loaded.size());
    }

    @Scheduled(fixedDelayString = "${governance.violations.index-retry-seconds:30}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${governance.violations.index-retry-seconds:30}")
    public void retryIndexLoad() {
        if (!indexesLoaded) {
            loadIndexes();
        }
    }

    public boolean isIndexesLoaded() {
        return indexesLoaded;
    }

    public void save(Violation violation) {
        Key key = new Key(namespace, AerospikeConfig.SET_VIOLATIONS, violation.getViolationId());

        client.put(createOnlyPolicy, key,
                new Bin("violationId", violation.getViolationId()),
                new Bin("type", violation.getViolationType()),
                new Bin("severity", violation.getSeverity().name()),
                new Bin("message", violation.getMessage()),
                new Bin("ts", violation.getTimestamp()),
                new Bin("agentId", violation.getAgentId()),
                new Bin("function", violation.getFunctionName()),
                new Bin("stackTrace", violation.getStackTrace()),
                new Bin("context", serializeContext(violation.getContext())));

        index(violation);
    }

    public Violation findById(String violationId) {
        Violation cached = byId.get(violationId);
        if (cached != null) return cached;

        Key key = new Key(namespace, AerospikeConfig.SET_VIOLATIONS, violationId);
        Record record = client.get(readPolicy, key);
        return record == null ? null : mapRecord(record);
    }

    public List<Violation> findBySeverity(Severity severity) {
        return copyOf(bySeverity.get(severity));
    }

    public List<Violation> findByAgent(String agentId) {
        return copyOf(byAgent.get(agentId));
    }

    public List<Violation> findByType(String violationType) {
        return copyOf(byType.get(violationType));
    }

    public List<Violation> findSince(long sinceMillis) {
        List<Violation> results = new ArrayList<>();
        for (Violation v : byId.values()) {
            if (v.getTimestamp() >= sinceMillis) {
                results.add(v);
            }
        }
        results.sort(Comparator.comparingLong(Violation::getTimestamp));
        return results;
    }

    public Collection<Violation> findAll() {
        List<Violation> all = new ArrayList<>(byId.values());
        all.sort(Comparator.comparingLong(Violation::getTimestamp));
        return all;
    }

    private void index(Violation violation) {
        if (byId.putIfAbsent(violation.getViolationId(), violation) != null) {
            return;
        }
        bySeverity.computeIfAbsent(violation.getSeverity(), k -> new CopyOnWriteArrayList<>()).add(violation);
        if (violation.getAgentId() != null) {
            byAgent.computeIfAbsent(violation.getAgentId(), k -> new CopyOnWriteArrayList<>()).add(violation);
        }
        byType.computeIfAbsent(violation.getViolationType(), k -> new CopyOnWriteArrayList<>()).add(violation);
    }

    private List<Violation> copyOf(List<Violation> list) {
        if (list == null) return Collections.emptyList();
        List<Violation> copy = new ArrayList<>(list);
        copy.sort(Comparator.comparingLong(Violation::getTimestamp));
        return copy;
    }

    private String serializeContext(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context != null ? context : Collections.emptyMap());
        } catch (Exception e) {
            log.error("Failed to serialize violation context", e);
            return "{}";
        }
    }

    private Violation mapRecord(Record record) {
        Map<String, Object> context = Collections.emptyMap();
        String contextJson = record.getString("context");
        if (contextJson != null && !contextJson.isEmpty()) {
            try {
                context = objectMapper.readValue(contextJson, new TypeReference<Map<String, Object>>() {});
            } catch (Exception e) {
                log.warn("Failed to deserialize violation context: {}", e.getMessage());
            }
        }

        return Violation.builder()
                .violationId(record.getString("violationId"))
                .violationType(record.getString("type"))
                .severity(Severity.valueOf(record.getString("severity")))
                .message(record.getString("message"))
                .timestamp(record.getLong("ts"))
                .agentId(record.getString("agentId"))
                .functionName(record.getString("function"))
                .stackTrace(record.getString("stackTrace"))
                .context(context)
                .build();
    }
}
