package com.ecp.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.model.Severity;
import com.ecp.governance.model.Violation;
import com.ecp.governance.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ViolationRepositoryTest {

    private static final String NAMESPACE = "ecp";

    @Mock private AerospikeClient client;

    private ViolationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ViolationRepository(client, NAMESPACE, new WritePolicy(), new Policy());
    }

    @Test
    void loadIndexes_scanFails_retriedUntilLoaded() {
        long now = System.currentTimeMillis();
        Violation savedDuringOutage = TestDataFactory.createViolation("vio_new", "replay_attempt",
                Severity.WARNING, "agent-1", now);
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "scan timed out"))
                .doAnswer(inv -> {
                    ScanCallback callback = inv.getArgument(3);
                    callback.scanCallback(key("vio_old"), record("vio_old", "missing_context", "AUDIT", now - 60_000));
                    callback.scanCallback(key("vio_new"), record("vio_new", "replay_attempt", "WARNING", now));
                    return null;
                })
                .when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_VIOLATIONS),
                        any(ScanCallback.class));

        repository.loadIndexes();
        assertThat(repository.isIndexesLoaded()).isFalse();

        repository.save(savedDuringOutage);
        assertThat(repository.findAll()).extracting(Violation::getViolationId).containsExactly("vio_new");

        repository.retryIndexLoad();

        assertThat(repository.isIndexesLoaded()).isTrue();
        assertThat(repository.findAll()).extracting(Violation::getViolationId).containsExactly("vio_old", "vio_new");
        assertThat(repository.findBySeverity(Severity.WARNING)).hasSize(1);
        assertThat(repository.findByAgent("agent-1")).extracting(Violation::getViolationId)
                .containsExactly("vio_old", "vio_new");
    }

    @Test
    void retryIndexLoad_afterSuccessfulLoad_doesNotScanAgain() {
        repository.loadIndexes();
        repository.retryIndexLoad();

        assertThat(repository.isIndexesLoaded()).isTrue();
        verify(client, times(1)).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));
    }

    private Key key(String violationId) {
        return new Key(NAMESPACE, AerospikeConfig.SET_VIOLATIONS, violationId);
    }

    private Record record(String violationId, String type, String severity, long timestamp) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("violationId", violationId);
        bins.put("type", type);
        bins.put("severity", severity);
        bins.put("message", "test");
        bins.put("ts", timestamp);
        bins.put("agentId", "agent-1");
        bins.put("function", "enforceDecision");
        bins.put("context", "{}");
        return new Record(bins, 1, 0);
    }
}
