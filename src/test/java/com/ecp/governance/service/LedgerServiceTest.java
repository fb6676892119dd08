package com.ecp.governance.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.exception.IntegrityViolationException;
import com.ecp.governance.exception.LedgerAppendInDoubtException;
import com.ecp.governance.model.ConsistencyError;
import com.ecp.governance.model.IntegrityReport;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.repository.LedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    @Mock private LedgerRepository ledgerRepo;
    @Mock private MetricsConfig metricsConfig;

    private final List<LedgerEntry> store = Collections.synchronizedList(new ArrayList<>());
    private LedgerService service;

    @BeforeEach
    void setUp() {
        lenient().doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            return null;
        }).when(ledgerRepo).save(any(LedgerEntry.class));
        lenient().when(ledgerRepo.findAllUpTo(anyLong())).thenAnswer(inv -> snapshot());
        lenient().when(ledgerRepo.findLast()).thenAnswer(inv -> {
            List<LedgerEntry> entries = snapshot();
            return entries.isEmpty() ? null : entries.get(entries.size() - 1);
        });
        lenient().when(ledgerRepo.findRange(anyLong(), anyInt())).thenAnswer(inv -> {
            long from = inv.getArgument(0);
            int limit = inv.getArgument(1);
            return snapshot().stream()
                    .filter(e -> e.getSequence() >= from && e.getSequence() < from + limit)
                    .toList();
        });

        service = new LedgerService(ledgerRepo, metricsConfig);
        service.loadHead();
    }

    @Test
    void append_firstEntryLinksToGenesis() {
        LedgerEntry entry = service.append("decision_event", Map.of("eventId", "evt_1"), "evt_1");

        assertThat(entry.getSequence()).isZero();
        assertThat(entry.getPreviousHash()).isEqualTo(LedgerHasher.GENESIS_HASH);
        assertThat(entry.getEntryId()).isEqualTo("evt_1");
        assertThat(entry.getHash()).hasSize(64).isNotEqualTo(LedgerHasher.GENESIS_HASH);
        verify(metricsConfig).recordLedgerAppend("decision_event");
    }

    @Test
    void append_chainsEachEntryToThePrevious() {
        LedgerEntry first = service.append("decision_event", Map.of("n", 1));
        LedgerEntry second = service.append("classification_recorded", Map.of("n", 2));
        LedgerEntry third = service.append("human_ruling", Map.of("n", 3));

        assertThat(second.getPreviousHash()).isEqualTo(first.getHash());
        assertThat(third.getPreviousHash()).isEqualTo(second.getHash());
        assertThat(third.getSequence()).isEqualTo(2);
        assertThat(third.getEntryId()).isEqualTo("led_2");
        assertThat(service.getLastEntry()).contains(third);
    }

    @Test
    void append_hashMatchesRecomputation() {
        LedgerEntry entry = service.append("decision_event", Map.of("b", 2, "a", List.of(1, 2)));

        String recomputed = LedgerHasher.entryHash(new com.fasterxml.jackson.databind.ObjectMapper(),
                entry.getTimestamp(), entry.getEntryType(), entry.getPayload(), entry.getPreviousHash());
        assertThat(entry.getHash()).isEqualTo(recomputed);
    }

    @Test
    void append_blankEntryType_throws() {
        assertThatThrownBy(() -> service.append(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(ledgerRepo, never()).save(any());
    }

    @Test
    void append_saveFails_headUnchanged() {
        LedgerEntry first = service.append("decision_event", Map.of("n", 1));
        doThrow(new RuntimeException("store down")).when(ledgerRepo).save(any(LedgerEntry.class));

        assertThatThrownBy(() -> service.append("decision_event", Map.of("n", 2)))
                .hasMessage("store down");
        assertThat(service.getLastEntry()).contains(first);
    }

    @Test
    void append_entryStoredButHeadWriteFails_returnsEntryAndChainContinues() {
        service.append("decision_event", Map.of("n", 1));
        doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            throw new AerospikeException(ResultCode.TIMEOUT, "head write timed out");
        }).doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            return null;
        }).when(ledgerRepo).save(any(LedgerEntry.class));

        LedgerEntry second = service.append("decision_event", Map.of("n", 2));
        LedgerEntry third = service.append("decision_event", Map.of("n", 3));

        assertThat(second.getSequence()).isEqualTo(1);
        assertThat(third.getSequence()).isEqualTo(2);
        assertThat(third.getPreviousHash()).isEqualTo(second.getHash());
        assertThat(service.verifyIntegrity().valid()).isTrue();
    }

    @Test
    void append_failedWriteWithOtherEntryAtSequence_rethrowsAndRelinks() {
        service.append("decision_event", Map.of("n", 1));
        LedgerEntry lateWrite = LedgerEntry.builder()
                .entryId("led_1").sequence(1).timestamp(System.currentTimeMillis()).entryType("decision_event")
                .payload(Map.of("n", 2)).previousHash(store.get(0).getHash()).hash("c".repeat(64))
                .build();
        doAnswer(inv -> {
            store.add(lateWrite);
            throw new AerospikeException(ResultCode.TIMEOUT, "write timed out");
        }).doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            return null;
        }).when(ledgerRepo).save(any(LedgerEntry.class));

        assertThatThrownBy(() -> service.append("decision_event", Map.of("n", 2)))
                .hasMessageContaining("write timed out");
        LedgerEntry next = service.append("decision_event", Map.of("n", 3));

        assertThat(next.getSequence()).isEqualTo(2);
        assertThat(next.getPreviousHash()).isEqualTo("c".repeat(64));
    }

    @Test
    void append_failureAndHeadUnreadable_isInDoubtThenReloadsBeforeNextAppend() {
        service.append("decision_event", Map.of("n", 1));
        doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            throw new AerospikeException(ResultCode.TIMEOUT, "write timed out");
        }).doAnswer(inv -> {
            storeCreateOnly(inv.getArgument(0));
            return null;
        }).when(ledgerRepo).save(any(LedgerEntry.class));
        when(ledgerRepo.findLast())
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "read timed out"))
                .thenAnswer(inv -> store.get(store.size() - 1));

        assertThatThrownBy(() -> service.append("decision_event", Map.of("n", 2)))
                .isInstanceOf(LedgerAppendInDoubtException.class)
                .satisfies(ex -> assertThat(((LedgerAppendInDoubtException) ex).getSequence()).isEqualTo(1));

        LedgerEntry next = service.append("decision_event", Map.of("n", 3));

        assertThat(next.getSequence()).isEqualTo(2);
        assertThat(next.getPreviousHash()).isEqualTo(store.get(1).getHash());
        assertThat(service.verifyIntegrity().valid()).isTrue();
    }

    @Test
    void append_concurrentWriters_produceGaplessValidChain() throws Exception {
        int writers = 16;
        int perWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    service.append("decision_event", Map.of("writer", writer, "n", i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        int total = writers * perWriter;
        assertThat(snapshot()).extracting(LedgerEntry::getSequence)
                .containsExactlyElementsOf(LongStream.range(0, total).boxed().toList());
        assertThat(service.getLastEntry()).map(LedgerEntry::getSequence).contains((long) total - 1);
        IntegrityReport report = service.verifyIntegrity();
        assertThat(report.valid()).isTrue();
        assertThat(report.entriesChecked()).isEqualTo(total);
    }

    @Test
    void findEntrySince_findsEntryById() {
        service.append("decision_event", Map.of("n", 1), "evt_a");
        service.append("classification_recorded", Map.of("eventId", "evt_b"));
        service.append("decision_event", Map.of("n", 2), "evt_b");

        assertThat(service.findEntrySince("decision_event", "evt_b", 0))
                .map(LedgerEntry::getSequence).contains(2L);
        assertThat(service.findEntrySince("decision_event", "evt_a", 0))
                .map(LedgerEntry::getSequence).contains(0L);
    }

    @Test
    void findEntrySince_stopsAtEntriesOlderThanTheBound() {
        service.append("decision_event", Map.of("n", 1), "evt_a");
        LedgerEntry newest = service.append("decision_event", Map.of("n", 2), "evt_b");

        assertThat(service.findEntrySince("decision_event", "evt_a", newest.getTimestamp() + 1)).isEmpty();
        assertThat(service.findEntrySince("decision_event", "evt_missing", 0)).isEmpty();
    }

    @Test
    void loadHead_continuesExistingChain() {
        LedgerEntry existing = LedgerEntry.builder()
                .entryId("led_4").sequence(4).timestamp(1L).entryType("decision_event")
                .payload(Map.of()).previousHash("a".repeat(64)).hash("b".repeat(64))
                .build();
        when(ledgerRepo.findLast()).thenReturn(existing);
        service.loadHead();

        LedgerEntry next = service.append("decision_event", Map.of("n", 5));

        assertThat(next.getSequence()).isEqualTo(5);
        assertThat(next.getPreviousHash()).isEqualTo("b".repeat(64));
    }

    @Test
    void verifyIntegrity_emptyLedger_isValid() {
        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.valid()).isTrue();
        assertThat(report.entriesChecked()).isZero();
    }

    @Test
    void verifyIntegrity_untouchedChain_isValid() {
        appendThree();

        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.valid()).isTrue();
        assertThat(report.entriesChecked()).isEqualTo(3);
    }

    @Test
    void verifyIntegrity_modifiedPayload_reportsHashMismatch() {
        appendThree();
        LedgerEntry original = store.get(1);
        Map<String, Object> tampered = new HashMap<>(original.getPayload());
        tampered.put("n", 99);
        store.set(1, copyWith(original, tampered, original.getPreviousHash()));

        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.valid()).isFalse();
        assertThat(report.failureType()).isEqualTo(IntegrityReport.FailureType.HASH_MISMATCH);
        assertThat(report.failedSequence()).isEqualTo(1L);
    }

    @Test
    void verifyIntegrity_deletedEntry_reportsChainLinkBreak() {
        appendThree();
        store.remove(1);

        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.valid()).isFalse();
        assertThat(report.failureType()).isEqualTo(IntegrityReport.FailureType.CHAIN_LINK_BREAK);
        assertThat(report.failedSequence()).isEqualTo(1L);
    }

    @Test
    void verifyIntegrity_reorderedEntries_reportsChainLinkBreak() {
        appendThree();
        LedgerEntry moved = store.remove(2);
        store.add(1, moved);

        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.failureType()).isEqualTo(IntegrityReport.FailureType.CHAIN_LINK_BREAK);
    }

    @Test
    void verifyIntegrity_alteredGenesisLink_reportsChainLinkBreak() {
        appendThree();
        LedgerEntry first = store.get(0);
        store.set(0, copyWith(first, first.getPayload(), "f".repeat(64)));

        IntegrityReport report = service.verifyIntegrity();

        assertThat(report.failureType()).isEqualTo(IntegrityReport.FailureType.CHAIN_LINK_BREAK);
        assertThat(report.failedSequence()).isZero();
    }

    @Test
    void collectChainErrors_reportsEveryTamperedEntry() {
        appendThree();
        store.set(0, copyWith(store.get(0), Map.of("n", 10), store.get(0).getPreviousHash()));
        store.set(2, copyWith(store.get(2), Map.of("n", 30), store.get(2).getPreviousHash()));

        List<ConsistencyError> errors = service.collectChainErrors();

        assertThat(errors).hasSize(2);
        assertThat(errors).allMatch(e -> "critical".equals(e.severity()));
        assertThat(errors).extracting(ConsistencyError::referenceId).containsExactly("0", "2");
    }

    @Test
    void requireIntegrity_brokenChain_throws() {
        appendThree();
        store.remove(2);

        assertThatThrownBy(() -> service.requireIntegrity())
                .isInstanceOf(IntegrityViolationException.class)
                .hasMessageContaining("CHAIN_LINK_BREAK");
    }

    @Test
    void getEntries_capsLimit() {
        when(ledgerRepo.findRange(0, 500)).thenReturn(List.of());

        service.getEntries(0, 10_000);

        verify(ledgerRepo).findRange(0, 500);
    }

    private void storeCreateOnly(LedgerEntry entry) {
        synchronized (store) {
            if (store.stream().anyMatch(e -> e.getSequence() == entry.getSequence())) {
                throw new AerospikeException(ResultCode.KEY_EXISTS_ERROR);
            }
            store.add(entry);
        }
    }

    private List<LedgerEntry> snapshot() {
        synchronized (store) {
            return new ArrayList<>(store);
        }
    }

    private void appendThree() {
        service.append("decision_event", Map.of("n", 1));
        service.append("decision_event", Map.of("n", 2));
        service.append("decision_event", Map.of("n", 3));
    }

    private LedgerEntry copyWith(LedgerEntry e, Map<String, Object> payload, String previousHash) {
        return LedgerEntry.builder()
                .entryId(e.getEntryId())
                .sequence(e.getSequence())
                .timestamp(e.getTimestamp())
                .entryType(e.getEntryType())
                .payload(payload)
                .previousHash(previousHash)
                .hash(e.getHash())
                .build();
    }
}
