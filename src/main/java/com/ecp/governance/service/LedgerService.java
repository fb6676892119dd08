package com.ecp.governance.service;

import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.exception.IntegrityViolationException;
import com.ecp.governance.exception.LedgerAppendInDoubtException;
import com.ecp.governance.model.ConsistencyError;
import com.ecp.governance.model.IntegrityReport;
import com.ecp.governance.model.IntegrityReport.FailureType;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.repository.LedgerRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained ledger. All appends go through one lock, so the
 * in-memory head is always the entry the next append links to.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    static final String CHECK_NAME = "chain_integrity";
    static final String CRITICAL = "critical";
    private static final int SEARCH_PAGE = 100;

    private final LedgerRepository ledgerRepo;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ReentrantLock commitLock = new ReentrantLock();
    private volatile LedgerEntry head;
    // set when a failed write left the store state unknown; cleared by the next successful reload
    private volatile boolean headStale;

    public LedgerService(LedgerRepository ledgerRepo, MetricsConfig metricsConfig) {
        this.ledgerRepo = ledgerRepo;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void loadHead() {
        head = ledgerRepo.findLast();
        if (head == null) {
            log.info("Ledger is empty, next entry links to genesis");
        } else {
            log.info("Ledger head loaded: sequence={}, hash={}", head.getSequence(), head.getHash());
        }
    }

    public LedgerEntry append(String entryType, Map<String, Object> payload) {
        return append(entryType, payload, null);
    }

    /**
     * Append a new entry linked to the current head.
     *
     * @param entryId id of the record carried by the entry; {@code led_<sequence>} when null
     * @throws LedgerAppendInDoubtException if the write failed and the store could not be read back
     */
    @Observed(name = "ledger.append", contextualName = "ledger-append")
    public LedgerEntry append(String entryType, Map<String, Object> payload, String entryId) {
        if (entryType == null || entryType.isBlank()) {
            throw new IllegalArgumentException("entryType is required");
        }
        // stored payload is read back from canonical JSON, so hash exactly that form
        Map<String, Object> canonicalPayload = canonicalCopy(payload);

        commitLock.lock();
        try {
            if (headStale) {
                head = ledgerRepo.findLast();
                headStale = false;
                log.info("Ledger head reloaded after an earlier failed write: {}",
                        head == null ? "empty" : head.getSequence());
            }
            long sequence = head == null ? 0 : head.getSequence() + 1;
            String previousHash = head == null ? LedgerHasher.GENESIS_HASH : head.getHash();
            long timestamp = System.currentTimeMillis();
            String hash = LedgerHasher.entryHash(objectMapper, timestamp, entryType, canonicalPayload, previousHash);

            LedgerEntry entry = LedgerEntry.builder()
                    .entryId(entryId != null ? entryId : "led_" + sequence)
                    .sequence(sequence)
                    .timestamp(timestamp)
                    .entryType(entryType)
                    .payload(canonicalPayload)
                    .previousHash(previousHash)
                    .hash(hash)
                    .build();

            try {
                ledgerRepo.save(entry);
            } catch (RuntimeException e) {
                LedgerEntry stored = reloadAfterFailedSave(entry, e);
                if (stored == null || stored.getSequence() != sequence || !hash.equals(stored.getHash())) {
                    throw e;
                }
                log.warn("Ledger entry {} was stored but the write reported a failure: {}", sequence, e.getMessage());
            }
            head = entry;

            metricsConfig.recordLedgerAppend(entryType);
            log.debug("Ledger append: seq={}, type={}, id={}", sequence, entryType, entry.getEntryId());
            return entry;
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Re-read the newest entry from the store. If that fails too, the next
     * append reloads before it links anything.
     */
    private LedgerEntry reloadAfterFailedSave(LedgerEntry attempted, RuntimeException cause) {
        try {
            head = ledgerRepo.findLast();
            headStale = false;
            return head;
        } catch (RuntimeException reloadFailure) {
            headStale = true;
            cause.addSuppressed(reloadFailure);
            log.error("Ledger append at sequence {} is in doubt, head could not be reloaded", attempted.getSequence());
            throw new LedgerAppendInDoubtException(attempted.getSequence(), cause);
        }
    }

    /**
     * Find an entry by type and id, searching back from the newest stored
     * entry. Entries older than {@code sinceMillis} end the search.
     */
    public Optional<LedgerEntry> findEntrySince(String entryType, String entryId, long sinceMillis) {
        LedgerEntry last = ledgerRepo.findLast();
        if (last == null) return Optional.empty();

        long to = last.getSequence() + 1;
        while (to > 0) {
            long from = Math.max(0, to - SEARCH_PAGE);
            List<LedgerEntry> page = ledgerRepo.findRange(from, (int) (to - from));
            for (int i = page.size() - 1; i >= 0; i--) {
                LedgerEntry entry = page.get(i);
                if (entryType.equals(entry.getEntryType()) && entryId.equals(entry.getEntryId())) {
                    return Optional.of(entry);
                }
                if (entry.getTimestamp() < sinceMillis) {
                    return Optional.empty();
                }
            }
            to = from;
        }
        return Optional.empty();
    }

    public Optional<LedgerEntry> getLastEntry() {
        return Optional.ofNullable(head);
    }

    public Optional<LedgerEntry> getEntry(long sequence) {
        if (sequence < 0) return Optional.empty();
        return Optional.ofNullable(ledgerRepo.findBySequence(sequence));
    }

    public List<LedgerEntry> getEntries(long fromSequence, int limit) {
        if (fromSequence < 0) {
            throw new IllegalArgumentException("fromSequence must be >= 0");
        }
        return ledgerRepo.findRange(fromSequence, Math.min(Math.max(limit, 0), 500));
    }

    /**
     * Walk the chain from the first entry and stop at the first broken link or
     * hash. A recomputed hash that differs is content tampering; a sequence gap
     * or a previousHash that does not match is a chain break.
     */
    @Observed(name = "ledger.verify", contextualName = "ledger-verify")
    public IntegrityReport verifyIntegrity() {
        LedgerEntry last = head;
        if (last == null) {
            return IntegrityReport.intact(0);
        }

        List<LedgerEntry> entries = ledgerRepo.findAllUpTo(last.getSequence());
        String expectedPrevious = LedgerHasher.GENESIS_HASH;
        for (int i = 0; i < entries.size(); i++) {
            LedgerEntry entry = entries.get(i);
            if (entry.getSequence() != i) {
                return broken(i, FailureType.CHAIN_LINK_BREAK, i,
                        "Expected sequence " + i + " but found " + entry.getSequence());
            }
            if (!expectedPrevious.equals(entry.getPreviousHash())) {
                return broken(i, FailureType.CHAIN_LINK_BREAK, entry.getSequence(),
                        "previousHash does not match the hash of the preceding entry");
            }
            if (!recomputeHash(entry).equals(entry.getHash())) {
                return broken(i, FailureType.HASH_MISMATCH, entry.getSequence(),
                        "Stored hash does not match entry content");
            }
            expectedPrevious = entry.getHash();
        }

        if (entries.size() != last.getSequence() + 1) {
            return broken(entries.size(), FailureType.CHAIN_LINK_BREAK, entries.size(),
                    "Entry " + entries.size() + " is missing");
        }
        return IntegrityReport.intact(entries.size());
    }

    /**
     * @throws IntegrityViolationException if the chain does not verify
     */
    public IntegrityReport requireIntegrity() {
        IntegrityReport report = verifyIntegrity();
        if (!report.valid()) {
            throw new IntegrityViolationException(report);
        }
        return report;
    }

    /** Same checks as {@link #verifyIntegrity()}, collecting every failure. */
    public List<ConsistencyError> collectChainErrors() {
        List<ConsistencyError> errors = new ArrayList<>();
        LedgerEntry last = head;
        if (last == null) return errors;

        List<LedgerEntry> entries = ledgerRepo.findAllUpTo(last.getSequence());
        long expectedSequence = 0;
        String expectedPrevious = LedgerHasher.GENESIS_HASH;
        for (LedgerEntry entry : entries) {
            String ref = String.valueOf(entry.getSequence());
            if (entry.getSequence() != expectedSequence) {
                errors.add(new ConsistencyError(CHECK_NAME, CRITICAL, ref,
                        "CHAIN_LINK_BREAK: entries " + expectedSequence + ".." + (entry.getSequence() - 1) + " missing"));
            } else if (!expectedPrevious.equals(entry.getPreviousHash())) {
                errors.add(new ConsistencyError(CHECK_NAME, CRITICAL, ref,
                        "CHAIN_LINK_BREAK: previousHash does not match the preceding entry"));
            }
            if (!recomputeHash(entry).equals(entry.getHash())) {
                errors.add(new ConsistencyError(CHECK_NAME, CRITICAL, ref,
                        "HASH_MISMATCH: stored hash does not match entry content"));
            }
            expectedSequence = entry.getSequence() + 1;
            expectedPrevious = entry.getHash();
        }
        if (expectedSequence <= last.getSequence()) {
            errors.add(new ConsistencyError(CHECK_NAME, CRITICAL, String.valueOf(expectedSequence),
                    "CHAIN_LINK_BREAK: entries " + expectedSequence + ".." + last.getSequence() + " missing"));
        }
        return errors;
    }

    private String recomputeHash(LedgerEntry entry) {
        return LedgerHasher.entryHash(objectMapper, entry.getTimestamp(), entry.getEntryType(),
                entry.getPayload(), entry.getPreviousHash());
    }

    private IntegrityReport broken(long checked, FailureType type, long sequence, String detail) {
        log.error("Ledger integrity failure at sequence {}: {} ({})", sequence, type, detail);
        return IntegrityReport.broken(checked, type, sequence, detail);
    }

    private Map<String, Object> canonicalCopy(Map<String, Object> payload) {
        String json = LedgerHasher.canonicalize(objectMapper, payload);
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            throw new IllegalArgumentException("Ledger payload is not a JSON object", e);
        }
    }
}
