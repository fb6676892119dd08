package com.ecp.governance.service;

import com.ecp.governance.exception.ConsistencyException;
import com.ecp.governance.model.Classification;
import com.ecp.governance.repository.ClassificationRepository;
import com.ecp.governance.repository.DecisionEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Write-time preconditions. Records that point at an event may only be
 * written once the event is in the ledger, and a classification update
 * archives the version it replaces.
 */
@Component
public class ConsistencyGuard {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyGuard.class);

    private final DecisionEventRepository decisionEventRepo;
    private final ClassificationRepository classificationRepo;

    private static final int LOCK_STRIPES = 64;

    // (eventId, classifierId) keys hash onto a fixed set of locks
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public ConsistencyGuard(DecisionEventRepository decisionEventRepo,
                            ClassificationRepository classificationRepo) {
        this.decisionEventRepo = decisionEventRepo;
        this.classificationRepo = classificationRepo;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public void requireEvent(String eventId) {
        if (eventId == null || decisionEventRepo.findSequence(eventId) == null) {
            throw new ConsistencyException("Event " + eventId + " does not exist in the ledger");
        }
    }

    /**
     * Store a classification as the next version for its (event, classifier)
     * pair, archiving the current version first.
     *
     * @return the stored version
     */
    public Classification writeClassification(Classification draft) {
        return writeClassification(draft, next -> { });
    }

    /**
     * As {@link #writeClassification(Classification)}, running {@code beforeCommit}
     * with the new version while the pair is locked and before anything is
     * written. If it throws, nothing is archived or stored.
     */
    public Classification writeClassification(Classification draft, Consumer<Classification> beforeCommit) {
        requireEvent(draft.getEventId());

        String key = ClassificationRepository.liveKey(draft.getEventId(), draft.getClassifierId());
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            long now = System.currentTimeMillis();
            Classification current = classificationRepo.find(draft.getEventId(), draft.getClassifierId());
            Classification stored = draft.toBuilder()
                    .version(current != null ? current.getVersion() + 1 : 1)
                    .timestamp(now)
                    .archivedAt(0)
                    .build();
            beforeCommit.accept(stored);

            if (current != null) {
                classificationRepo.archive(current.toBuilder().archivedAt(now).build());
                log.debug("Archived classification {} v{}", key, current.getVersion());
            }
            classificationRepo.save(stored);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }
}
