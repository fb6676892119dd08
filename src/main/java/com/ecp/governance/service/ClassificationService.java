package com.ecp.governance.service;

import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.RiskEstimate;
import com.ecp.governance.repository.ClassificationRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    static final String LEDGER_ENTRY_TYPE = "classification_recorded";

    private final ConsistencyGuard consistencyGuard;
    private final ClassificationRepository classificationRepo;
    private final ConsensusScoringService consensusScoringService;
    private final LedgerService ledgerService;
    private final MetricsConfig metricsConfig;

    public ClassificationService(ConsistencyGuard consistencyGuard,
                                 ClassificationRepository classificationRepo,
                                 ConsensusScoringService consensusScoringService,
                                 LedgerService ledgerService,
                                 MetricsConfig metricsConfig) {
        this.consistencyGuard = consistencyGuard;
        this.classificationRepo = classificationRepo;
        this.consensusScoringService = consensusScoringService;
        this.ledgerService = ledgerService;
        this.metricsConfig = metricsConfig;
    }

    public Classification classifyEvent(String eventId, String classifierId, EthicalStatus ethicalStatus,
                                        double confidence, RiskEstimate riskEstimate, String reasoning) {
        Classification draft = Classification.builder()
                .eventId(eventId)
                .classifierId(classifierId)
                .ethicalStatus(ethicalStatus)
                .confidence(confidence)
                .riskEstimate(riskEstimate)
                .reasoning(reasoning)
                .constraints(List.of())
                .selfClassification(false)
                .build();
        return record(draft);
    }

    /**
     * Validate a classification, log it to the ledger, store it and rescore
     * the event. The ledger entry is written first, under the pair's lock, so
     * a failed append leaves the live version untouched.
     */
    @Observed(name = "classification.record", contextualName = "record-classification")
    public Classification record(Classification draft) {
        validate(draft);

        Classification stored = consistencyGuard.writeClassification(draft,
                next -> ledgerService.append(LEDGER_ENTRY_TYPE, toLedgerPayload(next)));

        metricsConfig.recordClassification(stored.getEthicalStatus().getValue(), stored.requiresExternalReview());
        log.info("Classification recorded: event={}, classifier={}, status={}, version={}",
                stored.getEventId(), stored.getClassifierId(), stored.getEthicalStatus().getValue(), stored.getVersion());

        try {
            consensusScoringService.scoreEvent(stored.getEventId());
        } catch (RuntimeException e) {
            // the next classification or an explicit rescore recomputes it
            log.error("Consensus rescoring failed for event={} after classification by {}",
                    stored.getEventId(), stored.getClassifierId(), e);
        }
        return stored;
    }

    /** @return the live classification for the pair, or null */
    public Classification findCurrent(String eventId, String classifierId) {
        return classificationRepo.find(eventId, classifierId);
    }

    public List<Classification> getClassifications(String eventId) {
        return classificationRepo.findByEventId(eventId);
    }

    /** Every version for the pair, oldest first, ending with the live one. */
    public List<Classification> getHistory(String eventId, String classifierId) {
        Classification current = classificationRepo.find(eventId, classifierId);
        if (current == null) return List.of();
        List<Classification> history = new ArrayList<>(
                classificationRepo.findArchived(eventId, classifierId, current.getVersion()));
        history.add(current);
        return history;
    }

    private Map<String, Object> toLedgerPayload(Classification next) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", next.getEventId());
        payload.put("classifierId", next.getClassifierId());
        payload.put("version", next.getVersion());
        payload.put("ethicalStatus", next.getEthicalStatus().getValue());
        payload.put("confidence", next.getConfidence());
        payload.put("riskEstimate", next.getRiskEstimate().getValue());
        payload.put("selfClassification", next.isSelfClassification());
        payload.put("constraints", next.getConstraints() != null ? next.getConstraints() : List.of());
        return payload;
    }

    private void validate(Classification draft) {
        if (draft.getClassifierId() == null || draft.getClassifierId().isBlank()) {
            throw new IllegalArgumentException("classifierId is required");
        }
        if (draft.getEthicalStatus() == null) {
            throw new IllegalArgumentException("ethicalStatus is required");
        }
        if (draft.getRiskEstimate() == null) {
            throw new IllegalArgumentException("riskEstimate is required");
        }
        double confidence = draft.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
    }
}
