package com.ecp.governance.service;

import com.ecp.governance.config.ConsensusConfig;
import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.model.Classification;
import com.ecp.governance.model.ClassifierScore;
import com.ecp.governance.model.ConsensusRecord;
import com.ecp.governance.model.EthicalStatus;
import com.ecp.governance.model.PairwiseDivergence;
import com.ecp.governance.repository.ClassificationRepository;
import com.ecp.governance.repository.ConsensusRepository;
import com.ecp.governance.repository.DecisionEventRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Scores agreement across all current classifications of an event. The result
 * depends only on the classification set, so rescoring is safe at any time.
 */
@Service
public class ConsensusScoringService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusScoringService.class);

    private final ClassificationRepository classificationRepo;
    private final ConsensusRepository consensusRepo;
    private final DecisionEventRepository decisionEventRepo;
    private final DivergenceCalculator divergenceCalculator;
    private final EscalationService escalationService;
    private final ConsensusConfig consensusConfig;
    private final MetricsConfig metricsConfig;

    public ConsensusScoringService(ClassificationRepository classificationRepo,
                                   ConsensusRepository consensusRepo,
                                   DecisionEventRepository decisionEventRepo,
                                   DivergenceCalculator divergenceCalculator,
                                   EscalationService escalationService,
                                   ConsensusConfig consensusConfig,
                                   MetricsConfig metricsConfig) {
        this.classificationRepo = classificationRepo;
        this.consensusRepo = consensusRepo;
        this.decisionEventRepo = decisionEventRepo;
        this.divergenceCalculator = divergenceCalculator;
        this.escalationService = escalationService;
        this.consensusConfig = consensusConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return the stored consensus record, or empty when fewer than two
     *         classifications exist
     */
    @Observed(name = "consensus.score", contextualName = "score-event")
    public Optional<ConsensusRecord> scoreEvent(String eventId) {
        List<Classification> classifications = classificationRepo.findByEventId(eventId);
        Optional<ConsensusRecord> computed = computeConsensus(eventId, classifications);
        if (computed.isEmpty()) {
            log.debug("Event {} has {} classification(s), nothing to score", eventId, classifications.size());
            return Optional.empty();
        }

        ConsensusRecord record = computed.get();
        consensusRepo.save(record);
        metricsConfig.recordConsensus(record.isRequiresHumanReview(), record.getMaxPairwiseDivergence());

        if (record.isRequiresHumanReview()) {
            log.info("Event {} requires human review: reason={}, maxDivergence={}",
                    eventId, record.getTriggerReason(), record.getMaxPairwiseDivergence());
            escalationService.escalateConsensus(record, decisionEventRepo.findEventType(eventId));
        }
        return Optional.of(record);
    }

    /** Pure computation over a classification set; nothing is stored. */
    public Optional<ConsensusRecord> computeConsensus(String eventId, List<Classification> classifications) {
        if (classifications == null || classifications.size() < 2) {
            return Optional.empty();
        }

        List<Classification> ordered = new ArrayList<>(classifications);
        ordered.sort(Comparator.comparing(Classification::getClassifierId));

        List<PairwiseDivergence> pairs = new ArrayList<>();
        double max = 0.0;
        double sum = 0.0;
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                PairwiseDivergence pair = divergenceCalculator.compare(ordered.get(i), ordered.get(j));
                pairs.add(pair);
                max = Math.max(max, pair.getDivergence());
                sum += pair.getDivergence();
            }
        }
        double mean = sum / pairs.size();

        List<ClassifierScore> breakdown = new ArrayList<>();
        long latest = 0;
        boolean anyUnethical = false;
        for (Classification c : ordered) {
            breakdown.add(divergenceCalculator.score(c));
            latest = Math.max(latest, c.getTimestamp());
            anyUnethical |= c.getEthicalStatus() == EthicalStatus.UNETHICAL;
        }

        ConsensusConfig.Aggregation aggregation = consensusConfig.getAggregation();
        double threshold = consensusConfig.getReviewThreshold();
        double aggregate = aggregation == ConsensusConfig.Aggregation.MEAN ? mean : max;
        boolean overThreshold = aggregate >= threshold;

        return Optional.of(ConsensusRecord.builder()
                .eventId(eventId)
                .timestamp(latest)
                .classificationCount(ordered.size())
                .pairwiseDivergences(pairs)
                .divergenceScore(mean)
                .maxPairwiseDivergence(max)
                .aggregation(aggregation.name())
                .threshold(threshold)
                .requiresHumanReview(overThreshold || anyUnethical)
                .triggerReason(triggerReason(anyUnethical, overThreshold))
                .perClassifierBreakdown(breakdown)
                .build());
    }

    public ConsensusRecord getConsensus(String eventId) {
        return consensusRepo.findByEventId(eventId);
    }

    private String triggerReason(boolean anyUnethical, boolean overThreshold) {
        if (anyUnethical && overThreshold) {
            return ConsensusRecord.REASON_UNETHICAL + "+" + ConsensusRecord.REASON_DIVERGENCE;
        }
        if (anyUnethical) return ConsensusRecord.REASON_UNETHICAL;
        if (overThreshold) return ConsensusRecord.REASON_DIVERGENCE;
        return ConsensusRecord.REASON_NONE;
    }
}
