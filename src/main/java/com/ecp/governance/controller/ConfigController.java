package com.ecp.governance.controller;

import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.config.ConsensusConfig;
import com.ecp.governance.config.GovernanceConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and tune runtime configuration (consensus policy, governance defaults)")
public class ConfigController {

    private final ConsensusConfig consensusConfig;
    private final GovernanceConfig governanceConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(ConsensusConfig consensusConfig,
                            GovernanceConfig governanceConfig,
                            AerospikeConfig aerospikeConfig) {
        this.consensusConfig = consensusConfig;
        this.governanceConfig = governanceConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Consensus ──

    @Operation(summary = "Get consensus scoring policy")
    @GetMapping("/consensus")
    public ResponseEntity<Map<String, Object>> getConsensusConfig() {
        ConsensusConfig.Weights w = consensusConfig.getWeights();
        ConsensusConfig.StatusScale ss = consensusConfig.getStatusScale();
        ConsensusConfig.RiskScale rs = consensusConfig.getRiskScale();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("aggregation", consensusConfig.getAggregation().name());
        body.put("reviewThreshold", consensusConfig.getReviewThreshold());
        body.put("statusWeight", w.getStatus());
        body.put("confidenceWeight", w.getConfidence());
        body.put("riskWeight", w.getRisk());
        body.put("statusScale", Map.of(
                "ethical", ss.getEthical(),
                "permissible", ss.getPermissible(),
                "questionable", ss.getQuestionable(),
                "unethical", ss.getUnethical()));
        body.put("riskScale", Map.of(
                "low", rs.getLow(),
                "medium", rs.getMedium(),
                "high", rs.getHigh()));
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update consensus scoring policy",
            description = "Aggregation, threshold and weights. Changes apply to the next scoring run and reset on restart.")
    @PutMapping("/consensus")
    public ResponseEntity<?> updateConsensusConfig(@RequestBody Map<String, Object> body) {
        ConsensusConfig.Weights w = consensusConfig.getWeights();
        double threshold = toDouble(body, "reviewThreshold", consensusConfig.getReviewThreshold());
        double statusWeight = toDouble(body, "statusWeight", w.getStatus());
        double confidenceWeight = toDouble(body, "confidenceWeight", w.getConfidence());
        double riskWeight = toDouble(body, "riskWeight", w.getRisk());

        ConsensusConfig.Aggregation aggregation = consensusConfig.getAggregation();
        Object rawAggregation = body.get("aggregation");
        if (rawAggregation != null) {
            try {
                aggregation = ConsensusConfig.Aggregation.valueOf(rawAggregation.toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return badRequest("aggregation must be MAX or MEAN", "aggregation");
            }
        }

        if (threshold < 0) return badRequest("reviewThreshold must be >= 0", "reviewThreshold");
        if (statusWeight < 0) return badRequest("statusWeight must be >= 0", "statusWeight");
        if (confidenceWeight < 0) return badRequest("confidenceWeight must be >= 0", "confidenceWeight");
        if (riskWeight < 0) return badRequest("riskWeight must be >= 0", "riskWeight");
        if (statusWeight + confidenceWeight + riskWeight <= 0) {
            return badRequest("at least one weight must be > 0", "statusWeight");
        }

        consensusConfig.setAggregation(aggregation);
        consensusConfig.setReviewThreshold(threshold);
        w.setStatus(statusWeight);
        w.setConfidence(confidenceWeight);
        w.setRisk(riskWeight);

        return getConsensusConfig();
    }

    // ── Governance (read-only) ──

    @Operation(summary = "Get governance defaults (read-only)",
            description = "Self-classification and fallback verdicts, consistency check schedule")
    @GetMapping("/governance")
    public ResponseEntity<Map<String, Object>> getGovernanceConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("selfClassification", governanceConfig.getSelfClassification());
        body.put("fallbackClassification", governanceConfig.getFallbackClassification());
        body.put("consistencyCheckEnabled", governanceConfig.getConsistency().isEnabled());
        body.put("consistencyCheckIntervalMinutes", governanceConfig.getConsistency().getCheckIntervalMinutes());
        return ResponseEntity.ok(body);
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
