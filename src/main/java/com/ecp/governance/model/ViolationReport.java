package com.ecp.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViolationReport {
    private long timestamp;
    private int totalViolations;
    private int blockingViolations;
    private int warningViolations;
    private int auditViolations;
    private Map<String, Integer> violationsByType;
    private Map<String, Integer> violationsByAgent;
    private int recent24h;
    private int recent7d;
}
