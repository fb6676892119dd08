package com.ecp.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyReport {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private long timestamp;
    private int checksRun;
    private int checksFailed;
    private int totalErrors;
    private Map<String, CheckResult> checks;
    private String status;
    private List<ConsistencyError> criticalErrors;
}
