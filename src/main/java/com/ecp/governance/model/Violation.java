package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A recorded compliance breach. Permanent once written.")
public class Violation {

    @Schema(description = "Violation id", example = "vio_20250218_134244_123_5f1c2a9e")
    private String violationId;

    @Schema(description = "Kind of breach", example = "missing_context")
    private String violationType;

    @Schema(description = "Severity", example = "blocking")
    private Severity severity;

    private String message;

    @Schema(description = "Record time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    private String agentId;
    private String functionName;
    private String stackTrace;
    private Map<String, Object> context;
}
