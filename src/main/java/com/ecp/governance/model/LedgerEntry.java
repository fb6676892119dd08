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
@Schema(description = "One immutable, hash-linked record of the append-only ledger")
public class LedgerEntry {

    @Schema(description = "Id of the record this entry carries (event id for decision events)", example = "evt_3f9a0c1d22b4e8a1")
    private String entryId;

    @Schema(description = "Position in the chain, starting at 0", example = "42")
    private long sequence;

    @Schema(description = "Append time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Kind of entry", example = "decision_event",
            allowableValues = {"decision_event", "classification_recorded", "human_ruling"})
    private String entryType;

    @Schema(description = "Entry content")
    private Map<String, Object> payload;

    @Schema(description = "Hash of the preceding entry, or 64 zeros for the first entry")
    private String previousHash;

    @Schema(description = "SHA-256 over the canonical form of timestamp, entryType, payload and previousHash")
    private String hash;
}
