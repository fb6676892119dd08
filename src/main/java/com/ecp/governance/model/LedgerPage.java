package com.ecp.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * One page of ledger entries. {@code nextSequence} is null on the last page.
 */
@Schema(description = "A page of ledger entries in sequence order")
public record LedgerPage(List<LedgerEntry> entries,
                         @Schema(description = "Sequence of the newest entry, -1 when the ledger is empty", example = "41")
                         long headSequence,
                         boolean hasMore,
                         @Schema(description = "Value to pass as fromSequence for the next page", example = "20")
                         Long nextSequence) {

    public static LedgerPage of(List<LedgerEntry> entries, long fromSequence, long headSequence) {
        long next = entries.isEmpty() ? fromSequence : entries.get(entries.size() - 1).getSequence() + 1;
        boolean hasMore = next <= headSequence;
        return new LedgerPage(entries, headSequence, hasMore, hasMore ? next : null);
    }
}
