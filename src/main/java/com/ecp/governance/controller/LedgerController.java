package com.ecp.governance.controller;

import com.ecp.governance.model.IntegrityReport;
import com.ecp.governance.model.LedgerEntry;
import com.ecp.governance.model.LedgerPage;
import com.ecp.governance.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger")
@Tag(name = "Ledger", description = "Read access to the hash-chained event ledger and integrity verification")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping("/entries")
    @Operation(summary = "List ledger entries",
               description = "Entries in sequence order starting at fromSequence. nextSequence is the fromSequence of the following page.")
    public ResponseEntity<LedgerPage> getEntries(
            @RequestParam(defaultValue = "0") long fromSequence,
            @RequestParam(defaultValue = "100") int limit) {
        List<LedgerEntry> entries = ledgerService.getEntries(fromSequence, limit);
        long headSequence = ledgerService.getLastEntry().map(LedgerEntry::getSequence).orElse(-1L);
        return ResponseEntity.ok(LedgerPage.of(entries, fromSequence, headSequence));
    }

    @GetMapping("/entries/{sequence}")
    @Operation(summary = "Get a ledger entry by sequence")
    public ResponseEntity<LedgerEntry> getEntry(@PathVariable long sequence) {
        return ledgerService.getEntry(sequence)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/last")
    @Operation(summary = "Get the newest ledger entry")
    public ResponseEntity<LedgerEntry> getLastEntry() {
        return ledgerService.getLastEntry()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/verify")
    @Operation(summary = "Verify chain integrity",
               description = "Fail-fast walk of the whole chain. With strict=true a broken chain returns 500.")
    public ResponseEntity<IntegrityReport> verify(@RequestParam(defaultValue = "false") boolean strict) {
        if (strict) {
            return ResponseEntity.ok(ledgerService.requireIntegrity());
        }
        return ResponseEntity.ok(ledgerService.verifyIntegrity());
    }
}
