package com.ecp.governance.exception;

import com.ecp.governance.model.IntegrityReport;

/**
 * Raised by explicit integrity checks only. Requires forensic review; the ledger is never repaired automatically.
 */
public class IntegrityViolationException extends RuntimeException {

    private final IntegrityReport report;

    public IntegrityViolationException(IntegrityReport report) {
        super("Ledger integrity violation at sequence " + report.failedSequence()
                + " (" + report.failureType() + "): " + report.detail());
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
