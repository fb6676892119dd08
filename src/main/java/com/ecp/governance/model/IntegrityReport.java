package com.ecp.governance.model;

/**
 * Outcome of a fail-fast chain verification. On failure, {@code failedSequence}
 * is the first entry at which the chain stops holding.
 */
public record IntegrityReport(boolean valid,
                              long entriesChecked,
                              FailureType failureType,
                              Long failedSequence,
                              String detail) {

    public enum FailureType { HASH_MISMATCH, CHAIN_LINK_BREAK }

    public static IntegrityReport intact(long entriesChecked) {
        return new IntegrityReport(true, entriesChecked, null, null, "chain intact");
    }

    public static IntegrityReport broken(long entriesChecked, FailureType type, long sequence, String detail) {
        return new IntegrityReport(false, entriesChecked, type, sequence, detail);
    }
}
