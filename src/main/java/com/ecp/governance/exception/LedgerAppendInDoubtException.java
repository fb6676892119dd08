package com.ecp.governance.exception;

/**
 * A ledger write failed and the ledger could not be read back afterwards, so
 * it is unknown whether the entry was stored.
 */
public class LedgerAppendInDoubtException extends RuntimeException {

    private final long sequence;

    public LedgerAppendInDoubtException(long sequence, Throwable cause) {
        super("Ledger append at sequence " + sequence + " is in doubt: " + cause.getMessage(), cause);
        this.sequence = sequence;
    }

    public long getSequence() {
        return sequence;
    }
}
