package io.folioledger.core.storage;

import io.folioledger.core.LedgerException;

/** Chain verification failed; {@link #sequence()} names the first offending block. */
public class ChainIntegrityException extends LedgerException {
    private final long sequence;

    public ChainIntegrityException(long sequence, String message) {
        super("Chain integrity violated at block " + sequence + ": " + message);
        this.sequence = sequence;
    }

    public long sequence() {
        return sequence;
    }
}
