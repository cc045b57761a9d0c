package io.folioledger.core.storage;

import io.folioledger.core.LedgerException;

public class SequenceException extends LedgerException {
    private final long expected;
    private final long actual;

    public SequenceException(long expected, long actual) {
        super("Expected block sequence " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }

    /** True when the offered block lies beyond the next expected sequence. */
    public boolean isGap() {
        return actual > expected;
    }
}
