package io.folioledger.core.mempool;

import io.folioledger.core.LedgerException;

/** Recorded for a transaction dropped from the pool without being included. */
public class EvictedException extends LedgerException {
    private final String transactionId;
    private final String reason;

    public EvictedException(String transactionId, String reason) {
        super("Transaction " + transactionId + " evicted: " + reason);
        this.transactionId = transactionId;
        this.reason = reason;
    }

    public String transactionId() {
        return transactionId;
    }

    public String reason() {
        return reason;
    }
}
