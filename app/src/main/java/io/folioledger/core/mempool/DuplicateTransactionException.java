package io.folioledger.core.mempool;

import io.folioledger.core.LedgerException;

public class DuplicateTransactionException extends LedgerException {
    private final String transactionId;

    public DuplicateTransactionException(String transactionId, boolean included) {
        super("Transaction " + transactionId + (included ? " is already included in the ledger" : " is already pending"));
        this.transactionId = transactionId;
    }

    public String transactionId() {
        return transactionId;
    }
}
