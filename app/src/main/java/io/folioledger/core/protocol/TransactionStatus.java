package io.folioledger.core.protocol;

public enum TransactionStatus {
    /** Waiting in a pool. */
    PENDING,
    /** Placed in a block. */
    INCLUDED
}
