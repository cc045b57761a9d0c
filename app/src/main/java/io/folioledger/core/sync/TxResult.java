package io.folioledger.core.sync;

/** Authority verdict on a forwarded transaction. */
public enum TxResult {
    ACCEPTED,
    DUPLICATE,
    INVALID,
    EVICTED
}
