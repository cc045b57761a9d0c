package io.folioledger.core.sync;

/** Outcome a miner reports for a pushed block. */
public enum AckResult {
    OK,
    CHAIN_LINKAGE,
    CHAIN_INTEGRITY,
    SEQUENCE_GAP;

    static AckResult parse(String value) {
        try {
            return valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new SyncProtocolException("Unknown ack result: " + value);
        }
    }
}
