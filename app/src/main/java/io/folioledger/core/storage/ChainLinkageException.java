package io.folioledger.core.storage;

import io.folioledger.core.LedgerException;

/** A block's previous hash does not match the tip it was appended to. */
public class ChainLinkageException extends LedgerException {
    private final long sequence;

    public ChainLinkageException(long sequence, String expectedHash, String actualHash) {
        super("Block " + sequence + " links to " + abbreviate(actualHash) + " but tip hash is " + abbreviate(expectedHash));
        this.sequence = sequence;
    }

    public long sequence() {
        return sequence;
    }

    static String abbreviate(String hash) {
        if (hash == null || hash.isEmpty()) {
            return "<empty>";
        }
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
