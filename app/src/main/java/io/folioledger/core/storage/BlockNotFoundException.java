package io.folioledger.core.storage;

import io.folioledger.core.LedgerException;

public class BlockNotFoundException extends LedgerException {
    public BlockNotFoundException(long sequence) {
        super("No block at sequence " + sequence);
    }
}
