package io.folioledger.core.directory;

import io.folioledger.core.LedgerException;

public class DuplicateNodeException extends LedgerException {
    public DuplicateNodeException(String message) {
        super(message);
    }
}
