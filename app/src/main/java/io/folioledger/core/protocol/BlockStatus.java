package io.folioledger.core.protocol;

public enum BlockStatus {
    PENDING,
    CONFIRMED,
    REJECTED
}
