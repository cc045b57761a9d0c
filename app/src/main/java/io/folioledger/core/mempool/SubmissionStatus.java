package io.folioledger.core.mempool;

/** What a submitter can learn about a transaction id. */
public enum SubmissionStatus {
    PENDING,
    INCLUDED,
    EVICTED,
    UNKNOWN
}
