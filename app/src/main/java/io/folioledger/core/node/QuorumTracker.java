package io.folioledger.core.node;

import io.folioledger.core.protocol.Block;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/** Acknowledgements for the single block in flight. One ack per node counts. */
public final class QuorumTracker {
    private Block pending;
    private int required;
    private final Set<String> acks = new HashSet<>();

    public synchronized void open(Block block, int requiredAcks) {
        if (pending != null) {
            throw new IllegalStateException("Block " + pending.sequence() + " is still pending");
        }
        this.pending = block;
        this.required = requiredAcks;
        this.acks.clear();
    }

    public synchronized Optional<Block> pending() {
        return Optional.ofNullable(pending);
    }

    public synchronized boolean isPending(long sequence, String contentHash) {
        return pending != null && pending.sequence() == sequence && pending.contentHash().equals(contentHash);
    }

    /** Records an ack and returns true once the required count is reached. */
    public synchronized boolean ack(String nodeId, long sequence, String contentHash) {
        if (!isPending(sequence, contentHash)) {
            return false;
        }
        acks.add(nodeId);
        return acks.size() >= required;
    }

    public synchronized Optional<Block> close() {
        Block closed = pending;
        pending = null;
        acks.clear();
        required = 0;
        return Optional.ofNullable(closed);
    }

    public synchronized int ackCount() {
        return acks.size();
    }

    public synchronized int required() {
        return required;
    }
}
