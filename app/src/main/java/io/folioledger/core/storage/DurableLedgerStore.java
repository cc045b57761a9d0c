package io.folioledger.core.storage;

import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;

import java.util.List;
import java.util.Optional;

/**
 * Ledger whose mutations reach the chain file before they return. The chain anchor follows the
 * confirmed tip and only ever moves forward.
 */
public final class DurableLedgerStore implements LedgerStore {

    private final LedgerStore delegate;
    private final SnapshotStore files;

    public DurableLedgerStore(LedgerStore delegate, SnapshotStore files) {
        this.delegate = delegate;
        this.files = files;
    }

    @Override
    public synchronized void append(Block block) {
        delegate.append(block);
        persist();
    }

    @Override
    public Block get(long sequence) {
        return delegate.get(sequence);
    }

    @Override
    public Optional<Block> find(long sequence) {
        return delegate.find(sequence);
    }

    @Override
    public Block tip() {
        return delegate.tip();
    }

    @Override
    public Block confirmedTip() {
        return delegate.confirmedTip();
    }

    @Override
    public long size() {
        return delegate.size();
    }

    @Override
    public List<Block> range(long from, int max) {
        return delegate.range(from, max);
    }

    @Override
    public List<Block> blocks() {
        return delegate.blocks();
    }

    @Override
    public void verifyChain() {
        delegate.verifyChain();
    }

    @Override
    public synchronized void updateStatus(long sequence, BlockStatus status) {
        delegate.updateStatus(sequence, status);
        persist();
    }

    @Override
    public synchronized int confirmThrough(long sequence) {
        int changed = delegate.confirmThrough(sequence);
        if (changed > 0) {
            persist();
        }
        return changed;
    }

    @Override
    public synchronized Block removeTip() {
        Block removed = delegate.removeTip();
        persist();
        return removed;
    }

    @Override
    public synchronized List<Block> truncateTo(long sequence) {
        List<Block> removed = delegate.truncateTo(sequence);
        if (!removed.isEmpty()) {
            persist();
        }
        return removed;
    }

    @Override
    public boolean containsTransaction(String transactionId) {
        return delegate.containsTransaction(transactionId);
    }

    @Override
    public Optional<Long> blockOf(String transactionId) {
        return delegate.blockOf(transactionId);
    }

    @Override
    public synchronized void restore(List<Block> blocks) {
        delegate.restore(blocks);
    }

    private void persist() {
        files.writeChain(delegate.blocks());
        Block confirmed = delegate.confirmedTip();
        if (!confirmed.isSentinel()) {
            files.putAnchor(ChainAnchor.of(confirmed));
        }
    }
}
