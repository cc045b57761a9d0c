package io.folioledger.core.storage;

import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Thread-safe in-memory ledger. The list index is the block sequence.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    private final List<Block> chain = new ArrayList<>();
    private final Map<String, Long> txIndex = new HashMap<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        Block tip = tip();
        long expected = tip.sequence() + 1;
        if (block.sequence() != expected) {
            throw new SequenceException(expected, block.sequence());
        }
        if (!block.previousHash().equals(tip.contentHash())) {
            throw new ChainLinkageException(block.sequence(), tip.contentHash(), block.previousHash());
        }
        if (!block.hasValidContentHash()) {
            throw new ChainIntegrityException(block.sequence(), "content hash does not match contents");
        }
        Set<String> seen = new HashSet<>();
        for (String id : block.transactionIds()) {
            if (!seen.add(id)) {
                throw new ChainIntegrityException(block.sequence(), "transaction " + id + " repeated in block");
            }
            Long includedAt = txIndex.get(id);
            if (includedAt != null) {
                throw new ChainIntegrityException(block.sequence(), "transaction " + id + " already included at block " + includedAt);
            }
        }
        chain.add(block);
        for (String id : seen) {
            txIndex.put(id, block.sequence());
        }
    }

    @Override
    public synchronized Block get(long sequence) {
        return find(sequence).orElseThrow(() -> new BlockNotFoundException(sequence));
    }

    @Override
    public synchronized Optional<Block> find(long sequence) {
        if (sequence < 0 || sequence >= chain.size()) {
            return Optional.empty();
        }
        return Optional.of(chain.get((int) sequence));
    }

    @Override
    public synchronized Block tip() {
        return chain.isEmpty() ? Block.sentinel() : chain.get(chain.size() - 1);
    }

    @Override
    public synchronized Block confirmedTip() {
        for (int i = chain.size() - 1; i >= 0; i--) {
            Block block = chain.get(i);
            if (block.isConfirmed()) {
                return block;
            }
        }
        return Block.sentinel();
    }

    @Override
    public synchronized long size() {
        return chain.size();
    }

    @Override
    public synchronized List<Block> range(long from, int max) {
        if (from < 0) from = 0;
        if (max <= 0 || from >= chain.size()) {
            return List.of();
        }
        int end = (int) Math.min(chain.size(), from + max);
        return List.copyOf(chain.subList((int) from, end));
    }

    @Override
    public synchronized List<Block> blocks() {
        return List.copyOf(chain);
    }

    @Override
    public synchronized void verifyChain() {
        String previousHash = Block.sentinel().contentHash();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < chain.size(); i++) {
            Block block = chain.get(i);
            if (block.sequence() != i) {
                throw new ChainIntegrityException(i, "found sequence " + block.sequence());
            }
            if (!block.previousHash().equals(previousHash)) {
                throw new ChainIntegrityException(i, "previous hash mismatch");
            }
            if (!block.hasValidContentHash()) {
                throw new ChainIntegrityException(i, "content hash mismatch");
            }
            for (String id : block.transactionIds()) {
                if (!seen.add(id)) {
                    throw new ChainIntegrityException(i, "transaction " + id + " included twice");
                }
            }
            previousHash = block.contentHash();
        }
    }

    @Override
    public synchronized void updateStatus(long sequence, BlockStatus status) {
        Block current = get(sequence);
        if (current.isConfirmed() && status != BlockStatus.CONFIRMED) {
            throw new IllegalStateException("Block " + sequence + " is already confirmed");
        }
        chain.set((int) sequence, current.withStatus(status));
    }

    @Override
    public synchronized int confirmThrough(long sequence) {
        int changed = 0;
        long last = Math.min(sequence, chain.size() - 1L);
        for (int i = 0; i <= last; i++) {
            Block block = chain.get(i);
            if (block.status() == BlockStatus.PENDING) {
                chain.set(i, block.withStatus(BlockStatus.CONFIRMED));
                changed++;
            }
        }
        return changed;
    }

    @Override
    public synchronized Block removeTip() {
        if (chain.isEmpty()) {
            throw new IllegalStateException("Ledger is empty");
        }
        Block tip = chain.get(chain.size() - 1);
        if (tip.isConfirmed()) {
            throw new IllegalStateException("Cannot remove confirmed block " + tip.sequence());
        }
        chain.remove(chain.size() - 1);
        for (String id : tip.transactionIds()) {
            txIndex.remove(id);
        }
        return tip;
    }

    @Override
    public synchronized List<Block> truncateTo(long sequence) {
        for (long i = Math.max(0, sequence + 1); i < chain.size(); i++) {
            if (chain.get((int) i).isConfirmed()) {
                throw new IllegalStateException("Cannot truncate confirmed block " + i);
            }
        }
        List<Block> removed = new ArrayList<>();
        while (chain.size() - 1 > sequence) {
            removed.add(0, removeTip());
        }
        return removed;
    }

    @Override
    public synchronized boolean containsTransaction(String transactionId) {
        return txIndex.containsKey(transactionId);
    }

    @Override
    public synchronized Optional<Long> blockOf(String transactionId) {
        return Optional.ofNullable(txIndex.get(transactionId));
    }

    @Override
    public synchronized void restore(List<Block> blocks) {
        chain.clear();
        txIndex.clear();
        for (Block block : blocks) {
            chain.add(block);
            for (String id : block.transactionIds()) {
                txIndex.putIfAbsent(id, block.sequence());
            }
        }
    }
}
