package io.folioledger.core.storage;

import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, hash-linked block sequence.
 *
 * <p>{@link #tip()} is the last appended block whatever its status, because a PENDING block is
 * already part of the chain new blocks link to. {@link #confirmedTip()} is the highest CONFIRMED
 * block. Both return {@link Block#sentinel()} on an empty store.
 */
public interface LedgerStore {

    /**
     * Appends a block at {@code tip + 1}.
     *
     * @throws SequenceException        if the sequence is not {@code tip().sequence() + 1}
     * @throws ChainLinkageException    if the previous hash is not the tip's content hash
     * @throws ChainIntegrityException  if the content hash is wrong or a transaction is already included
     */
    void append(Block block);

    /** @throws BlockNotFoundException for unknown sequences */
    Block get(long sequence);

    Optional<Block> find(long sequence);

    Block tip();

    Block confirmedTip();

    /** Number of blocks held, genesis included. */
    long size();

    /** Up to {@code max} consecutive blocks starting at {@code from}. */
    List<Block> range(long from, int max);

    List<Block> blocks();

    /** @throws ChainIntegrityException at the first broken sequence, linkage or content hash */
    void verifyChain();

    void updateStatus(long sequence, BlockStatus status);

    /** Marks every held block up to {@code sequence} CONFIRMED. Returns how many changed. */
    int confirmThrough(long sequence);

    /** Removes the tip, which must not be CONFIRMED. */
    Block removeTip();

    /** Drops every block after {@code sequence}. CONFIRMED blocks are never dropped. */
    List<Block> truncateTo(long sequence);

    boolean containsTransaction(String transactionId);

    /** Sequence of the block that includes the transaction. */
    Optional<Long> blockOf(String transactionId);

    /** Replaces the contents without validation; callers run {@link #verifyChain()} afterwards. */
    void restore(List<Block> blocks);
}
