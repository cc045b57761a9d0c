package io.folioledger.core.node;

import io.folioledger.core.directory.NodeDirectory;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.mempool.TxValidator;
import io.folioledger.core.metrics.LedgerMetrics;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionStatus;
import io.folioledger.core.storage.LedgerStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Batches pooled transactions into blocks on the authority.
 * A new block is appended locally as PENDING and becomes CONFIRMED once enough synced miners
 * acknowledge it. A miner reporting a linkage or integrity failure rejects it: the block leaves
 * the tip and its transactions go back to the front of the pool. Only one block is in flight.
 */
public final class BlockProducer implements TransactionPool.PoolListener {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final NodeContext ctx;
    private final LedgerStore ledger;
    private final TransactionPool pool;
    private final NodeDirectory directory;
    private final TxValidator validator;
    private final QuorumTracker tracker;
    private final BlockPropagator propagator;
    private final BooleanSupplier productionAllowed;
    private final LongSupplier clock;
    private final Map<String, Integer> rejections = new HashMap<>();

    private ScheduledExecutorService executor;

    public BlockProducer(NodeContext ctx, BlockPropagator propagator, BooleanSupplier productionAllowed) {
        this(ctx, new QuorumTracker(), propagator, productionAllowed, System::currentTimeMillis);
    }

    public BlockProducer(NodeContext ctx,
                         QuorumTracker tracker,
                         BlockPropagator propagator,
                         BooleanSupplier productionAllowed,
                         LongSupplier clock) {
        this.ctx = ctx;
        this.ledger = ctx.ledger();
        this.pool = ctx.pool();
        this.directory = ctx.directory();
        this.validator = new TxValidator();
        this.tracker = tracker;
        this.propagator = propagator == null ? BlockPropagator.NONE : propagator;
        this.productionAllowed = productionAllowed == null ? () -> true : productionAllowed;
        this.clock = clock;
    }

    /** Runs {@link #tick()} every batch interval, and early when the pool reaches the batch size. */
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "folioledger-producer");
            t.setDaemon(true);
            return t;
        });
        pool.addListener(this);
        long interval = ctx.config().batchIntervalMillis;
        executor.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info(() -> "Block producer started (interval=" + interval + "ms, batch=" + ctx.config().batchMaxSize + ")");
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    @Override
    public void onSubmitted(Transaction tx, int poolSize) {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current != null && poolSize >= ctx.config().batchMaxSize) {
            current.execute(this::safeTick);
        }
    }

    /** One production attempt: returns the block appended by this call, if any. */
    public Optional<Block> tick() {
        Block produced;
        List<Transaction> batch;
        boolean confirmedNow;
        synchronized (this) {
            if (tracker.pending().isPresent() || !productionAllowed.getAsBoolean()) {
                return Optional.empty();
            }
            if (ledger.tip().status() == BlockStatus.PENDING) {
                restorePendingLocked();
                return Optional.empty();
            }
            batch = collectBatch();
            if (batch.isEmpty()) {
                return Optional.empty();
            }
            Block tip = ledger.tip();
            List<Transaction> included = new ArrayList<>(batch.size());
            for (Transaction tx : batch) {
                included.add(tx.withStatus(TransactionStatus.INCLUDED));
            }
            long timestamp = Math.max(clock.getAsLong(), tip.timestamp());
            Block block;
            try {
                block = Block.create(tip.sequence() + 1, timestamp, tip.contentHash(), included,
                        ctx.selfIdOrEmpty(), BlockStatus.PENDING);
                ledger.append(block);
            } catch (RuntimeException e) {
                pool.requeue(batch);
                throw e;
            }
            pool.settle(block.transactionIds());
            LedgerMetrics.blockProduced();
            int required = requiredAcks();
            if (required == 0) {
                produced = confirmLocked(block);
                confirmedNow = true;
            } else {
                tracker.open(block, required);
                produced = block;
                confirmedNow = false;
            }
            LOG.info(() -> "Produced block " + block.sequence() + " with " + included.size()
                    + " transaction(s), awaiting " + required + " ack(s)");
        }
        propagator.propagate(produced);
        if (confirmedNow) {
            afterConfirm(produced);
        }
        return Optional.of(produced);
    }

    /** Counts a successful append reported by a miner. */
    public void onAck(String nodeId, long sequence, String contentHash) {
        Block confirmed = null;
        synchronized (this) {
            if (tracker.ack(nodeId, sequence, contentHash)) {
                confirmed = confirmLocked(tracker.pending().orElseThrow());
            }
        }
        if (confirmed != null) {
            afterConfirm(confirmed);
        }
    }

    /**
     * A miner reached {@code tipSequence} through catch-up. That covers the pending block when the
     * miner's tip hash agrees with ours.
     */
    public void onSyncedAt(String nodeId, long tipSequence, String tipHash) {
        Optional<Block> pending = tracker.pending();
        if (pending.isEmpty() || pending.get().sequence() > tipSequence) {
            return;
        }
        boolean agrees = ledger.find(tipSequence).map(b -> b.contentHash().equals(tipHash)).orElse(false);
        if (agrees) {
            onAck(nodeId, pending.get().sequence(), pending.get().contentHash());
        }
    }

    /** Rolls back the pending block after a miner failed to append it. */
    public void onRejected(String nodeId, long sequence, String contentHash, String reason) {
        Block rejected;
        synchronized (this) {
            if (!tracker.isPending(sequence, contentHash)) {
                return;
            }
            Block pending = tracker.close().orElseThrow();
            ledger.removeTip();
            rejected = pending.withStatus(BlockStatus.REJECTED);
            pool.requeue(pending.transactions());
            for (Transaction tx : pending.transactions()) {
                int count = rejections.merge(tx.id(), 1, Integer::sum);
                if (count >= ctx.config().maxRejections) {
                    rejections.remove(tx.id());
                    pool.evict(tx.id(), "rejected in " + count + " blocks").ifPresent(e -> LedgerMetrics.transactionEvicted());
                }
            }
        }
        LedgerMetrics.blockRejected();
        LOG.warning(() -> "Block " + sequence + " rejected by " + nodeId + " (" + reason + "); transactions requeued");
        propagator.announceStatus(rejected);
        ctx.checkpoint();
    }

    /** Tracks a PENDING tip left over from before a restart. */
    public void restorePending() {
        Block confirmed;
        synchronized (this) {
            confirmed = restorePendingLocked();
        }
        if (confirmed != null) {
            afterConfirm(confirmed);
        }
    }

    /** Drops tracking of a pending block that catch-up from a miner has since confirmed. */
    public synchronized void reconcile() {
        Optional<Block> pending = tracker.pending();
        if (pending.isEmpty()) {
            return;
        }
        Optional<Block> held = ledger.find(pending.get().sequence());
        if (held.isEmpty() || held.get().isConfirmed() || !held.get().contentHash().equals(pending.get().contentHash())) {
            tracker.close();
        }
    }

    public Optional<Block> pending() {
        return tracker.pending();
    }

    public QuorumTracker tracker() {
        return tracker;
    }

    /** 0 with no registered miner, else max(1, ceil(fraction * synced miners)). */
    int requiredAcks() {
        if (directory.registeredMiners().isEmpty()) {
            return 0;
        }
        int synced = directory.syncedMiners().size();
        return Math.max(1, (int) Math.ceil(ctx.config().quorumFraction * synced));
    }

    private Block restorePendingLocked() {
        Block tip = ledger.tip();
        if (tip.status() != BlockStatus.PENDING || tracker.pending().isPresent()) {
            return null;
        }
        int required = requiredAcks();
        if (required == 0) {
            return confirmLocked(tip);
        }
        tracker.open(tip, required);
        LOG.info(() -> "Tracking pending block " + tip.sequence() + " restored from snapshot");
        return null;
    }

    private List<Transaction> collectBatch() {
        List<Transaction> drained = pool.drain(ctx.config().batchMaxSize);
        List<Transaction> valid = new ArrayList<>(drained.size());
        for (Transaction tx : drained) {
            try {
                validator.validate(tx);
                valid.add(tx);
            } catch (IllegalArgumentException e) {
                pool.reportEvicted(tx, e.getMessage());
                LedgerMetrics.transactionEvicted();
            }
        }
        return valid;
    }

    private Block confirmLocked(Block block) {
        tracker.close();
        ledger.updateStatus(block.sequence(), BlockStatus.CONFIRMED);
        for (String id : block.transactionIds()) {
            rejections.remove(id);
        }
        LedgerMetrics.blockConfirmed();
        return ledger.get(block.sequence());
    }

    private void afterConfirm(Block block) {
        LOG.info(() -> "Block " + block.sequence() + " confirmed");
        propagator.announceStatus(block);
        ctx.checkpoint();
    }

    private void safeTick() {
        try {
            LedgerMetrics.recordProduction(this::tick);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Block production tick failed", e);
        }
    }
}
