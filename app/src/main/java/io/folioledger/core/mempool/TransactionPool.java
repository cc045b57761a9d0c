package io.folioledger.core.mempool;

import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * FIFO pool of pending transactions.
 * - ids are unique across the pool and the ledger (checked through {@code includedInLedger})
 * - drain order is submission order; requeued transactions go back to the front
 * - drained ids stay reserved until the producer settles or requeues them
 */
public final class TransactionPool {
    private static final Logger LOG = Logger.getLogger(TransactionPool.class.getName());
    private static final int MAX_REMEMBERED_EVICTIONS = 10_000;

    public interface PoolListener {
        default void onSubmitted(Transaction tx, int poolSize) {}
        default void onEvicted(Transaction tx, EvictedException error) {}
    }

    private final Deque<Transaction> fifo = new ArrayDeque<>();
    private final Map<String, Transaction> byId = new HashMap<>();
    private final Map<String, Transaction> drained = new HashMap<>();
    private final Map<String, EvictedException> evictions = new LinkedHashMap<>();
    private final CopyOnWriteArrayList<PoolListener> listeners = new CopyOnWriteArrayList<>();
    private final TxValidator validator;
    private final Predicate<String> includedInLedger;

    public TransactionPool(TxValidator validator, Predicate<String> includedInLedger) {
        this.validator = validator;
        this.includedInLedger = includedInLedger;
    }

    public void addListener(PoolListener listener) {
        if (listener != null) {
            listeners.addIfAbsent(listener);
        }
    }

    /**
     * Validates and appends a transaction.
     *
     * @throws DuplicateTransactionException if the id is pending or already included
     * @throws IllegalArgumentException      if the validator rejects it
     */
    public Transaction submit(Transaction tx) {
        validator.validate(tx);
        Transaction pending = tx.withStatus(TransactionStatus.PENDING);
        int size;
        synchronized (this) {
            if (byId.containsKey(tx.id()) || drained.containsKey(tx.id())) {
                throw new DuplicateTransactionException(tx.id(), false);
            }
            if (includedInLedger.test(tx.id())) {
                throw new DuplicateTransactionException(tx.id(), true);
            }
            evictions.remove(tx.id());
            fifo.addLast(pending);
            byId.put(pending.id(), pending);
            size = fifo.size();
        }
        for (PoolListener listener : listeners) {
            listener.onSubmitted(pending, size);
        }
        return pending;
    }

    /**
     * Removes and returns up to {@code max} transactions in submission order. Their ids stay reserved
     * until {@link #settle} or {@link #requeue}.
     */
    public synchronized List<Transaction> drain(int max) {
        List<Transaction> out = new ArrayList<>(Math.max(0, Math.min(max, fifo.size())));
        for (int i = 0; i < max && !fifo.isEmpty(); i++) {
            Transaction tx = fifo.removeFirst();
            byId.remove(tx.id());
            drained.put(tx.id(), tx);
            out.add(tx);
        }
        return out;
    }

    /** Releases drained ids once their block is in the ledger. */
    public synchronized void settle(Collection<String> ids) {
        for (String id : ids) {
            drained.remove(id);
        }
    }

    /** Puts transactions back at the front, keeping their relative order. Already-present ids are skipped. */
    public synchronized void requeue(List<Transaction> txs) {
        ListIterator<Transaction> it = txs.listIterator(txs.size());
        while (it.hasPrevious()) {
            Transaction tx = it.previous().withStatus(TransactionStatus.PENDING);
            drained.remove(tx.id());
            if (byId.containsKey(tx.id()) || includedInLedger.test(tx.id())) {
                continue;
            }
            fifo.addFirst(tx);
            byId.put(tx.id(), tx);
        }
    }

    /** Drops a pending transaction and records why. Empty if the id was not pending. */
    public Optional<EvictedException> evict(String id, String reason) {
        Transaction removed;
        EvictedException error = new EvictedException(id, reason);
        synchronized (this) {
            removed = byId.remove(id);
            if (removed != null) {
                fifo.remove(removed);
            }
            recordEviction(error);
        }
        if (removed == null) {
            return Optional.empty();
        }
        notifyEvicted(removed, error);
        return Optional.of(error);
    }

    /** Evicts a transaction that was already drained, e.g. one that failed validation at batching time. */
    public EvictedException reportEvicted(Transaction tx, String reason) {
        EvictedException error = new EvictedException(tx.id(), reason);
        synchronized (this) {
            drained.remove(tx.id());
            recordEviction(error);
        }
        notifyEvicted(tx, error);
        return error;
    }

    private void notifyEvicted(Transaction tx, EvictedException error) {
        LOG.info(() -> "Evicted transaction " + tx.id() + ": " + error.reason());
        for (PoolListener listener : listeners) {
            listener.onEvicted(tx, error);
        }
    }

    /** Records an eviction decided elsewhere for a transaction that is no longer pending here. */
    public synchronized void recordEviction(EvictedException error) {
        evictions.put(error.transactionId(), error);
        if (evictions.size() > MAX_REMEMBERED_EVICTIONS) {
            String oldest = evictions.keySet().iterator().next();
            evictions.remove(oldest);
        }
    }

    /** Drops transactions that were included through another path. Returns how many were removed. */
    public synchronized int remove(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            Transaction tx = byId.remove(id);
            if (tx != null) {
                fifo.remove(tx);
                removed++;
            }
        }
        return removed;
    }

    public synchronized SubmissionStatus status(String id) {
        if (byId.containsKey(id)) {
            return SubmissionStatus.PENDING;
        }
        if (includedInLedger.test(id)) {
            return SubmissionStatus.INCLUDED;
        }
        if (drained.containsKey(id)) {
            return SubmissionStatus.PENDING;
        }
        if (evictions.containsKey(id)) {
            return SubmissionStatus.EVICTED;
        }
        return SubmissionStatus.UNKNOWN;
    }

    public synchronized Optional<EvictedException> evictionOf(String id) {
        return Optional.ofNullable(evictions.get(id));
    }

    public synchronized boolean contains(String id) {
        return byId.containsKey(id);
    }

    public synchronized List<Transaction> pending() {
        return List.copyOf(fifo);
    }

    public synchronized int size() {
        return fifo.size();
    }

    /** Loads persisted pending transactions, skipping any the ledger already holds. */
    public synchronized void restore(List<Transaction> txs) {
        fifo.clear();
        byId.clear();
        drained.clear();
        for (Transaction tx : txs) {
            if (byId.containsKey(tx.id()) || includedInLedger.test(tx.id())) {
                continue;
            }
            Transaction pending = tx.withStatus(TransactionStatus.PENDING);
            fifo.addLast(pending);
            byId.put(pending.id(), pending);
        }
    }
}
