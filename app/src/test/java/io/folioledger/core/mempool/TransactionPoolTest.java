package io.folioledger.core.mempool;

import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransactionPoolTest {

    private final Set<String> ledger = new HashSet<>();
    private TransactionPool pool;

    @BeforeEach
    void setUp() {
        pool = new TransactionPool(new TxValidator(), ledger::contains);
    }

    private static Transaction tx(String id) {
        return Transaction.builder()
                .id(id)
                .kind(TransactionKind.RECORD_ISSUANCE)
                .payload("{\"record\":\"" + id + "\"}")
                .createdAt(1_700_000_000_000L)
                .build();
    }

    private static List<String> ids(List<Transaction> txs) {
        return txs.stream().map(Transaction::id).toList();
    }

    @Test
    void drainsInSubmissionOrder() {
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        pool.submit(tx("c"));
        assertEquals(List.of("a", "b"), ids(pool.drain(2)));
        assertEquals(List.of("c"), ids(pool.pending()));
    }

    @Test
    void rejectsDuplicates() {
        pool.submit(tx("a"));
        assertThrows(DuplicateTransactionException.class, () -> pool.submit(tx("a")));

        ledger.add("b");
        DuplicateTransactionException ex = assertThrows(DuplicateTransactionException.class, () -> pool.submit(tx("b")));
        assertTrue(ex.getMessage().contains("already included"));
        assertEquals(1, pool.size());
    }

    @Test
    void rejectsInvalidTransactions() {
        Transaction noPayload = Transaction.builder().id("x").kind(TransactionKind.RECORD_ISSUANCE).createdAt(1L).build();
        assertThrows(IllegalArgumentException.class, () -> pool.submit(noPayload));

        Transaction noTimestamp = Transaction.builder().id("y").kind(TransactionKind.REQUEST_CLOSED).createdAt(0L).build();
        assertThrows(IllegalArgumentException.class, () -> pool.submit(noTimestamp));

        Transaction oversized = Transaction.builder().id("z").payload("p".repeat(9_000)).createdAt(1L).build();
        assertThrows(IllegalArgumentException.class, () -> pool.submit(oversized));
        assertEquals(0, pool.size());
    }

    @Test
    void requeuePutsTransactionsBackInFront() {
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        pool.submit(tx("c"));
        List<Transaction> batch = pool.drain(2);
        pool.submit(tx("d"));

        pool.requeue(batch);
        assertEquals(List.of("a", "b", "c", "d"), ids(pool.pending()));
    }

    @Test
    void requeueSkipsIncludedTransactions() {
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        List<Transaction> batch = pool.drain(2);
        ledger.add("a");

        pool.requeue(batch);
        assertEquals(List.of("b"), ids(pool.pending()));
    }

    @Test
    void drainedIdsStayReservedUntilSettledOrRequeued() {
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        List<Transaction> batch = pool.drain(2);

        assertThrows(DuplicateTransactionException.class, () -> pool.submit(tx("a")));
        assertEquals(SubmissionStatus.PENDING, pool.status("b"));
        assertEquals(0, pool.size());

        pool.requeue(batch.subList(1, 2));
        assertEquals(List.of("b"), ids(pool.pending()));

        ledger.add("a");
        pool.settle(List.of("a"));
        assertEquals(SubmissionStatus.INCLUDED, pool.status("a"));

        ledger.remove("a");
        pool.submit(tx("a"));
        assertEquals(List.of("b", "a"), ids(pool.pending()));
    }

    @Test
    void evictionIsRecordedAndReported() {
        List<String> evicted = new ArrayList<>();
        pool.addListener(new TransactionPool.PoolListener() {
            @Override
            public void onEvicted(Transaction tx, EvictedException error) {
                evicted.add(tx.id() + ":" + error.reason());
            }
        });
        pool.submit(tx("a"));

        assertTrue(pool.evict("a", "rejected").isPresent());
        assertEquals(SubmissionStatus.EVICTED, pool.status("a"));
        assertEquals("rejected", pool.evictionOf("a").orElseThrow().reason());
        assertEquals(List.of("a:rejected"), evicted);

        assertTrue(pool.evict("missing", "gone").isEmpty());
        assertEquals(1, evicted.size());
    }

    @Test
    void resubmittingClearsEviction() {
        pool.submit(tx("a"));
        pool.evict("a", "rejected");
        pool.submit(tx("a"));
        assertEquals(SubmissionStatus.PENDING, pool.status("a"));
    }

    @Test
    void statusFollowsLifecycle() {
        assertEquals(SubmissionStatus.UNKNOWN, pool.status("a"));
        pool.submit(tx("a"));
        assertEquals(SubmissionStatus.PENDING, pool.status("a"));
        pool.drain(1);
        ledger.add("a");
        assertEquals(SubmissionStatus.INCLUDED, pool.status("a"));
    }

    @Test
    void submitNotifiesListenersWithPoolSize() {
        List<Integer> sizes = new ArrayList<>();
        pool.addListener(new TransactionPool.PoolListener() {
            @Override
            public void onSubmitted(Transaction tx, int poolSize) {
                sizes.add(poolSize);
            }
        });
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        assertEquals(List.of(1, 2), sizes);
    }

    @Test
    void removeDropsTransactionsIncludedElsewhere() {
        pool.submit(tx("a"));
        pool.submit(tx("b"));
        assertEquals(1, pool.remove(List.of("a", "zz")));
        assertEquals(List.of("b"), ids(pool.pending()));
    }

    @Test
    void restoreSkipsDuplicatesAndIncluded() {
        ledger.add("b");
        pool.restore(List.of(tx("a"), tx("b"), tx("a"), tx("c")));
        assertEquals(List.of("a", "c"), ids(pool.pending()));
    }
}
