package io.folioledger.core.sync;

import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.directory.NodeState;
import io.folioledger.core.node.BlockProducer;
import io.folioledger.core.node.BlockPropagator;
import io.folioledger.core.node.NodeConfig;
import io.folioledger.core.node.NodeContext;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerChannel;
import io.folioledger.core.p2p.PeerListener;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.ProtocolLimits;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionKind;
import io.folioledger.core.protocol.TransactionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SyncProtocolTest {

    private static final String AUTHORITY_ID = "fl00000000000000000000000000000001";

    private final List<SyncEngine> engines = new CopyOnWriteArrayList<>();
    private final List<LoopbackConnector> connectors = new CopyOnWriteArrayList<>();
    private final Map<MinerSyncEngine, LoopbackConnector> connectorByMiner = new ConcurrentHashMap<>();
    private final AtomicInteger txCounter = new AtomicInteger();

    @AfterEach
    void tearDown() {
        for (SyncEngine engine : engines) {
            engine.stop();
        }
        for (LoopbackConnector connector : connectors) {
            connector.shutdown();
        }
    }

    // --- fixtures

    private static final class Authority {
        final NodeContext ctx;
        final AuthoritySyncEngine engine;
        final BlockProducer producer;

        Authority(NodeContext ctx, AuthoritySyncEngine engine, BlockProducer producer) {
            this.ctx = ctx;
            this.engine = engine;
            this.producer = producer;
        }

        PeerConnection onlyConnection() {
            List<PeerConnection> conns = engine.connections();
            return conns.size() == 1 ? conns.get(0) : null;
        }
    }

    private static NodeConfig.Builder authorityConfig() {
        return NodeConfig.builder()
                .role(NodeRole.AUTHORITY)
                .peerTimeoutMillis(2_000L)
                .catchUpChunkSize(2);
    }

    private static NodeConfig.Builder minerConfig() {
        return NodeConfig.builder()
                .role(NodeRole.ARCHIVAL_MINER)
                .authority("loopback", 7000)
                .listenPort(7100)
                .peerTimeoutMillis(2_000L)
                .reconnectDelayMillis(100L)
                .catchUpChunkSize(2);
    }

    private Authority authority(NodeConfig.Builder config) {
        NodeContext ctx = NodeContext.inMemory(config.build(), AUTHORITY_ID);
        ctx.directory().register(new NodeRecord(AUTHORITY_ID, NodeRole.AUTHORITY, "loopback", 7000, 0L, 0L, NodeState.SYNCED));
        AuthoritySyncEngine engine = new AuthoritySyncEngine(ctx);
        BlockProducer producer = new BlockProducer(ctx, engine, engine::productionAllowed);
        engine.attachProducer(producer);
        engine.start((host, port, onFailure) -> {});
        engines.add(engine);
        return new Authority(ctx, engine, producer);
    }

    private MinerSyncEngine miner(NodeContext ctx, Authority authority) {
        MinerSyncEngine engine = new MinerSyncEngine(ctx);
        LoopbackConnector connector = new LoopbackConnector(authority.engine, engine);
        connectors.add(connector);
        connectorByMiner.put(engine, connector);
        engines.add(engine);
        return engine;
    }

    private LoopbackConnector connectorOf(MinerSyncEngine miner) {
        return Objects.requireNonNull(connectorByMiner.get(miner), "no connector");
    }

    private static NodeContext minerContext(NodeConfig.Builder config, String selfId) {
        return NodeContext.inMemory(config.build(), selfId);
    }

    private Transaction tx(String prefix) {
        String id = prefix + "-" + txCounter.incrementAndGet();
        return Transaction.builder()
                .id(id)
                .kind(TransactionKind.RECORD_ISSUANCE)
                .payload("{\"record\":\"" + id + "\"}")
                .submitterId("registrar")
                .createdAt(System.currentTimeMillis())
                .build();
    }

    /** Produces {@code count} confirmed blocks on a ledger nobody else watches. */
    private List<Block> produceAlone(NodeContext ctx, int count) {
        BlockProducer producer = new BlockProducer(ctx, BlockPropagator.NONE, () -> true);
        for (int i = 0; i < count; i++) {
            ctx.pool().submit(tx("solo"));
            producer.tick().orElseThrow();
        }
        return ctx.ledger().blocks();
    }

    /** Appends {@code count} confirmed blocks of {@code txsPerBlock} maximum-size transactions. */
    private List<Block> appendFullBlocks(NodeContext ctx, int count, int txsPerBlock) {
        String payload = "x".repeat(ProtocolLimits.MAX_PAYLOAD_BYTES);
        for (int i = 0; i < count; i++) {
            Block tip = ctx.ledger().tip();
            List<Transaction> txs = new ArrayList<>(txsPerBlock);
            for (int j = 0; j < txsPerBlock; j++) {
                txs.add(Transaction.builder()
                        .id("bulk-" + txCounter.incrementAndGet())
                        .kind(TransactionKind.RECORD_ISSUANCE)
                        .payload(payload)
                        .submitterId("registrar")
                        .createdAt(tip.timestamp() + 1)
                        .build()
                        .withStatus(TransactionStatus.INCLUDED));
            }
            ctx.ledger().append(Block.create(tip.sequence() + 1, tip.timestamp() + 1, tip.contentHash(), txs,
                    AUTHORITY_ID, BlockStatus.CONFIRMED));
        }
        return ctx.ledger().blocks();
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException {
        await(what, condition, 5_000L);
    }

    private static void await(String what, BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(20L);
        }
    }

    private static List<String> hashes(NodeContext ctx) {
        return ctx.ledger().blocks().stream().map(Block::contentHash).toList();
    }

    private void startAndSync(MinerSyncEngine miner, NodeContext minerCtx, Authority authority) throws InterruptedException {
        miner.start(connectorOf(miner));
        await("miner to sync", miner::isSynced);
        await("authority to see the miner synced", () -> {
            PeerConnection conn = authority.onlyConnection();
            return conn != null && conn.state() == ConnectionState.SYNCED;
        });
        assertEquals(hashes(authority.ctx), hashes(minerCtx));
    }

    // --- scenarios

    @Test
    void newMinerCatchesUpFromGenesis() throws Exception {
        Authority authority = authority(authorityConfig());
        produceAlone(authority.ctx, 5);
        assertEquals(5L, authority.ctx.ledger().tip().sequence());

        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        assertEquals(authority.ctx.ledger().blocks(), minerCtx.ledger().blocks());
        assertEquals(5L, minerCtx.ledger().confirmedTip().sequence());

        String minerId = minerCtx.selfId().orElseThrow();
        assertTrue(minerId.startsWith("fl"));
        assertEquals(NodeState.SYNCED, authority.ctx.directory().get(minerId).orElseThrow().state());
        assertTrue(authority.ctx.pool().contains(AuthoritySyncEngine.REGISTRATION_PREFIX + minerId));
        assertEquals(AUTHORITY_ID, minerCtx.directory().get(AUTHORITY_ID).orElseThrow().nodeId());
    }

    @Test
    void pushedBlockIsConfirmedByMinerAck() throws Exception {
        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        authority.ctx.pool().submit(tx("issue"));
        Block block = authority.producer.tick().orElseThrow();
        assertEquals(BlockStatus.PENDING, block.status());

        await("authority to confirm", () -> authority.ctx.ledger().get(block.sequence()).isConfirmed());
        await("miner to learn the confirmation",
                () -> minerCtx.ledger().find(block.sequence()).map(Block::isConfirmed).orElse(false));
        assertEquals(block.contentHash(), minerCtx.ledger().get(block.sequence()).contentHash());
    }

    @Test
    void pendingBlockWaitsForDisconnectedMiner() throws Exception {
        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);
        String minerId = minerCtx.selfId().orElseThrow();

        LoopbackConnector connector = connectorOf(miner);
        connector.reachable(false);
        connector.severAll();
        await("authority to drop the miner",
                () -> authority.ctx.directory().get(minerId).orElseThrow().state() == NodeState.DISCONNECTED);

        authority.ctx.pool().submit(tx("offline"));
        Block block = authority.producer.tick().orElseThrow();
        Thread.sleep(300L);
        assertEquals(BlockStatus.PENDING, authority.ctx.ledger().get(block.sequence()).status());
        assertTrue(minerCtx.ledger().find(block.sequence()).isEmpty());

        connector.reachable(true);
        await("authority to confirm after reconnect", () -> authority.ctx.ledger().get(block.sequence()).isConfirmed());
        await("miner to hold the confirmed block",
                () -> minerCtx.ledger().find(block.sequence()).map(Block::isConfirmed).orElse(false));
        assertEquals(minerId, minerCtx.selfId().orElseThrow());
    }

    @Test
    void interruptedCatchUpResumesFromMinerTip() throws Exception {
        Authority authority = authority(authorityConfig());
        List<Block> chain = produceAlone(authority.ctx, 6);

        NodeContext minerCtx = minerContext(minerConfig(), null);
        for (Block block : chain.subList(1, 4)) {
            minerCtx.ledger().append(block);
        }
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        assertEquals(6L, minerCtx.ledger().tip().sequence());
        assertEquals(chain, minerCtx.ledger().blocks());
    }

    @Test
    void catchUpResumesAfterLinkDropsMidStream() throws Exception {
        Authority authority = authority(authorityConfig());
        List<Block> chain = produceAlone(authority.ctx, 6);

        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        LoopbackConnector connector = connectorOf(miner);
        connector.severAfter(message -> SyncMessages.BLOCKS.equals(message.type()));
        startAndSync(miner, minerCtx, authority);

        assertTrue(connector.linksOpened() >= 2);
        assertEquals(chain, minerCtx.ledger().blocks());
        assertEquals(6L, minerCtx.ledger().confirmedTip().sequence());

        assertFalse(miner.applyReceived(null, chain.get(1)));
        assertFalse(miner.applyReceived(null, chain.get(2)));
        assertEquals(chain, minerCtx.ledger().blocks());
    }

    @Test
    void catchUpOverFullBlocksStaysWithinFrameLimit() throws Exception {
        Authority authority = authority(authorityConfig());
        List<Block> chain = appendFullBlocks(authority.ctx, 64, 32);

        NodeContext minerCtx = minerContext(minerConfig().catchUpChunkSize(64), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        LoopbackConnector connector = connectorOf(miner);
        miner.start(connector);
        await("miner to sync over full blocks", miner::isSynced, 30_000L);

        assertEquals(1, connector.linksOpened());
        assertEquals(64L, minerCtx.ledger().tip().sequence());
        assertEquals(chain, minerCtx.ledger().blocks());
        assertTrue(connector.largestFrame() <= ProtocolLimits.MAX_REPLY_BYTES + 4_096,
                "largest frame " + connector.largestFrame());
    }

    @Test
    void divergentMinerIsRewoundToConfirmedTip() throws Exception {
        Authority authority = authority(authorityConfig());
        produceAlone(authority.ctx, 3);

        NodeContext minerCtx = minerContext(minerConfig(), null);
        Block genesis = minerCtx.ledger().tip();
        Transaction rogue = tx("rogue");
        minerCtx.ledger().append(Block.create(1, genesis.timestamp() + 1, genesis.contentHash(), List.of(rogue),
                "fl-elsewhere", BlockStatus.PENDING));

        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        assertFalse(minerCtx.ledger().containsTransaction(rogue.id()));
        assertEquals(3L, minerCtx.ledger().tip().sequence());
    }

    @Test
    void authorityRecoversBlocksFromMinerAhead() throws Exception {
        NodeContext origin = NodeContext.inMemory(authorityConfig().build(), AUTHORITY_ID);
        List<Block> chain = produceAlone(origin, 4);

        Authority authority = authority(authorityConfig());
        for (Block block : chain.subList(1, 3)) {
            authority.ctx.ledger().append(block);
        }
        NodeContext minerCtx = minerContext(minerConfig(), null);
        for (Block block : chain.subList(1, 5)) {
            minerCtx.ledger().append(block);
        }

        MinerSyncEngine miner = miner(minerCtx, authority);
        miner.start(connectorOf(miner));
        await("authority to pull the missing blocks", () -> authority.ctx.ledger().tip().sequence() == 4L);
        await("miner to sync", miner::isSynced);

        assertEquals(hashes(minerCtx), hashes(authority.ctx));
        assertEquals(4L, authority.ctx.ledger().confirmedTip().sequence());
        await("production to resume", authority.engine::productionAllowed);
    }

    @Test
    void authorityRefusesBlocksProducedElsewhere() throws Exception {
        NodeContext origin = NodeContext.inMemory(authorityConfig().build(), "fl-some-other-authority");
        List<Block> foreign = produceAlone(origin, 2);

        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), null);
        for (Block block : foreign.subList(1, 3)) {
            minerCtx.ledger().append(block);
        }

        MinerSyncEngine miner = miner(minerCtx, authority);
        miner.start(connectorOf(miner));
        Thread.sleep(500L);
        assertEquals(0L, authority.ctx.ledger().tip().sequence());
    }

    @Test
    void handshakeRejectedAtMinerLimit() throws Exception {
        Authority authority = authority(authorityConfig().maxMiners(1));
        NodeContext firstCtx = minerContext(minerConfig(), null);
        MinerSyncEngine first = miner(firstCtx, authority);
        startAndSync(first, firstCtx, authority);

        NodeContext secondCtx = minerContext(minerConfig().listenPort(7101), null);
        MinerSyncEngine second = miner(secondCtx, authority);
        second.start(connectorOf(second));

        await("second miner to be rejected", () -> second.lastRejection().isPresent());
        assertTrue(second.lastRejection().get().reason().contains("miner limit"));
        assertFalse(second.isSynced());
        assertTrue(secondCtx.selfId().isEmpty());
        assertEquals(1, authority.engine.admittedNodeIds().size());
    }

    @Test
    void handshakeRejectedForUnknownNodeId() throws Exception {
        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), "fl-never-registered");
        MinerSyncEngine miner = miner(minerCtx, authority);
        miner.start(connectorOf(miner));

        await("miner to be rejected", () -> miner.lastRejection().isPresent());
        assertTrue(miner.lastRejection().get().reason().contains("unknown node id"));
        assertFalse(authority.ctx.directory().contains("fl-never-registered"));
    }

    @Test
    void silentPeerIsDroppedAfterHandshakeTimeout() throws Exception {
        Authority authority = authority(authorityConfig().peerTimeoutMillis(200L));
        CountDownLatch dropped = new CountDownLatch(1);
        PeerListener silent = new PeerListener() {
            @Override
            public void onPeerConnected(PeerChannel channel) {
            }

            @Override
            public void onPeerDisconnected(PeerChannel channel) {
                dropped.countDown();
            }

            @Override
            public void onMessage(PeerChannel channel, P2pMessage message) {
            }
        };
        LoopbackConnector connector = new LoopbackConnector(authority.engine, silent);
        connectors.add(connector);
        connector.connect("loopback", 7000, error -> fail(error));

        assertTrue(dropped.await(5, TimeUnit.SECONDS));
        await("authority to forget the connection", () -> authority.engine.connections().isEmpty());
    }

    @Test
    void minerForwardsSubmittedTransactions() throws Exception {
        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        Transaction submitted = minerCtx.pool().submit(tx("forwarded"));
        await("authority to receive the transaction", () -> authority.ctx.pool().contains(submitted.id()));

        Block block = authority.producer.tick().orElseThrow();
        assertTrue(block.transactionIds().contains(submitted.id()));
        await("miner to include it", () -> minerCtx.ledger().containsTransaction(submitted.id()));
        assertFalse(minerCtx.pool().contains(submitted.id()));
        await("block to be confirmed", () -> authority.ctx.ledger().get(block.sequence()).isConfirmed());
    }

    @Test
    void linkageFailureRejectsBlockAndRewindsMiner() throws Exception {
        Authority authority = authority(authorityConfig());
        NodeContext minerCtx = minerContext(minerConfig(), null);
        MinerSyncEngine miner = miner(minerCtx, authority);
        startAndSync(miner, minerCtx, authority);

        Block tip = minerCtx.ledger().tip();
        Block local = Block.create(tip.sequence() + 1, tip.timestamp() + 1, tip.contentHash(), List.of(),
                "fl-elsewhere", BlockStatus.PENDING);
        minerCtx.ledger().append(local);

        Transaction issued = authority.ctx.pool().submit(tx("contested"));
        Block rejected = authority.producer.tick().orElseThrow();

        await("authority to roll the block back", () -> authority.ctx.pool().contains(issued.id()));
        assertEquals(rejected.sequence() - 1, authority.ctx.ledger().tip().sequence());
        await("miner to drop its local block", () -> minerCtx.ledger().tip().sequence() == tip.sequence());
        await("authority to see the miner synced again", () -> {
            PeerConnection conn = authority.onlyConnection();
            return conn != null && conn.state() == ConnectionState.SYNCED;
        });

        Block retried = authority.producer.tick().orElseThrow();
        assertTrue(retried.transactionIds().contains(issued.id()));
        await("retried block to be confirmed", () -> authority.ctx.ledger().get(retried.sequence()).isConfirmed());
        await("miner to hold it", () -> minerCtx.ledger().containsTransaction(issued.id()));
    }
}
