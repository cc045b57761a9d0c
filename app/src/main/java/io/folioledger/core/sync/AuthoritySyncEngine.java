package io.folioledger.core.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.folioledger.core.directory.DuplicateNodeException;
import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.mempool.DuplicateTransactionException;
import io.folioledger.core.mempool.EvictedException;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.metrics.LedgerMetrics;
import io.folioledger.core.node.BlockProducer;
import io.folioledger.core.node.BlockPropagator;
import io.folioledger.core.node.NodeContext;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.p2p.PeerConnector;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionCodec;
import io.folioledger.core.protocol.TransactionKind;
import io.folioledger.core.storage.ChainIntegrityException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Authority side of the sync protocol: admits miners, serves and pushes blocks, collects acks for
 * the {@link BlockProducer} and takes transactions forwarded by miners.
 */
public final class AuthoritySyncEngine extends BaseSyncEngine implements BlockPropagator, TransactionPool.PoolListener {
    private static final Logger LOG = Logger.getLogger(AuthoritySyncEngine.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String REGISTRATION_PREFIX = "reg-";

    private final AtomicInteger reverseSessions = new AtomicInteger();
    private final Map<String, String> forwardedBy = new ConcurrentHashMap<>();
    private volatile BlockProducer producer;

    public AuthoritySyncEngine(NodeContext ctx) {
        super(ctx);
        pool.addListener(this);
    }

    public void attachProducer(BlockProducer producer) {
        this.producer = producer;
    }

    /** Production pauses while the authority is pulling blocks from a miner that is ahead. */
    public boolean productionAllowed() {
        return reverseSessions.get() == 0;
    }

    @Override
    public void start(PeerConnector connector) {
        markRunning(true);
        LOG.info(() -> "Authority sync engine ready (max miners " + ctx.config().maxMiners + ")");
    }

    @Override
    protected void onConnected(PeerConnection conn) {
        conn.expect(SyncMessages.HANDSHAKE);
    }

    @Override
    protected void dispatch(PeerConnection conn, P2pMessage message) {
        switch (message.type()) {
            case SyncMessages.HANDSHAKE:
                handleHandshake(conn, message);
                break;
            case SyncMessages.GET_BLOCKS:
                requireAdmitted(conn, message);
                serveBlocks(conn, message);
                break;
            case SyncMessages.BLOCKS:
                requireAdmitted(conn, message);
                receiveBlocks(conn, message);
                break;
            case SyncMessages.SYNC_COMPLETE:
                requireAdmitted(conn, message);
                receiveSyncComplete(conn, message);
                break;
            case SyncMessages.BLOCK_ACK:
                requireAdmitted(conn, message);
                handleBlockAck(conn, message);
                break;
            case SyncMessages.TX_SUBMIT:
                requireAdmitted(conn, message);
                handleTxSubmit(conn, message);
                break;
            default:
                throw new SyncProtocolException("Unexpected " + message.type() + " from miner");
        }
    }

    private void requireAdmitted(PeerConnection conn, P2pMessage message) {
        ConnectionState state = conn.state();
        if (state != ConnectionState.CATCHING_UP && state != ConnectionState.SYNCED) {
            throw new SyncProtocolException(message.type() + " before handshake");
        }
    }

    private void handleHandshake(PeerConnection conn, P2pMessage message) {
        conn.fulfil(SyncMessages.HANDSHAKE);
        moveTo(conn, ConnectionState.HANDSHAKING);

        NodeRole role;
        try {
            role = NodeRole.parse(message.text("role"));
        } catch (IllegalArgumentException e) {
            reject(conn, e.getMessage());
            return;
        }
        if (role != NodeRole.ARCHIVAL_MINER) {
            reject(conn, "only archival miners may connect");
            return;
        }
        String requested = message.text("nodeId").trim();
        if (!requested.isEmpty() && !directory.contains(requested)) {
            reject(conn, "unknown node id " + requested);
            return;
        }
        if (admittedMiners() >= ctx.config().maxMiners) {
            reject(conn, "miner limit of " + ctx.config().maxMiners + " reached");
            return;
        }
        String host = message.text("host");
        int port = (int) message.number("port", 0L);
        String nodeId;
        try {
            nodeId = directory.register(NodeRecord.candidate(requested, NodeRole.ARCHIVAL_MINER, host, port));
        } catch (DuplicateNodeException e) {
            reject(conn, e.getMessage());
            return;
        }
        conn.nodeId(nodeId);
        if (requested.isEmpty()) {
            submitRegistration(nodeId, host, port);
        }

        long peerTip = SyncMessages.requireNumber(message, "tip");
        String peerTipHash = message.text("tipHash");
        long peerConfirmed = message.number("confirmedTip", 0L);
        conn.peerTip(peerTip);

        Block tip = ledger.tip();
        long rewindTo = SyncMessages.NO_REWIND;
        if (peerTip <= tip.sequence()) {
            boolean agrees = ledger.find(peerTip).map(b -> b.contentHash().equals(peerTipHash)).orElse(false);
            if (!agrees) {
                rewindTo = Math.max(0L, peerConfirmed);
            }
        }
        conn.send(SyncMessages.handshakeAck(nodeId, ctx.selfIdOrEmpty(), tip, ledger.confirmedTip(), rewindTo));
        moveTo(conn, ConnectionState.CATCHING_UP);
        LOG.info(() -> "Admitted miner " + nodeId + " at tip " + peerTip + " (authority tip " + tip.sequence() + ")");

        if (peerTip > tip.sequence()) {
            conn.reverse(true);
            reverseSessions.incrementAndGet();
            LOG.info(() -> "Miner " + nodeId + " is ahead; pulling its blocks");
            requestBlocks(conn);
        }
    }

    private void reject(PeerConnection conn, String reason) {
        LedgerMetrics.handshakeRejected();
        LOG.warning(() -> "Rejecting handshake from " + conn.channel().remoteAddress() + ": " + reason);
        conn.send(SyncMessages.handshakeReject(reason));
        fail(conn, "handshake rejected");
    }

    private int admittedMiners() {
        int count = 0;
        for (PeerConnection other : connections()) {
            if (!other.nodeId().isBlank() && other.state() != ConnectionState.DISCONNECTED) {
                count++;
            }
        }
        return count;
    }

    private void submitRegistration(String nodeId, String host, int port) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("nodeId", nodeId);
        payload.put("role", NodeRole.ARCHIVAL_MINER.name());
        payload.put("host", host);
        payload.put("port", port);
        Transaction tx = Transaction.builder()
                .id(REGISTRATION_PREFIX + nodeId)
                .kind(TransactionKind.NODE_REGISTRATION)
                .payload(payload.toString())
                .submitterId(ctx.selfIdOrEmpty())
                .createdAt(System.currentTimeMillis())
                .build();
        try {
            pool.submit(tx);
        } catch (DuplicateTransactionException e) {
            LOG.fine(() -> "Registration of " + nodeId + " already recorded");
        }
    }

    /** Blocks pulled from a miner were produced here before; they are taken as CONFIRMED. */
    @Override
    protected Block admitReceived(PeerConnection conn, Block block) {
        String self = ctx.selfIdOrEmpty();
        if (!self.isEmpty() && !self.equals(block.producerId())) {
            throw new ChainIntegrityException(block.sequence(), "block produced by " + block.producerId() + ", not by this authority");
        }
        return block.withStatus(BlockStatus.CONFIRMED);
    }

    @Override
    protected void onRolledBack(List<Block> removed) {
        for (Block block : removed) {
            pool.requeue(block.transactions());
        }
        BlockProducer current = producer;
        if (current != null) {
            current.reconcile();
        }
    }

    @Override
    protected void onSynced(PeerConnection conn, long peerTip, String peerTipHash) {
        if (conn.reverse()) {
            conn.reverse(false);
            reverseSessions.decrementAndGet();
            ledger.confirmThrough(ledger.tip().sequence());
            ctx.checkpoint();
            Block tip = ledger.tip();
            conn.send(SyncMessages.blockStatus(tip.sequence(), tip.contentHash(), BlockStatus.CONFIRMED));
        }
        BlockProducer current = producer;
        if (current != null) {
            current.reconcile();
            current.onSyncedAt(conn.nodeId(), peerTip, peerTipHash);
        }
        for (Block block : ledger.range(peerTip + 1, MAX_BLOCKS_PER_REPLY)) {
            push(conn, block);
        }
    }

    @Override
    protected void onDisconnected(PeerConnection conn) {
        if (conn.reverse()) {
            conn.reverse(false);
            reverseSessions.decrementAndGet();
        }
    }

    private void handleBlockAck(PeerConnection conn, P2pMessage message) {
        long sequence = SyncMessages.requireNumber(message, "sequence");
        String hash = message.text("hash");
        AckResult result = AckResult.parse(message.text("result"));
        conn.fulfil(SyncMessages.ackKey(sequence));
        LOG.fine(() -> "Ack " + result + " for block " + sequence + " from " + conn.nodeId());
        BlockProducer current = producer;
        switch (result) {
            case OK:
                if (current != null) {
                    current.onAck(conn.nodeId(), sequence, hash);
                }
                break;
            case CHAIN_LINKAGE:
                if (current != null) {
                    current.onRejected(conn.nodeId(), sequence, hash, "chain linkage");
                }
                conn.send(SyncMessages.rewind(ledger.confirmedTip().sequence()));
                backToCatchUp(conn);
                break;
            case CHAIN_INTEGRITY:
                if (current != null) {
                    current.onRejected(conn.nodeId(), sequence, hash, "chain integrity");
                }
                break;
            case SEQUENCE_GAP:
                backToCatchUp(conn);
                break;
            default:
                break;
        }
    }

    private void backToCatchUp(PeerConnection conn) {
        if (conn.state() == ConnectionState.SYNCED) {
            moveTo(conn, ConnectionState.CATCHING_UP);
        }
    }

    private void handleTxSubmit(PeerConnection conn, P2pMessage message) {
        Transaction tx;
        try {
            tx = TransactionCodec.fromValue(message.value("transaction"));
        } catch (IllegalArgumentException e) {
            conn.send(SyncMessages.txResult("", TxResult.INVALID, e.getMessage()));
            return;
        }
        try {
            pool.submit(tx);
            forwardedBy.put(tx.id(), conn.nodeId());
            conn.send(SyncMessages.txResult(tx.id(), TxResult.ACCEPTED, ""));
        } catch (DuplicateTransactionException e) {
            conn.send(SyncMessages.txResult(tx.id(), TxResult.DUPLICATE, e.getMessage()));
        } catch (IllegalArgumentException e) {
            conn.send(SyncMessages.txResult(tx.id(), TxResult.INVALID, e.getMessage()));
        }
    }

    @Override
    public void onEvicted(Transaction tx, EvictedException error) {
        String origin = forwardedBy.remove(tx.id());
        if (origin == null) {
            return;
        }
        connectionOf(origin).ifPresent(conn -> conn.send(SyncMessages.txResult(tx.id(), TxResult.EVICTED, error.reason())));
    }

    @Override
    public void propagate(Block block) {
        for (PeerConnection conn : connections()) {
            if (conn.state() == ConnectionState.SYNCED) {
                push(conn, block);
            }
        }
    }

    @Override
    public void announceStatus(Block block) {
        if (block.isConfirmed()) {
            for (String id : block.transactionIds()) {
                forwardedBy.remove(id);
            }
        }
        P2pMessage status = SyncMessages.blockStatus(block.sequence(), block.contentHash(), block.status());
        for (PeerConnection conn : connections()) {
            ConnectionState state = conn.state();
            if (state == ConnectionState.SYNCED || state == ConnectionState.CATCHING_UP) {
                conn.send(status);
            }
        }
    }

    private void push(PeerConnection conn, Block block) {
        conn.send(SyncMessages.blockPush(block));
        conn.expect(SyncMessages.ackKey(block.sequence()));
    }

    /** Miners currently admitted, by node id. */
    public List<String> admittedNodeIds() {
        List<String> out = new ArrayList<>();
        for (PeerConnection conn : connections()) {
            if (!conn.nodeId().isBlank()) {
                out.add(conn.nodeId());
            }
        }
        return out;
    }
}
