package io.folioledger.core.sync;

import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.p2p.P2pMessage;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockCodec;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionCodec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message types of the sync protocol and factories for their payloads.
 */
public final class SyncMessages {
    public static final String HANDSHAKE = "handshake";
    public static final String HANDSHAKE_ACK = "handshake_ack";
    public static final String HANDSHAKE_REJECT = "handshake_reject";
    public static final String GET_BLOCKS = "get_blocks";
    public static final String BLOCKS = "blocks";
    public static final String SYNC_COMPLETE = "sync_complete";
    public static final String REWIND = "rewind";
    public static final String BLOCK_PUSH = "block_push";
    public static final String BLOCK_ACK = "block_ack";
    public static final String BLOCK_STATUS = "block_status";
    public static final String TX_SUBMIT = "tx_submit";
    public static final String TX_RESULT = "tx_result";

    /** No rewind requested in a handshake ack. */
    public static final long NO_REWIND = -1L;

    private SyncMessages() {}

    public static P2pMessage handshake(NodeRole role, String nodeId, Block tip, Block confirmedTip, String host, int port) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("role", role.name());
        p.put("nodeId", nodeId == null ? "" : nodeId);
        p.put("tip", tip.sequence());
        p.put("tipHash", tip.contentHash());
        p.put("confirmedTip", confirmedTip.sequence());
        p.put("host", host == null ? "" : host);
        p.put("port", port);
        return new P2pMessage(HANDSHAKE, p);
    }

    public static P2pMessage handshakeAck(String nodeId, String authorityId, Block tip, Block confirmedTip, long rewindTo) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("nodeId", nodeId);
        p.put("authorityId", authorityId);
        p.put("tip", tip.sequence());
        p.put("tipHash", tip.contentHash());
        p.put("confirmedTip", confirmedTip.sequence());
        p.put("rewindTo", rewindTo);
        return new P2pMessage(HANDSHAKE_ACK, p);
    }

    public static P2pMessage handshakeReject(String reason) {
        return new P2pMessage(HANDSHAKE_REJECT, Map.of("reason", reason == null ? "" : reason));
    }

    public static P2pMessage getBlocks(long from, int max) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("from", from);
        p.put("max", max);
        return new P2pMessage(GET_BLOCKS, p);
    }

    public static P2pMessage blocks(List<Block> blocks, long holderTip) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("blocks", BlockCodec.toJson(blocks));
        p.put("holderTip", holderTip);
        return new P2pMessage(BLOCKS, p);
    }

    /**
     * Longest prefix of {@code blocks} whose encoding stays within {@code budgetBytes}. The first block
     * is always kept so a reply never comes back empty while the holder has blocks.
     */
    static List<Block> withinBudget(List<Block> blocks, long budgetBytes) {
        long used = 0L;
        for (int i = 0; i < blocks.size(); i++) {
            used += BlockCodec.encodedSize(blocks.get(i));
            if (i > 0 && used > budgetBytes) {
                return blocks.subList(0, i);
            }
        }
        return blocks;
    }

    public static P2pMessage syncComplete(Block tip) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("tip", tip.sequence());
        p.put("tipHash", tip.contentHash());
        return new P2pMessage(SYNC_COMPLETE, p);
    }

    public static P2pMessage rewind(long to) {
        return new P2pMessage(REWIND, Map.of("to", to));
    }

    public static P2pMessage blockPush(Block block) {
        return new P2pMessage(BLOCK_PUSH, Map.of("block", BlockCodec.toJson(block)));
    }

    public static P2pMessage blockAck(long sequence, String hash, AckResult result) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("sequence", sequence);
        p.put("hash", hash == null ? "" : hash);
        p.put("result", result.name());
        return new P2pMessage(BLOCK_ACK, p);
    }

    public static P2pMessage blockStatus(long sequence, String hash, BlockStatus status) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("sequence", sequence);
        p.put("hash", hash);
        p.put("status", status.name());
        return new P2pMessage(BLOCK_STATUS, p);
    }

    public static P2pMessage txSubmit(Transaction tx) {
        return new P2pMessage(TX_SUBMIT, Map.of("transaction", TransactionCodec.toJson(tx)));
    }

    public static P2pMessage txResult(String id, TxResult result, String message) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("id", id == null ? "" : id);
        p.put("result", result.name());
        p.put("message", message == null ? "" : message);
        return new P2pMessage(TX_RESULT, p);
    }

    /** Reply key for a block ack, so acks of different blocks time out independently. */
    static String ackKey(long sequence) {
        return BLOCK_ACK + ':' + sequence;
    }

    /** @throws SyncProtocolException when the field is absent or not a number */
    static long requireNumber(P2pMessage message, String key) {
        long value = message.number(key, Long.MIN_VALUE);
        if (value == Long.MIN_VALUE) {
            throw new SyncProtocolException(message.type() + " without numeric '" + key + "'");
        }
        return value;
    }
}
