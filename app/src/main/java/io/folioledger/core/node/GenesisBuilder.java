package io.folioledger.core.node;

import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockStatus;
import io.folioledger.core.storage.LedgerStore;

import java.util.List;

/**
 * Creates the genesis block.
 * - sequence = 0, timestamp = 0
 * - previousHash = "" (the empty-store sentinel hash)
 * - no transactions, producer "genesis", already CONFIRMED
 * Every node derives the same block, so chains from different nodes link at sequence 0.
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis() {
        return Block.create(0L, 0L, Block.sentinel().contentHash(), List.of(), Block.GENESIS_PRODUCER, BlockStatus.CONFIRMED);
    }

    /** Appends genesis to an empty ledger. Does nothing otherwise. */
    public static void initIfNeeded(LedgerStore ledger) {
        if (ledger.size() > 0) return;
        ledger.append(buildGenesis());
    }
}
