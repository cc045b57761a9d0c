package io.folioledger.core.node;

import io.folioledger.core.protocol.Block;

/** Where the producer hands blocks for delivery to miners. */
public interface BlockPropagator {
    /** Pushes a freshly produced block to every synced miner. */
    void propagate(Block block);

    /** Tells miners a block became CONFIRMED or REJECTED. */
    void announceStatus(Block block);

    BlockPropagator NONE = new BlockPropagator() {
        @Override
        public void propagate(Block block) {}

        @Override
        public void announceStatus(Block block) {}
    };
}
