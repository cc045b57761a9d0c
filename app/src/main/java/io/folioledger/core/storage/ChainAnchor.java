package io.folioledger.core.storage;

import io.folioledger.core.protocol.Block;

/**
 * Sequence and content hash of the highest confirmed block, kept in the node database so a chain
 * file that lost confirmed blocks, or was swapped for another chain, is caught at startup.
 */
public record ChainAnchor(long sequence, String contentHash) {
    public static ChainAnchor of(Block block) {
        return new ChainAnchor(block.sequence(), block.contentHash());
    }

    public boolean matches(Block block) {
        return block.sequence() == sequence && block.contentHash().equals(contentHash);
    }
}
