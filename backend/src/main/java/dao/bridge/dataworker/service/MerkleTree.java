package dao.bridge.dataworker.service;

import dao.bridge.dataworker.util.HexUtil;

import java.util.List;

/**
 * Immutable sorted-pair keccak tree over an ordered leaf list. Built by {@link MerkleTreeService}.
 */
public final class MerkleTree<L> {

    private final List<L> leaves;
    private final List<List<byte[]>> layers;

    MerkleTree(List<L> leaves, List<List<byte[]>> layers) {
        this.leaves = List.copyOf(leaves);
        this.layers = layers;
    }

    public List<L> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    public String getRootHex() {
        return HexUtil.toHex0x(layers.get(layers.size() - 1).get(0));
    }

    public byte[] leafHash(int index) {
        return layers.get(0).get(index).clone();
    }

    public List<String> proofFor(int index) {
        return MerkleTreeService.proofFromLayers(layers, index);
    }

    public List<String> proofFor(L leaf) {
        int index = leaves.indexOf(leaf);
        if (index < 0) {
            throw new IllegalArgumentException("Leaf not in tree: " + leaf);
        }
        return proofFor(index);
    }
}
