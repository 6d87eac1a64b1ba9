package dao.bridge.dataworker.service;

import dao.bridge.dataworker.util.HexUtil;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

@Service
public class MerkleTreeService {

    /** Root submitted on-chain for a root type with no leaves. */
    public static final String EMPTY_ROOT = "0x" + "0".repeat(64);

    /**
     * Build a tree over leaves that are already in their canonical order.
     * The leaf order is never changed here; callers own the sort.
     */
    public <L> MerkleTree<L> build(List<L> orderedLeaves, Function<L, byte[]> leafHasher) {
        if (orderedLeaves == null || orderedLeaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }
        List<byte[]> hashes = new ArrayList<>(orderedLeaves.size());
        for (L leaf : orderedLeaves) {
            hashes.add(leafHasher.apply(leaf));
        }
        return new MerkleTree<>(orderedLeaves, buildLayers(hashes));
    }

    /**
     * Check a bottom-up sorted-pair proof against a 0x-prefixed root.
     */
    public boolean verifyProof(byte[] leafHash, List<String> proof, String rootHex) {
        if (leafHash == null || leafHash.length != 32 || proof == null || rootHex == null) {
            return false;
        }
        byte[] computed = leafHash.clone();
        for (String hex : proof) {
            byte[] sibling = HexUtil.toBytes32(hex);
            computed = hashPair(computed, sibling);
        }
        return HexUtil.toHex0x(computed).equalsIgnoreCase(HexUtil.ensure0x(rootHex));
    }

    static List<List<byte[]>> buildLayers(List<byte[]> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }

        List<List<byte[]>> layers = new ArrayList<>();
        List<byte[]> current = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            if (leaf == null || leaf.length != 32) {
                throw new IllegalArgumentException("Each leaf must be 32 bytes");
            }
            current.add(leaf.clone());
        }
        layers.add(current);

        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>();
            for (int i = 0; i < current.size(); i += 2) {
                byte[] left = current.get(i);
                if (i + 1 < current.size()) {
                    next.add(hashPair(left, current.get(i + 1)));
                } else {
                    // Promote odd leaf
                    next.add(left);
                }
            }
            layers.add(next);
            current = next;
        }
        return layers;
    }

    static List<String> proofFromLayers(List<List<byte[]>> layers, int index) {
        int leafCount = layers.get(0).size();
        if (index < 0 || index >= leafCount) {
            throw new IndexOutOfBoundsException("Invalid leaf index: " + index);
        }

        List<String> proof = new ArrayList<>();
        int idx = index;

        for (int layerIdx = 0; layerIdx < layers.size() - 1; layerIdx++) {
            List<byte[]> layer = layers.get(layerIdx);
            int siblingIndex;
            if (idx % 2 == 0) {
                if (idx + 1 < layer.size()) {
                    siblingIndex = idx + 1;
                } else {
                    // No sibling at this level (odd leaf promoted)
                    idx = idx / 2;
                    continue;
                }
            } else {
                siblingIndex = idx - 1;
            }

            proof.add(HexUtil.toHex0x(layer.get(siblingIndex)));
            idx = idx / 2;
        }

        return proof;
    }

    /**
     * Hash a pair of 32-byte nodes with sorted-pair keccak.
     */
    static byte[] hashPair(byte[] left, byte[] right) {
        if (left == null || right == null || left.length != 32 || right.length != 32) {
            throw new IllegalArgumentException("hashPair requires two 32-byte inputs");
        }

        if (compareBytes(left, right) <= 0) {
            return keccak256(concat(left, right));
        } else {
            return keccak256(concat(right, left));
        }
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static int compareBytes(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            int ai = a[i] & 0xff;
            int bi = b[i] & 0xff;
            if (ai != bi) return ai - bi;
        }
        return a.length - b.length;
    }
}
