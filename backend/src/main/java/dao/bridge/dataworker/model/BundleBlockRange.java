package dao.bridge.dataworker.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-chain block ranges a bundle covers (the hub's bundle evaluation block numbers).
 * Chains without an entry are unbounded.
 */
public record BundleBlockRange(SortedMap<Integer, BlockRange> ranges) {

    public record BlockRange(long startBlock, long endBlock) {
        public BlockRange {
            if (startBlock < 0 || endBlock < startBlock) {
                throw new IllegalArgumentException("Invalid block range [" + startBlock + ", " + endBlock + "]");
            }
        }

        public boolean contains(long blockNumber) {
            return blockNumber >= startBlock && blockNumber <= endBlock;
        }
    }

    public BundleBlockRange {
        ranges = Collections.unmodifiableSortedMap(new TreeMap<>(ranges == null ? Map.of() : ranges));
    }

    public static BundleBlockRange unbounded() {
        return new BundleBlockRange(new TreeMap<>());
    }

    public static BundleBlockRange of(Map<Integer, BlockRange> ranges) {
        return new BundleBlockRange(new TreeMap<>(ranges));
    }

    public boolean contains(int chainId, long blockNumber) {
        BlockRange r = ranges.get(chainId);
        return r == null || r.contains(blockNumber);
    }

    public long endBlock(int chainId) {
        BlockRange r = ranges.get(chainId);
        return r == null ? Long.MAX_VALUE : r.endBlock();
    }

    /**
     * End blocks in ascending chain-id order, as submitted with a proposal.
     */
    public List<BigInteger> evaluationBlockNumbers() {
        List<BigInteger> out = new ArrayList<>(ranges.size());
        for (BlockRange r : ranges.values()) {
            out.add(BigInteger.valueOf(r.endBlock()));
        }
        return out;
    }
}
