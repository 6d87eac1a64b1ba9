package dao.bridge.dataworker.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Pool-rebalance leaf for one chain (or one group of a chain's tokens).
 * The four lists are parallel and ordered by l1Token address.
 */
public record PoolRebalanceLeaf(
        int leafId,
        int chainId,
        int groupIndex,
        List<String> l1Tokens,
        List<BigInteger> bundleLpFees,
        List<BigInteger> netSendAmounts,
        List<BigInteger> runningBalances
) {}
