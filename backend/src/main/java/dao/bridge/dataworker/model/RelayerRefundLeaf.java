package dao.bridge.dataworker.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Relayer-refund leaf: every refund owed on one repayment chain.
 * Entries are ordered by (relayer, refundToken).
 */
public record RelayerRefundLeaf(
        int leafId,
        int chainId,
        BigInteger amountToReturn,
        List<RelayerRefund> refunds
) {}
