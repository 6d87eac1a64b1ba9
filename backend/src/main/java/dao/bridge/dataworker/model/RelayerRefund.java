package dao.bridge.dataworker.model;

import java.math.BigInteger;
import java.util.List;

/**
 * One refund entry inside a relayer-refund leaf.
 *
 * @param fillAmounts the refunded fills, ascending; {@code amount} is their sum
 */
public record RelayerRefund(
        String relayer,
        String refundToken,
        BigInteger amount,
        List<BigInteger> fillAmounts
) {}
