package dao.bridge.dataworker.model;

import lombok.Builder;

import java.math.BigInteger;

/**
 * A deposit observed on its origin spoke pool.
 * Identified by (originChainId, depositId); depositId increases monotonically per origin chain.
 * Fee percentages are 18-decimal fixed point (1e18 = 100%).
 */
@Builder(toBuilder = true)
public record Deposit(
        long depositId,
        int originChainId,
        int destinationChainId,
        String depositor,
        String recipient,
        String originToken,
        String destinationToken,
        BigInteger amount,
        BigInteger relayerFeePct,
        BigInteger realizedLpFeePct,
        long quoteTimestamp,
        long blockNumber
) {}
