package dao.bridge.dataworker.model;

import lombok.Builder;

import java.math.BigInteger;

/**
 * A FilledRelay event observed on the destination spoke pool.
 * Carries the economic fields of the deposit it claims to satisfy plus the relayer's repayment choice.
 */
@Builder(toBuilder = true)
public record Fill(
        long depositId,
        int originChainId,
        int destinationChainId,
        String depositor,
        String recipient,
        String destinationToken,
        BigInteger amount,
        BigInteger relayerFeePct,
        BigInteger realizedLpFeePct,
        BigInteger fillAmount,
        BigInteger totalFilledAmount,
        int repaymentChainId,
        String relayer,
        boolean isSlowRelay,
        long blockNumber
) {}
