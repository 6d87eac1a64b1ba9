package dao.bridge.dataworker.model;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Slow-relay leaf. Enough for the destination spoke pool to execute a slow fill
 * without re-reading deposit history.
 */
public record RelayData(
        String depositor,
        String recipient,
        String destinationToken,
        BigInteger amount,
        int originChainId,
        int destinationChainId,
        BigInteger realizedLpFeePct,
        BigInteger relayerFeePct,
        long depositId
) {

    /** (originChainId, depositId) is globally unique, so this is a total order. */
    public static final Comparator<RelayData> LEAF_ORDER = Comparator
            .comparingInt(RelayData::originChainId)
            .thenComparingLong(RelayData::depositId);

    public static RelayData from(UnfilledDeposit unfilled) {
        Deposit d = unfilled.deposit();
        return new RelayData(
                d.depositor(),
                d.recipient(),
                d.destinationToken(),
                d.amount(),
                d.originChainId(),
                d.destinationChainId(),
                d.realizedLpFeePct(),
                d.relayerFeePct(),
                d.depositId()
        );
    }
}
