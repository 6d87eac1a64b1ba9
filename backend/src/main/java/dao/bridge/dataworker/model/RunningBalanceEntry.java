package dao.bridge.dataworker.model;

import java.math.BigInteger;

/**
 * One carry-forward step of the running-balance ledger.
 * newBalance = priorBalance + bundleAmount - netSendAmount.
 *
 * @param version local id of the bundle that produced this entry
 */
public record RunningBalanceEntry(
        BalanceKey key,
        long version,
        BigInteger priorBalance,
        BigInteger bundleAmount,
        BigInteger bundleLpFee,
        BigInteger netSendAmount,
        BigInteger newBalance
) {

    public RunningBalanceEntry withVersion(long newVersion) {
        return new RunningBalanceEntry(key, newVersion, priorBalance, bundleAmount, bundleLpFee, netSendAmount, newBalance);
    }
}
