package dao.bridge.dataworker.ledger;

import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.RunningBalanceEntry;

import java.math.BigInteger;
import java.util.List;
import java.util.SortedMap;

/**
 * Versioned running balances keyed by (chainId, l1Token). A version is the local id of the
 * bundle whose pool-rebalance root produced the entries.
 */
public interface RunningBalanceLedger {

    /**
     * Newest committed balance per key.
     */
    SortedMap<BalanceKey, BigInteger> latestBalances();

    /**
     * Balances as they stood before {@code version} was committed. Used to recompute a proposed
     * bundle after later bundles have already committed.
     */
    SortedMap<BalanceKey, BigInteger> balancesBefore(long version);

    /**
     * @throws IllegalStateException if the version is already committed
     */
    void commit(long version, List<RunningBalanceEntry> entries);

    /**
     * Drop every entry of {@code version}. Returns the dropped entries; unknown versions are a no-op.
     */
    List<RunningBalanceEntry> revert(long version);

    List<RunningBalanceEntry> history(int chainId, String l1Token);
}
