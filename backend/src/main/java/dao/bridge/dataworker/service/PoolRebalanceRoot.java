package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.PoolRebalanceLeaf;
import dao.bridge.dataworker.model.RunningBalanceEntry;

import java.util.List;

/**
 * Pool-rebalance tree plus the running-balance transitions it implies. The entries are
 * committed to the ledger only once the bundle has been proposed.
 */
public record PoolRebalanceRoot(RootBuildResult<PoolRebalanceLeaf> result, List<RunningBalanceEntry> entries) {

    public PoolRebalanceRoot {
        entries = List.copyOf(entries);
    }

    public String rootHex() {
        return result.rootHex();
    }
}
