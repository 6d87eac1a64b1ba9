package dao.bridge.dataworker.model;

import lombok.Data;

import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

@Data
public class LocalBundle {

    private long localId;
    /**
     * chainId -> index the spoke pool on that chain gave this bundle when the hub relayed it.
     * Filled in from the spoke's RelayedRootBundle events as leaves are executed.
     */
    private Map<Integer, Long> relayedRootBundleIds = new ConcurrentSkipListMap<>();
    private BundleBlockRange blockRange;
    private BundleStatus status = BundleStatus.BUILDING;
    private String proposeTxId;
    private long proposedAt; // unix seconds
    private long challengePeriodEnd; // unix seconds

    private StoredRoot<PoolRebalanceLeaf> poolRebalanceRoot;
    private StoredRoot<RelayerRefundLeaf> relayerRefundRoot;
    private StoredRoot<RelayData> slowRelayRoot;

    public StoredRoot<?> root(RootType type) {
        return switch (type) {
            case POOL_REBALANCE -> poolRebalanceRoot;
            case RELAYER_REFUND -> relayerRefundRoot;
            case SLOW_RELAY -> slowRelayRoot;
        };
    }

    public boolean allLeavesExecuted() {
        for (RootType type : RootType.values()) {
            StoredRoot<?> r = root(type);
            if (r != null && !r.allExecuted()) return false;
        }
        return true;
    }
}
