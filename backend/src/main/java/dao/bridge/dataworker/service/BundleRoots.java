package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RelayerRefundLeaf;
import dao.bridge.dataworker.model.RootType;

/**
 * All three roots of one bundle, built from a single reconciliation pass.
 */
public record BundleRoots(
        RootBuildResult<RelayData> slowRelay,
        RootBuildResult<RelayerRefundLeaf> relayerRefund,
        PoolRebalanceRoot poolRebalance
) {

    public String rootHex(RootType type) {
        return switch (type) {
            case POOL_REBALANCE -> poolRebalance.rootHex();
            case RELAYER_REFUND -> relayerRefund.rootHex();
            case SLOW_RELAY -> slowRelay.rootHex();
        };
    }

    public RootBuildResult<?> result(RootType type) {
        return switch (type) {
            case POOL_REBALANCE -> poolRebalance.result();
            case RELAYER_REFUND -> relayerRefund;
            case SLOW_RELAY -> slowRelay;
        };
    }
}
