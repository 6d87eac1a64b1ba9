package dao.bridge.dataworker.model;

public enum RootType {
    POOL_REBALANCE,
    RELAYER_REFUND,
    SLOW_RELAY
}
