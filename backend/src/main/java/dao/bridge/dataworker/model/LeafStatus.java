package dao.bridge.dataworker.model;

public enum LeafStatus {
    PENDING,
    EXECUTED
}
