package dao.bridge.dataworker.model;

/**
 * Lifecycle of a root bundle.
 * BUILDING -> PROPOSED -> (VALIDATED | DISPUTED) -> EXECUTING -> CLOSED
 */
public enum BundleStatus {
    BUILDING,
    PROPOSED,
    VALIDATED,
    DISPUTED,
    EXECUTING,
    CLOSED
}
