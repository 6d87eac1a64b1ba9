package dao.bridge.dataworker.model;

/**
 * Result of comparing one claimed root against the locally recomputed one.
 */
public record RootComparison(RootType rootType, String expectedRoot, String claimedRoot, boolean matches) {}
