package dao.bridge.dataworker.exception;

import dao.bridge.dataworker.model.BundleStatus;

public class BundleStateException extends RuntimeException {

    private final long bundleId;
    private final BundleStatus status;

    public BundleStateException(long bundleId, BundleStatus status, String action) {
        super("Cannot " + action + " bundle " + bundleId + " in status " + status);
        this.bundleId = bundleId;
        this.status = status;
    }

    public long getBundleId() {
        return bundleId;
    }

    public BundleStatus getStatus() {
        return status;
    }
}
