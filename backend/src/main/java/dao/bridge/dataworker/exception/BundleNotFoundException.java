package dao.bridge.dataworker.exception;

public class BundleNotFoundException extends IllegalArgumentException {

    public BundleNotFoundException(long bundleId) {
        super("Bundle not found: " + bundleId);
    }
}
