package dao.bridge.dataworker.exception;

/**
 * A spoke pool client has not finished syncing. Fatal for the current pass;
 * retry once the named chain has been updated.
 */
public class StaleChainStateException extends RuntimeException {

    private final int chainId;

    public StaleChainStateException(int chainId, String role) {
        super(role + " spoke pool client on chain " + chainId + " not updated");
        this.chainId = chainId;
    }

    public int getChainId() {
        return chainId;
    }
}
