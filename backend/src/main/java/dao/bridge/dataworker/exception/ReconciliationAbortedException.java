package dao.bridge.dataworker.exception;

import java.util.concurrent.CancellationException;

/**
 * Raised when the caller aborts a reconciliation pass. No partial output is emitted.
 */
public class ReconciliationAbortedException extends CancellationException {

    public ReconciliationAbortedException(String message) {
        super(message);
    }
}
