package dao.bridge.dataworker.exception;

import dao.bridge.dataworker.model.ExecutionReport;
import dao.bridge.dataworker.model.RootType;

/**
 * The persisted leaves of a bundle cannot produce a proof that verifies against the stored root.
 * Scoped to one leaf, or to the whole root when its leaves are missing.
 */
public class ProofConstructionException extends RuntimeException {

    private final RootType rootType;
    private final int leafId;

    public ProofConstructionException(RootType rootType, int leafId, String message) {
        super(rootType + " leaf " + leafId + ": " + message);
        this.rootType = rootType;
        this.leafId = leafId;
    }

    public ProofConstructionException(RootType rootType, String message) {
        super(rootType + " root: " + message);
        this.rootType = rootType;
        this.leafId = ExecutionReport.WHOLE_ROOT;
    }

    public RootType getRootType() {
        return rootType;
    }

    public int getLeafId() {
        return leafId;
    }
}
