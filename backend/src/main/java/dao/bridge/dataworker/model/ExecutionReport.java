package dao.bridge.dataworker.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of executing one root type of a bundle.
 *
 * @param failedLeaves leafId to failure reason; {@link #WHOLE_ROOT} when no leaf could be attempted
 */
public record ExecutionReport(
        long bundleId,
        RootType rootType,
        List<Integer> executedLeaves,
        List<Integer> skippedLeaves,
        Map<Integer, String> failedLeaves
) {

    public static final int WHOLE_ROOT = -1;

    public boolean isComplete() {
        return failedLeaves.isEmpty();
    }
}
