package dao.bridge.dataworker.model;

import java.util.List;

/**
 * Per-root outcome of validating a proposal. All three roots are always compared.
 */
public record BundleValidationResult(
        BundleBlockRange blockRange,
        List<RootComparison> comparisons
) {

    public boolean isValid() {
        return comparisons.stream().allMatch(RootComparison::matches);
    }

    public List<RootType> mismatchedRoots() {
        return comparisons.stream()
                .filter(c -> !c.matches())
                .map(RootComparison::rootType)
                .toList();
    }
}
