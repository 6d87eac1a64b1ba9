package dao.bridge.dataworker.model;

import java.util.List;
import java.util.SortedMap;

/**
 * Output of one reconciliation pass: unfilled deposits keyed by destination chain
 * and valid fills keyed by (repayment chain, relayer).
 */
public record ReconciledBundleData(
        SortedMap<Integer, List<UnfilledDeposit>> unfilledDeposits,
        FillsToRefund fillsToRefund
) {}
