package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.PoolRebalanceLeaf;

import java.math.BigInteger;
import java.util.List;

public interface HubPoolContractClient {

    ProposalSubmission proposeRootBundle(List<BigInteger> bundleEvaluationBlockNumbers,
                                         int poolRebalanceLeafCount,
                                         String poolRebalanceRoot,
                                         String relayerRefundRoot,
                                         String slowRelayRoot);

    /**
     * @return dispute tx id
     */
    String disputeRootBundle();

    /**
     * @return execution tx id
     */
    String executeRootBundle(PoolRebalanceLeaf leaf, List<String> proof);

    /**
     * True if the leaf of the proposal with {@code poolRebalanceRoot} has been executed on the hub.
     * A different pending root means the proposal was fully executed and replaced.
     */
    boolean isPoolRebalanceLeafExecuted(String poolRebalanceRoot, int leafId);
}
