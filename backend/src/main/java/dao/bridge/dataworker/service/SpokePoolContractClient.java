package dao.bridge.dataworker.service;

import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RelayerRefundLeaf;

import java.util.List;
import java.util.OptionalLong;

public interface SpokePoolContractClient {

    /**
     * @return execution tx hash on the leaf's chain
     */
    String executeRelayerRefundLeaf(long rootBundleId, RelayerRefundLeaf leaf, List<String> proof);

    /**
     * @return execution tx hash on the deposit's destination chain
     */
    String executeSlowRelayLeaf(long rootBundleId, RelayData leaf, List<String> proof);

    boolean isRelayerRefundLeafExecuted(int chainId, long rootBundleId, int leafId);

    /**
     * Index the spoke pool on {@code chainId} assigned when the hub relayed a root bundle with these
     * roots. Empty until the hub has executed the pool rebalance leaf for that chain.
     */
    OptionalLong findRelayedRootBundleId(int chainId, String relayerRefundRoot, String slowRelayRoot);

    /**
     * True once the relay has been filled in full on its destination chain, by a slow fill or otherwise.
     */
    boolean isSlowRelayLeafExecuted(RelayData leaf);
}
