package dao.bridge.dataworker.event;

import java.util.List;

/**
 * DTO representing the HubPool ProposeRootBundle event.
 *
 * Solidity:
 * event ProposeRootBundle(uint32 challengePeriodEndTimestamp, uint8 poolRebalanceLeafCount,
 *     uint256[] bundleEvaluationBlockNumbers, bytes32 indexed poolRebalanceRoot,
 *     bytes32 indexed relayerRefundRoot, bytes32 slowRelayRoot, address indexed proposer);
 */
public record RootBundleProposedEvent(
        long challengePeriodEndTimestamp,
        int poolRebalanceLeafCount,
        List<Long> bundleEvaluationBlockNumbers,
        String poolRebalanceRoot,
        String relayerRefundRoot,
        String slowRelayRoot,
        String proposer
) {}
