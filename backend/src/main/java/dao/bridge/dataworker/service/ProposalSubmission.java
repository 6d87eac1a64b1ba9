package dao.bridge.dataworker.service;

/**
 * Result of proposeRootBundle() including txId and the on-chain challenge window.
 */
public record ProposalSubmission(
        String proposeTxId,
        String poolRebalanceRoot,
        String relayerRefundRoot,
        String slowRelayRoot,
        int poolRebalanceLeafCount,
        long proposedAt,
        long challengePeriodEnd
) {}
