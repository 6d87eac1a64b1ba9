package dao.bridge.dataworker.service;

import dao.bridge.dataworker.exception.BundleNotFoundException;
import dao.bridge.dataworker.exception.BundleStateException;
import dao.bridge.dataworker.ledger.RunningBalanceLedger;
import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.BundleValidationResult;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.model.RootComparison;
import dao.bridge.dataworker.model.RootType;
import dao.bridge.dataworker.model.StoredLeaf;
import dao.bridge.dataworker.model.StoredRoot;
import dao.bridge.dataworker.repository.BundleRepository;
import dao.bridge.dataworker.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * Propose, validate and dispute. Leaf execution lives in {@link ExecutionService}.
 */
@Slf4j
@Service
public class BundleService {

    private static final Set<BundleStatus> PENDING = EnumSet.of(
            BundleStatus.BUILDING, BundleStatus.PROPOSED, BundleStatus.VALIDATED, BundleStatus.EXECUTING);

    private final RootBundleService rootBundleService;
    private final HubPoolContractClient hubClient;
    private final BundleRepository bundleRepository;
    private final RunningBalanceLedger ledger;
    private final BundleLocks locks;

    public BundleService(RootBundleService rootBundleService,
                         HubPoolContractClient hubClient,
                         BundleRepository bundleRepository,
                         RunningBalanceLedger ledger,
                         BundleLocks locks) {
        this.rootBundleService = rootBundleService;
        this.hubClient = hubClient;
        this.bundleRepository = bundleRepository;
        this.ledger = ledger;
        this.locks = locks;
    }

    /**
     * Reconcile, build all three roots, submit them to the hub, then persist the bundle and commit
     * its running balances. Any failure before the hub accepts the proposal leaves no trace.
     *
     * @throws BundleStateException if an earlier bundle is still pending on the hub
     */
    public synchronized LocalBundle propose(BundleBlockRange range) {
        if (range.ranges().isEmpty()) {
            throw new IllegalArgumentException("Block range must cover at least one chain");
        }
        for (LocalBundle existing : bundleRepository.findAll()) {
            if (PENDING.contains(existing.getStatus())) {
                throw new BundleStateException(existing.getLocalId(), existing.getStatus(), "propose over");
            }
        }

        Map<BalanceKey, BigInteger> prior = ledger.latestBalances();
        BundleRoots roots = rootBundleService.buildAll(range, prior, RootBundleService.PREVIEW_VERSION);

        ProposalSubmission submission = hubClient.proposeRootBundle(
                range.evaluationBlockNumbers(),
                roots.poolRebalance().result().leaves().size(),
                roots.poolRebalance().rootHex(),
                roots.relayerRefund().rootHex(),
                roots.slowRelay().rootHex()
        );

        // ids are only spent on proposals the hub accepted; ledger entries are re-versioned on commit
        long localId = bundleRepository.reserveLocalId();
        LocalBundle bundle = new LocalBundle();
        bundle.setLocalId(localId);
        bundle.setBlockRange(range);
        bundle.setProposeTxId(submission.proposeTxId());
        bundle.setProposedAt(submission.proposedAt());
        bundle.setChallengePeriodEnd(submission.challengePeriodEnd());
        bundle.setPoolRebalanceRoot(toStoredRoot(RootType.POOL_REBALANCE, roots.poolRebalance().result()));
        bundle.setRelayerRefundRoot(toStoredRoot(RootType.RELAYER_REFUND, roots.relayerRefund()));
        bundle.setSlowRelayRoot(toStoredRoot(RootType.SLOW_RELAY, roots.slowRelay()));
        bundle.setStatus(BundleStatus.PROPOSED);

        bundleRepository.save(bundle);
        ledger.commit(localId, roots.poolRebalance().entries());

        log.info("Bundle {} proposed: tx={}, challengePeriodEnd={}, poolRebalance={} ({} leaves), relayerRefund={} ({} leaves), slowRelay={} ({} leaves)",
                localId, submission.proposeTxId(), submission.challengePeriodEnd(),
                bundle.getPoolRebalanceRoot().getRootHex(), bundle.getPoolRebalanceRoot().getLeaves().size(),
                bundle.getRelayerRefundRoot().getRootHex(), bundle.getRelayerRefundRoot().getLeaves().size(),
                bundle.getSlowRelayRoot().getRootHex(), bundle.getSlowRelayRoot().getLeaves().size());
        return bundle;
    }

    /**
     * Recompute a locally stored bundle against the running balances it was built on.
     * A full match moves a PROPOSED bundle to VALIDATED; a mismatch leaves the status untouched.
     */
    public BundleValidationResult validate(long bundleId) {
        LocalBundle bundle = getBundle(bundleId);
        Lock lock = locks.forBundle(bundleId).writeLock();
        lock.lock();
        try {
            if (bundle.getStatus() == BundleStatus.BUILDING) {
                throw new BundleStateException(bundleId, bundle.getStatus(), "validate");
            }

            BundleRoots expected = rootBundleService.buildAll(
                    bundle.getBlockRange(), ledger.balancesBefore(bundleId), bundleId);
            BundleValidationResult result = compare(bundle.getBlockRange(), expected,
                    bundle.getPoolRebalanceRoot().getRootHex(),
                    bundle.getRelayerRefundRoot().getRootHex(),
                    bundle.getSlowRelayRoot().getRootHex());

            if (result.isValid()) {
                if (bundle.getStatus() == BundleStatus.PROPOSED) {
                    bundle.setStatus(BundleStatus.VALIDATED);
                    bundleRepository.save(bundle);
                }
                log.info("Bundle {} validated: all roots match", bundleId);
            } else {
                log.warn("Bundle {} validation failed: mismatched roots={}", bundleId, result.mismatchedRoots());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validate roots proposed by someone else for {@code range} against the latest committed balances.
     */
    public BundleValidationResult validate(BundleBlockRange range,
                                           String claimedPoolRebalanceRoot,
                                           String claimedRelayerRefundRoot,
                                           String claimedSlowRelayRoot) {
        BundleRoots expected = rootBundleService.buildAll(range, ledger.latestBalances(), RootBundleService.PREVIEW_VERSION);
        BundleValidationResult result = compare(range, expected,
                claimedPoolRebalanceRoot, claimedRelayerRefundRoot, claimedSlowRelayRoot);
        if (!result.isValid()) {
            log.warn("Claimed roots for range {} mismatch: {}", range.ranges(), result.mismatchedRoots());
        }
        return result;
    }

    /**
     * Dispute a pending proposal on the hub and drop its running balances.
     */
    public LocalBundle dispute(long bundleId) {
        LocalBundle bundle = getBundle(bundleId);
        Lock lock = locks.forBundle(bundleId).writeLock();
        lock.lock();
        try {
            if (bundle.getStatus() != BundleStatus.PROPOSED && bundle.getStatus() != BundleStatus.VALIDATED) {
                throw new BundleStateException(bundleId, bundle.getStatus(), "dispute");
            }
            String txId = hubClient.disputeRootBundle();
            bundle.setStatus(BundleStatus.DISPUTED);
            bundleRepository.save(bundle);
            ledger.revert(bundleId);
            log.info("Bundle {} disputed: tx={}", bundleId, txId);
            return bundle;
        } finally {
            lock.unlock();
        }
    }

    public List<LocalBundle> getBundles() {
        return bundleRepository.findAll();
    }

    /**
     * Most recent bundle that was not disputed. Its block range is where the next proposal starts.
     */
    public Optional<LocalBundle> getLatestActiveBundle() {
        return bundleRepository.findLatestActive();
    }

    public boolean hasPendingBundle() {
        return bundleRepository.findAll().stream().anyMatch(b -> PENDING.contains(b.getStatus()));
    }

    public LocalBundle getBundle(long bundleId) {
        return bundleRepository.findByLocalId(bundleId)
                .orElseThrow(() -> new BundleNotFoundException(bundleId));
    }

    private static BundleValidationResult compare(BundleBlockRange range,
                                                  BundleRoots expected,
                                                  String claimedPoolRebalanceRoot,
                                                  String claimedRelayerRefundRoot,
                                                  String claimedSlowRelayRoot) {
        // every root is compared, even after a mismatch
        List<RootComparison> comparisons = new ArrayList<>(3);
        comparisons.add(compareRoot(RootType.POOL_REBALANCE, expected.rootHex(RootType.POOL_REBALANCE), claimedPoolRebalanceRoot));
        comparisons.add(compareRoot(RootType.RELAYER_REFUND, expected.rootHex(RootType.RELAYER_REFUND), claimedRelayerRefundRoot));
        comparisons.add(compareRoot(RootType.SLOW_RELAY, expected.rootHex(RootType.SLOW_RELAY), claimedSlowRelayRoot));
        return new BundleValidationResult(range, comparisons);
    }

    private static RootComparison compareRoot(RootType type, String expectedRoot, String claimedRoot) {
        boolean matches = claimedRoot != null
                && HexUtil.normalizeHex32(expectedRoot).equals(HexUtil.normalizeHex32(claimedRoot));
        return new RootComparison(type, expectedRoot, claimedRoot, matches);
    }

    static <L> StoredRoot<L> toStoredRoot(RootType type, RootBuildResult<L> result) {
        StoredRoot<L> root = new StoredRoot<>();
        root.setRootType(type);
        root.setEmpty(result.isEmpty());
        root.setRootHex(result.rootHex());

        List<StoredLeaf<L>> leaves = new ArrayList<>();
        result.tree().ifPresent(tree -> {
            for (int i = 0; i < tree.size(); i++) {
                StoredLeaf<L> st = new StoredLeaf<>();
                st.setLeafId(i);
                st.setLeaf(tree.getLeaves().get(i));
                st.setProof(tree.proofFor(i));
                leaves.add(st);
            }
        });
        root.setLeaves(leaves);
        return root;
    }
}
