package dao.bridge.dataworker.service;

import dao.bridge.dataworker.config.SchedulerProperties;
import dao.bridge.dataworker.exception.BundleNotFoundException;
import dao.bridge.dataworker.exception.BundleStateException;
import dao.bridge.dataworker.exception.ProofConstructionException;
import dao.bridge.dataworker.model.BundleStatus;
import dao.bridge.dataworker.model.ExecutionReport;
import dao.bridge.dataworker.model.LeafStatus;
import dao.bridge.dataworker.model.LocalBundle;
import dao.bridge.dataworker.model.RootType;
import dao.bridge.dataworker.model.StoredLeaf;
import dao.bridge.dataworker.model.StoredRoot;
import dao.bridge.dataworker.repository.BundleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Executes the leaves of a validated bundle, one transaction per leaf. Idempotent: leaves already
 * executed locally or on-chain are skipped.
 */
@Slf4j
@Service
public class ExecutionService {

    private final HubPoolContractClient hubClient;
    private final SpokePoolContractClient spokeClient;
    private final MerkleTreeService merkleTreeService;
    private final LeafCodec leafCodec;
    private final BundleRepository bundleRepository;
    private final BundleLocks locks;
    private final ExecutorService executor;

    public ExecutionService(HubPoolContractClient hubClient,
                            SpokePoolContractClient spokeClient,
                            MerkleTreeService merkleTreeService,
                            LeafCodec leafCodec,
                            BundleRepository bundleRepository,
                            BundleLocks locks,
                            SchedulerProperties schedulerProps) {
        this.hubClient = hubClient;
        this.spokeClient = spokeClient;
        this.merkleTreeService = merkleTreeService;
        this.leafCodec = leafCodec;
        this.bundleRepository = bundleRepository;
        this.locks = locks;
        // Upper bound to avoid accidental massive fan-out; can be increased if needed.
        int threadSize = Math.max(1, Math.min(8, schedulerProps.getExecution().getMaxParallel()));
        this.executor = Executors.newFixedThreadPool(threadSize);
    }

    /**
     * Execute every root of the bundle, pool rebalance first so spoke pools have the relayed roots.
     */
    public List<ExecutionReport> executeAll(long bundleId) {
        List<ExecutionReport> reports = new ArrayList<>();
        for (RootType type : List.of(RootType.POOL_REBALANCE, RootType.RELAYER_REFUND, RootType.SLOW_RELAY)) {
            reports.add(execute(bundleId, type));
        }
        return reports;
    }

    /**
     * @throws BundleStateException unless the bundle is VALIDATED or EXECUTING
     */
    public ExecutionReport execute(long bundleId, RootType rootType) {
        LocalBundle bundle = bundleRepository.findByLocalId(bundleId)
                .orElseThrow(() -> new BundleNotFoundException(bundleId));
        ReadWriteLock bundleLock = locks.forBundle(bundleId);

        bundleLock.writeLock().lock();
        try {
            if (bundle.getStatus() == BundleStatus.VALIDATED) {
                bundle.setStatus(BundleStatus.EXECUTING);
                bundleRepository.save(bundle);
                log.info("Bundle {} executing", bundleId);
            } else if (bundle.getStatus() != BundleStatus.EXECUTING) {
                throw new BundleStateException(bundleId, bundle.getStatus(), "execute");
            }
        } finally {
            bundleLock.writeLock().unlock();
        }

        ExecutionReport report;
        Lock rootLock = locks.forRoot(bundleId, rootType);
        bundleLock.readLock().lock();
        rootLock.lock();
        try {
            report = switch (rootType) {
                case POOL_REBALANCE -> executeLeaves(bundle, rootType, bundle.getPoolRebalanceRoot(),
                        leafCodec::hashPoolRebalanceLeaf,
                        st -> hubClient.isPoolRebalanceLeafExecuted(bundle.getPoolRebalanceRoot().getRootHex(), st.getLeaf().leafId()),
                        (st, proof) -> hubClient.executeRootBundle(st.getLeaf(), proof));
                case RELAYER_REFUND -> executeLeaves(bundle, rootType, bundle.getRelayerRefundRoot(),
                        leafCodec::hashRelayerRefundLeaf,
                        st -> spokeClient.isRelayerRefundLeafExecuted(st.getLeaf().chainId(),
                                relayedRootBundleId(bundle, st.getLeaf().chainId()), st.getLeaf().leafId()),
                        (st, proof) -> spokeClient.executeRelayerRefundLeaf(
                                relayedRootBundleId(bundle, st.getLeaf().chainId()), st.getLeaf(), proof));
                case SLOW_RELAY -> executeLeaves(bundle, rootType, bundle.getSlowRelayRoot(),
                        leafCodec::hashRelayData,
                        st -> spokeClient.isSlowRelayLeafExecuted(st.getLeaf()),
                        (st, proof) -> spokeClient.executeSlowRelayLeaf(
                                relayedRootBundleId(bundle, st.getLeaf().destinationChainId()), st.getLeaf(), proof));
            };
        } finally {
            rootLock.unlock();
            bundleLock.readLock().unlock();
        }

        bundleLock.writeLock().lock();
        try {
            if (bundle.getStatus() == BundleStatus.EXECUTING && bundle.allLeavesExecuted()) {
                bundle.setStatus(BundleStatus.CLOSED);
                log.info("Bundle {} closed: all leaves executed", bundleId);
            }
            bundleRepository.save(bundle);
        } finally {
            bundleLock.writeLock().unlock();
        }

        log.info("Bundle {} {} execution finished: executed={}, skipped={}, failed={}",
                bundleId, rootType, report.executedLeaves(), report.skippedLeaves(), report.failedLeaves().keySet());
        return report;
    }

    private <L> ExecutionReport executeLeaves(LocalBundle bundle,
                                              RootType rootType,
                                              StoredRoot<L> root,
                                              Function<L, byte[]> leafHasher,
                                              Predicate<StoredLeaf<L>> executedOnChain,
                                              BiFunction<StoredLeaf<L>, List<String>, String> submit) {
        List<Integer> executed = Collections.synchronizedList(new ArrayList<>());
        List<Integer> skipped = Collections.synchronizedList(new ArrayList<>());
        Map<Integer, String> failed = Collections.synchronizedMap(new TreeMap<>());

        if (root == null || root.isEmpty()) {
            return new ExecutionReport(bundle.getLocalId(), rootType, List.of(), List.of(), Map.of());
        }
        if (root.getLeaves().isEmpty()) {
            ProofConstructionException e = new ProofConstructionException(rootType,
                    "stored root " + root.getRootHex() + " has no persisted leaves");
            log.error("Bundle {} cannot be executed: {}", bundle.getLocalId(), e.getMessage());
            return new ExecutionReport(bundle.getLocalId(), rootType, List.of(), List.of(),
                    Map.of(ExecutionReport.WHOLE_ROOT, e.getMessage()));
        }

        List<StoredLeaf<L>> leaves = root.getLeaves();

        // Proofs come from the persisted leaves, never from a fresh reconciliation.
        MerkleTree<L> tree = null;
        String treeError = null;
        try {
            tree = merkleTreeService.build(leaves.stream().map(StoredLeaf::getLeaf).toList(), leafHasher);
        } catch (RuntimeException e) {
            treeError = e.getMessage();
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < leaves.size(); i++) {
            StoredLeaf<L> st = leaves.get(i);
            if (st.isExecuted()) {
                skipped.add(st.getLeafId());
                continue;
            }
            int index = i;
            MerkleTree<L> builtTree = tree;
            String builtTreeError = treeError;
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    if (executedOnChain.test(st)) {
                        st.setStatus(LeafStatus.EXECUTED);
                        skipped.add(st.getLeafId());
                        log.info("{} leaf {} of bundle {} already executed on-chain", rootType, st.getLeafId(), bundle.getLocalId());
                        return;
                    }
                    List<String> proof = verifiedProof(rootType, root, builtTree, builtTreeError, st, index);
                    String txId = submit.apply(st, proof);
                    st.setExecutionTxId(txId);
                    st.setStatus(LeafStatus.EXECUTED);
                    executed.add(st.getLeafId());
                    log.info("{} leaf {} of bundle {} executed: tx={}", rootType, st.getLeafId(), bundle.getLocalId(), txId);
                } catch (ProofConstructionException e) {
                    failed.put(st.getLeafId(), e.getMessage());
                    log.error("Proof construction failed: {}", e.getMessage());
                } catch (Exception e) {
                    failed.put(st.getLeafId(), e.getMessage());
                    log.error("{} leaf {} of bundle {} execution failed: {}", rootType, st.getLeafId(), bundle.getLocalId(), e.getMessage());
                }
            }, executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Integer> executedSorted = new ArrayList<>(executed);
        Collections.sort(executedSorted);
        List<Integer> skippedSorted = new ArrayList<>(skipped);
        Collections.sort(skippedSorted);
        return new ExecutionReport(bundle.getLocalId(), rootType, executedSorted, skippedSorted, new TreeMap<>(failed));
    }

    /**
     * Spoke pools number root bundles in the order the hub relays them, so the id is looked up per
     * chain and cached once found.
     *
     * @throws IllegalStateException while the hub has not relayed the bundle to the chain yet
     */
    private long relayedRootBundleId(LocalBundle bundle, int chainId) {
        Long cached = bundle.getRelayedRootBundleIds().get(chainId);
        if (cached != null) {
            return cached;
        }
        OptionalLong found = spokeClient.findRelayedRootBundleId(chainId,
                bundle.getRelayerRefundRoot().getRootHex(), bundle.getSlowRelayRoot().getRootHex());
        if (found.isEmpty()) {
            throw new IllegalStateException("Bundle " + bundle.getLocalId() + " not relayed to chain " + chainId + " yet");
        }
        bundle.getRelayedRootBundleIds().put(chainId, found.getAsLong());
        log.info("Bundle {} relayed to chain {} as rootBundleId={}", bundle.getLocalId(), chainId, found.getAsLong());
        return found.getAsLong();
    }

    private <L> List<String> verifiedProof(RootType rootType,
                                           StoredRoot<L> root,
                                           MerkleTree<L> tree,
                                           String treeError,
                                           StoredLeaf<L> st,
                                           int index) {
        if (tree == null) {
            throw new ProofConstructionException(rootType, st.getLeafId(), "cannot rebuild tree from persisted leaves: " + treeError);
        }
        List<String> proof = tree.proofFor(index);
        if (!merkleTreeService.verifyProof(tree.leafHash(index), proof, root.getRootHex())) {
            throw new ProofConstructionException(rootType, st.getLeafId(),
                    "proof does not verify against stored root " + root.getRootHex());
        }
        return proof;
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
