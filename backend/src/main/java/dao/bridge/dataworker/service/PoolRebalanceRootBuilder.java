package dao.bridge.dataworker.service;

import dao.bridge.dataworker.config.BundleProperties;
import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;
import dao.bridge.dataworker.model.PoolRebalanceLeaf;
import dao.bridge.dataworker.model.ReconciledBundleData;
import dao.bridge.dataworker.model.RunningBalanceEntry;
import dao.bridge.dataworker.model.UnfilledDeposit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Pool-rebalance aggregation, protocol v1.
 * <p>
 * Per (chainId, l1Token) with activity in the bundle:
 * <pre>
 * slowRelayAmount = sum(unfilledAmount) of deposits bound for chainId in l1Token
 * refundAmount    = sum(fillAmount) of valid fills repaid on chainId in l1Token
 * bundleLpFee     = sum(floor(x * realizedLpFeePct / 1e18)) over both sets, floored per item
 * candidate       = priorRunningBalance + slowRelayAmount + refundAmount
 * candidate >= transferThreshold and candidate > 0 : netSend = candidate, runningBalance = 0
 * otherwise                                        : netSend = 0, runningBalance = candidate
 * </pre>
 * Refunds add to the amount owed: relayers are repaid out of the spoke's own balance, which the
 * hub then replenishes, the same as it funds slow relays.
 * <p>
 * Tokens inside a chain are ordered by address and split into leaves of at most
 * {@code bundle.max-l1-tokens-per-pool-rebalance-leaf}, numbered by groupIndex. The hub takes
 * leaf ids and the leaf count as uint8, so a root holds at most {@link #MAX_LEAVES} leaves.
 */
@Slf4j
@Service
public class PoolRebalanceRootBuilder {

    static final BigInteger FIXED_POINT_ONE = BigInteger.TEN.pow(18);

    public static final int MAX_LEAVES = 255;

    private final MerkleTreeService merkleTreeService;
    private final LeafCodec leafCodec;
    private final TokenRouteResolver tokenRoutes;
    private final BundleProperties bundleProps;

    public PoolRebalanceRootBuilder(MerkleTreeService merkleTreeService,
                                    LeafCodec leafCodec,
                                    TokenRouteResolver tokenRoutes,
                                    BundleProperties bundleProps) {
        this.merkleTreeService = merkleTreeService;
        this.leafCodec = leafCodec;
        this.tokenRoutes = tokenRoutes;
        this.bundleProps = bundleProps;
    }

    private static final class Totals {
        BigInteger slowRelayAmount = BigInteger.ZERO;
        BigInteger refundAmount = BigInteger.ZERO;
        BigInteger lpFee = BigInteger.ZERO;
    }

    /**
     * @param priorBalances running balances committed before this bundle; missing keys are zero
     * @param version       ledger version the resulting entries will be committed under
     */
    public PoolRebalanceRoot build(ReconciledBundleData data, Map<BalanceKey, BigInteger> priorBalances, long version) {
        int maxTokensPerLeaf = bundleProps.getMaxL1TokensPerPoolRebalanceLeaf();
        if (maxTokensPerLeaf < 1) {
            throw new IllegalStateException("bundle.max-l1-tokens-per-pool-rebalance-leaf must be >= 1");
        }

        SortedMap<BalanceKey, Totals> totals = new TreeMap<>();

        for (List<UnfilledDeposit> perDestination : data.unfilledDeposits().values()) {
            for (UnfilledDeposit u : perDestination) {
                Deposit d = u.deposit();
                String l1Token = tokenRoutes.l1TokenFor(d.destinationChainId(), d.destinationToken());
                Totals t = totals.computeIfAbsent(new BalanceKey(d.destinationChainId(), l1Token), k -> new Totals());
                t.slowRelayAmount = t.slowRelayAmount.add(u.unfilledAmount());
                t.lpFee = t.lpFee.add(lpFee(u.unfilledAmount(), d.realizedLpFeePct()));
            }
        }

        for (Fill fill : data.fillsToRefund().allFills()) {
            String l1Token = tokenRoutes.l1TokenFor(fill.destinationChainId(), fill.destinationToken());
            Totals t = totals.computeIfAbsent(new BalanceKey(fill.repaymentChainId(), l1Token), k -> new Totals());
            t.refundAmount = t.refundAmount.add(fill.fillAmount());
            t.lpFee = t.lpFee.add(lpFee(fill.fillAmount(), fill.realizedLpFeePct()));
        }

        if (totals.isEmpty()) {
            log.debug("No bundle activity, pool rebalance root is empty");
            return new PoolRebalanceRoot(RootBuildResult.empty(), List.of());
        }

        List<RunningBalanceEntry> entries = new ArrayList<>(totals.size());
        for (Map.Entry<BalanceKey, Totals> e : totals.entrySet()) {
            BalanceKey key = e.getKey();
            Totals t = e.getValue();
            BigInteger prior = priorBalances.getOrDefault(key, BigInteger.ZERO);
            BigInteger bundleAmount = t.slowRelayAmount.add(t.refundAmount);
            BigInteger candidate = prior.add(bundleAmount);
            BigInteger threshold = tokenRoutes.transferThreshold(key.l1Token());

            BigInteger netSend;
            BigInteger newBalance;
            if (candidate.signum() > 0 && candidate.compareTo(threshold) >= 0) {
                netSend = candidate;
                newBalance = BigInteger.ZERO;
            } else {
                netSend = BigInteger.ZERO;
                newBalance = candidate;
            }
            entries.add(new RunningBalanceEntry(key, version, prior, bundleAmount, t.lpFee, netSend, newBalance));
        }

        List<PoolRebalanceLeaf> leaves = toLeaves(entries, maxTokensPerLeaf);
        if (leaves.size() > MAX_LEAVES) {
            throw new IllegalStateException("Pool rebalance root needs " + leaves.size() + " leaves, the hub accepts at most "
                    + MAX_LEAVES + ". Raise bundle.max-l1-tokens-per-pool-rebalance-leaf or propose a smaller block range");
        }
        MerkleTree<PoolRebalanceLeaf> tree = merkleTreeService.build(leaves, leafCodec::hashPoolRebalanceLeaf);

        for (RunningBalanceEntry entry : entries) {
            log.info("Running balance transition v{}: chainId={}, l1Token={}, prior={}, bundleAmount={}, lpFee={}, netSend={}, new={}",
                    version, entry.key().chainId(), entry.key().l1Token(), entry.priorBalance(),
                    entry.bundleAmount(), entry.bundleLpFee(), entry.netSendAmount(), entry.newBalance());
        }
        log.debug("Pool rebalance root built: leaves={}, root={}", leaves.size(), tree.getRootHex());
        return new PoolRebalanceRoot(RootBuildResult.of(tree), entries);
    }

    // entries arrive sorted by (chainId, l1Token)
    private static List<PoolRebalanceLeaf> toLeaves(List<RunningBalanceEntry> entries, int maxTokensPerLeaf) {
        SortedMap<Integer, List<RunningBalanceEntry>> byChain = new TreeMap<>();
        for (RunningBalanceEntry e : entries) {
            byChain.computeIfAbsent(e.key().chainId(), k -> new ArrayList<>()).add(e);
        }

        List<PoolRebalanceLeaf> leaves = new ArrayList<>();
        byChain.forEach((chainId, chainEntries) -> {
            int groupIndex = 0;
            for (int from = 0; from < chainEntries.size(); from += maxTokensPerLeaf) {
                List<RunningBalanceEntry> group = chainEntries.subList(from, Math.min(from + maxTokensPerLeaf, chainEntries.size()));
                leaves.add(new PoolRebalanceLeaf(
                        leaves.size(),
                        chainId,
                        groupIndex++,
                        group.stream().map(e -> e.key().l1Token()).toList(),
                        group.stream().map(RunningBalanceEntry::bundleLpFee).toList(),
                        group.stream().map(RunningBalanceEntry::netSendAmount).toList(),
                        group.stream().map(RunningBalanceEntry::newBalance).toList()
                ));
            }
        });
        return leaves;
    }

    static BigInteger lpFee(BigInteger amount, BigInteger realizedLpFeePct) {
        if (realizedLpFeePct == null) return BigInteger.ZERO;
        return amount.multiply(realizedLpFeePct).divide(FIXED_POINT_ONE);
    }
}
