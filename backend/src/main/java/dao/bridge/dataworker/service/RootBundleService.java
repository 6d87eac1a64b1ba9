package dao.bridge.dataworker.service;

import dao.bridge.dataworker.ledger.RunningBalanceLedger;
import dao.bridge.dataworker.model.BalanceKey;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.ReconciledBundleData;
import dao.bridge.dataworker.model.RelayData;
import dao.bridge.dataworker.model.RelayerRefundLeaf;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Root-construction entry points. Each call reconciles from the spoke pool clients' current
 * caches; nothing is retained between calls.
 */
@Slf4j
@Service
public class RootBundleService {

    /** Version stamped on entries not committed yet. {@link RunningBalanceLedger#commit} re-versions them. */
    public static final long PREVIEW_VERSION = 0L;

    private final ReconciliationService reconciliationService;
    private final SlowRelayRootBuilder slowRelayRootBuilder;
    private final RelayerRefundRootBuilder relayerRefundRootBuilder;
    private final PoolRebalanceRootBuilder poolRebalanceRootBuilder;
    private final RunningBalanceLedger ledger;

    public RootBundleService(ReconciliationService reconciliationService,
                             SlowRelayRootBuilder slowRelayRootBuilder,
                             RelayerRefundRootBuilder relayerRefundRootBuilder,
                             PoolRebalanceRootBuilder poolRebalanceRootBuilder,
                             RunningBalanceLedger ledger) {
        this.reconciliationService = reconciliationService;
        this.slowRelayRootBuilder = slowRelayRootBuilder;
        this.relayerRefundRootBuilder = relayerRefundRootBuilder;
        this.poolRebalanceRootBuilder = poolRebalanceRootBuilder;
        this.ledger = ledger;
    }

    public RootBuildResult<RelayData> buildSlowRelayRoot(BundleBlockRange range) {
        return slowRelayRootBuilder.build(reconciliationService.loadData(range).unfilledDeposits());
    }

    public RootBuildResult<RelayerRefundLeaf> buildRelayerRefundRoot(BundleBlockRange range) {
        return relayerRefundRootBuilder.build(reconciliationService.loadData(range).fillsToRefund());
    }

    /**
     * Pool-rebalance root against the latest committed running balances.
     */
    public PoolRebalanceRoot buildPoolRebalanceRoot(BundleBlockRange range) {
        return poolRebalanceRootBuilder.build(reconciliationService.loadData(range), ledger.latestBalances(), PREVIEW_VERSION);
    }

    public BundleRoots buildAll(BundleBlockRange range, Map<BalanceKey, BigInteger> priorBalances, long version) {
        return buildAll(range, priorBalances, version, () -> false);
    }

    public BundleRoots buildAll(BundleBlockRange range,
                                Map<BalanceKey, BigInteger> priorBalances,
                                long version,
                                BooleanSupplier abortRequested) {
        ReconciledBundleData data = reconciliationService.loadData(range, abortRequested);
        BundleRoots roots = new BundleRoots(
                slowRelayRootBuilder.build(data.unfilledDeposits()),
                relayerRefundRootBuilder.build(data.fillsToRefund()),
                poolRebalanceRootBuilder.build(data, priorBalances, version)
        );
        log.info("Bundle roots built (v{}): poolRebalance={}, relayerRefund={}, slowRelay={}",
                version, roots.poolRebalance().rootHex(), roots.relayerRefund().rootHex(), roots.slowRelay().rootHex());
        return roots;
    }
}
