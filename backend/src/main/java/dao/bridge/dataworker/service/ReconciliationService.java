package dao.bridge.dataworker.service;

import dao.bridge.dataworker.client.SpokePoolClient;
import dao.bridge.dataworker.client.SpokePoolClients;
import dao.bridge.dataworker.config.BundleProperties;
import dao.bridge.dataworker.exception.ReconciliationAbortedException;
import dao.bridge.dataworker.exception.StaleChainStateException;
import dao.bridge.dataworker.model.BundleBlockRange;
import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;
import dao.bridge.dataworker.model.FillsToRefund;
import dao.bridge.dataworker.model.ReconciledBundleData;
import dao.bridge.dataworker.model.UnfilledDeposit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * Reconciles deposits against fills across every ordered pair of spoke chains.
 * <p>
 * Reads only what the spoke pool clients have already cached, so it assumes those clients were
 * updated beforehand. Output is rebuilt on every call and is independent of event ordering.
 */
@Slf4j
@Service
public class ReconciliationService {

    private static final Comparator<UnfilledDeposit> UNFILLED_ORDER = Comparator
            .comparingInt((UnfilledDeposit u) -> u.deposit().originChainId())
            .thenComparingLong(u -> u.deposit().depositId());

    private static final Comparator<Fill> FILL_ORDER = Comparator
            .comparingInt(Fill::originChainId)
            .thenComparingLong(Fill::depositId)
            .thenComparingLong(Fill::blockNumber)
            .thenComparing(Fill::fillAmount)
            .thenComparing(Fill::totalFilledAmount, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final SpokePoolClients spokePoolClients;
    private final int maxParallel;
    private final ExecutorService executor;

    public ReconciliationService(SpokePoolClients spokePoolClients, BundleProperties bundleProps) {
        this.spokePoolClients = spokePoolClients;
        // Bounded by chain count anyway; cap avoids accidental fan-out on large chain sets.
        this.maxParallel = Math.max(1, Math.min(8, bundleProps.getReconciliationMaxParallel()));
        this.executor = Executors.newFixedThreadPool(maxParallel);
    }

    public ReconciledBundleData loadData() {
        return loadData(BundleBlockRange.unbounded());
    }

    public ReconciledBundleData loadData(BundleBlockRange range) {
        return loadData(range, () -> false);
    }

    /**
     * @param abortRequested polled between chain pairs; once true the pass throws
     *                       {@link ReconciliationAbortedException} and returns nothing
     */
    public ReconciledBundleData loadData(BundleBlockRange range, BooleanSupplier abortRequested) {
        List<Integer> chainIds = spokePoolClients.chainIds();
        log.debug("Loading deposit and fill data: chainIds={}, range={}", chainIds, range.ranges());

        for (Integer chainId : chainIds) {
            if (!spokePoolClients.get(chainId).isUpdated()) {
                throw new StaleChainStateException(chainId, "spoke");
            }
        }

        List<OriginResult> results = maxParallel == 1 || chainIds.size() <= 1
                ? loadSequential(chainIds, range, abortRequested)
                : loadParallel(chainIds, range, abortRequested);

        checkAbort(abortRequested, "before merge");

        SortedMap<Integer, List<UnfilledDeposit>> unfilledDeposits = new TreeMap<>();
        List<Fill> validFills = new ArrayList<>();
        for (OriginResult r : results) {
            r.unfilled().forEach((destination, list) ->
                    unfilledDeposits.computeIfAbsent(destination, k -> new ArrayList<>()).addAll(list));
            validFills.addAll(r.validFills());
        }
        unfilledDeposits.replaceAll((destination, list) -> {
            List<UnfilledDeposit> sorted = new ArrayList<>(list);
            sorted.sort(UNFILLED_ORDER);
            return Collections.unmodifiableList(sorted);
        });

        validFills.sort(FILL_ORDER);
        FillsToRefund fillsToRefund = new FillsToRefund();
        validFills.forEach(fillsToRefund::add);

        log.info("Reconciled {} chains: unfilledDeposits={}, validFills={}",
                chainIds.size(),
                unfilledDeposits.values().stream().mapToInt(List::size).sum(),
                validFills.size());
        return new ReconciledBundleData(Collections.unmodifiableSortedMap(unfilledDeposits), fillsToRefund);
    }

    private List<OriginResult> loadSequential(List<Integer> chainIds, BundleBlockRange range, BooleanSupplier abort) {
        List<OriginResult> results = new ArrayList<>();
        for (Integer origin : chainIds) {
            results.add(loadOrigin(origin, chainIds, range, abort));
        }
        return results;
    }

    private List<OriginResult> loadParallel(List<Integer> chainIds, BundleBlockRange range, BooleanSupplier abort) {
        List<CompletableFuture<OriginResult>> futures = new ArrayList<>();
        for (Integer origin : chainIds) {
            futures.add(CompletableFuture.supplyAsync(() -> loadOrigin(origin, chainIds, range, abort), executor));
        }

        List<OriginResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<OriginResult> f : futures) {
                results.add(f.get());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new ReconciliationAbortedException("Reconciliation interrupted");
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Reconciliation failed: " + e.getCause().getMessage(), e.getCause());
        }
        return results;
    }

    private OriginResult loadOrigin(int originChainId, List<Integer> chainIds, BundleBlockRange range,
                                    BooleanSupplier abort) {
        SpokePoolClient originClient = spokePoolClients.get(originChainId);
        SortedMap<Integer, List<UnfilledDeposit>> unfilled = new TreeMap<>();
        List<Fill> validFills = new ArrayList<>();
        long originEnd = range.endBlock(originChainId);

        for (Integer destinationChainId : chainIds) {
            if (destinationChainId == originChainId) continue;
            checkAbort(abort, "origin " + originChainId + " -> destination " + destinationChainId);

            SpokePoolClient destinationClient = spokePoolClients.get(destinationChainId);
            long destinationEnd = range.endBlock(destinationChainId);

            // Older deposits stay matchable: a fill in this range may satisfy a deposit from an earlier bundle.
            List<Deposit> deposits = originClient.getDepositsForDestinationChain(destinationChainId).stream()
                    .filter(d -> d.blockNumber() <= originEnd)
                    .toList();
            log.debug("Found {} deposits for destination chain {}: originChainId={}",
                    deposits.size(), destinationChainId, originChainId);

            List<UnfilledDeposit> unfilledForDestination = new ArrayList<>();
            for (Deposit deposit : deposits) {
                if (!range.contains(originChainId, deposit.blockNumber())) continue;
                BigInteger remaining = destinationClient.getValidUnfilledAmountForDeposit(deposit, destinationEnd);
                if (remaining.signum() > 0) {
                    unfilledForDestination.add(new UnfilledDeposit(deposit, remaining));
                }
            }
            if (unfilledForDestination.isEmpty()) {
                log.debug("All deposits are filled: originChainId={}, destinationChainId={}",
                        originChainId, destinationChainId);
            } else {
                unfilled.put(destinationChainId, unfilledForDestination);
            }

            int matched = 0;
            for (Fill fill : destinationClient.getFills()) {
                // Slow relays are never refunded, even when a zero relayer fee makes them look valid.
                if (fill.isSlowRelay()) continue;
                if (!range.contains(destinationChainId, fill.blockNumber())) continue;
                if (matchesAny(destinationClient, fill, deposits)) {
                    validFills.add(fill);
                    matched++;
                }
            }
            log.debug("Found {} fills on destination {} matching origin {}", matched, destinationChainId, originChainId);
        }
        return new OriginResult(unfilled, validFills);
    }

    private static boolean matchesAny(SpokePoolClient destinationClient, Fill fill, List<Deposit> deposits) {
        for (Deposit deposit : deposits) {
            if (destinationClient.validateFillForDeposit(fill, deposit)) return true;
        }
        return false;
    }

    private static void checkAbort(BooleanSupplier abort, String where) {
        if (abort.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new ReconciliationAbortedException("Reconciliation aborted (" + where + ")");
        }
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        executor.shutdown();
    }

    private record OriginResult(SortedMap<Integer, List<UnfilledDeposit>> unfilled, List<Fill> validFills) {}
}
