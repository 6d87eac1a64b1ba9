package dao.bridge.dataworker.client;

import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Spoke pool client backed by an in-process event cache. The ingestion layer appends events
 * and flips the updated flag; the dataworker only reads.
 */
@Slf4j
public class InMemorySpokePoolClient implements SpokePoolClient {

    private final int chainId;
    private final List<Deposit> deposits = new CopyOnWriteArrayList<>();
    private final List<Fill> fills = new CopyOnWriteArrayList<>();
    private volatile boolean updated;
    private volatile long latestBlockNumber;

    public InMemorySpokePoolClient(int chainId) {
        this.chainId = chainId;
    }

    public void addDeposit(Deposit deposit) {
        if (deposit.originChainId() != chainId) {
            throw new IllegalArgumentException("Deposit from chain " + deposit.originChainId()
                    + " cannot be stored on spoke " + chainId);
        }
        deposits.add(deposit);
        latestBlockNumber = Math.max(latestBlockNumber, deposit.blockNumber());
    }

    public void addFill(Fill fill) {
        if (fill.destinationChainId() != chainId) {
            throw new IllegalArgumentException("Fill for chain " + fill.destinationChainId()
                    + " cannot be stored on spoke " + chainId);
        }
        fills.add(fill);
        latestBlockNumber = Math.max(latestBlockNumber, fill.blockNumber());
    }

    public void setUpdated(boolean updated) {
        this.updated = updated;
    }

    public void setLatestBlockNumber(long latestBlockNumber) {
        this.latestBlockNumber = latestBlockNumber;
    }

    @Override
    public int getChainId() {
        return chainId;
    }

    @Override
    public boolean isUpdated() {
        return updated;
    }

    @Override
    public long getLatestBlockNumber() {
        return latestBlockNumber;
    }

    @Override
    public List<Deposit> getDepositsForDestinationChain(int destinationChainId) {
        return deposits.stream()
                .filter(d -> d.destinationChainId() == destinationChainId)
                .toList();
    }

    @Override
    public List<Fill> getFills() {
        return List.copyOf(fills);
    }

    @Override
    public BigInteger getValidUnfilledAmountForDeposit(Deposit deposit, long toBlock) {
        BigInteger filled = BigInteger.ZERO;
        for (Fill fill : fills) {
            if (fill.isSlowRelay() || fill.blockNumber() > toBlock) continue;
            if (validateFillForDeposit(fill, deposit)) {
                filled = filled.add(fill.fillAmount());
            }
        }
        BigInteger remaining = deposit.amount().subtract(filled);
        if (remaining.signum() < 0) {
            log.warn("Deposit {}/{} overfilled by {} on chain {}",
                    deposit.originChainId(), deposit.depositId(), remaining.negate(), chainId);
            return BigInteger.ZERO;
        }
        return remaining;
    }

    @Override
    public boolean validateFillForDeposit(Fill fill, Deposit deposit) {
        return fill.depositId() == deposit.depositId()
                && fill.originChainId() == deposit.originChainId()
                && fill.destinationChainId() == deposit.destinationChainId()
                && Objects.equals(fill.amount(), deposit.amount())
                && Objects.equals(fill.relayerFeePct(), deposit.relayerFeePct())
                && Objects.equals(fill.realizedLpFeePct(), deposit.realizedLpFeePct())
                && sameAddress(fill.depositor(), deposit.depositor())
                && sameAddress(fill.recipient(), deposit.recipient())
                && sameAddress(fill.destinationToken(), deposit.destinationToken());
    }

    private static boolean sameAddress(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }
}
