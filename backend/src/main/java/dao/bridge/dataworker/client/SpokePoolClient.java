package dao.bridge.dataworker.client;

import dao.bridge.dataworker.model.Deposit;
import dao.bridge.dataworker.model.Fill;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only view of the events one spoke pool client has already cached.
 * Nothing here may be assumed about how or when the cache refreshes beyond {@link #isUpdated()}.
 */
public interface SpokePoolClient {

    int getChainId();

    /**
     * True once the client has fetched every event up to {@link #getLatestBlockNumber()}.
     */
    boolean isUpdated();

    long getLatestBlockNumber();

    /**
     * Deposits made on this chain whose destination is {@code destinationChainId}.
     */
    List<Deposit> getDepositsForDestinationChain(int destinationChainId);

    /**
     * Fills observed on this chain, slow relays included.
     */
    List<Fill> getFills();

    /**
     * Deposit amount minus the valid, non-slow fills seen on this chain up to {@code toBlock}.
     * Never negative.
     */
    BigInteger getValidUnfilledAmountForDeposit(Deposit deposit, long toBlock);

    default BigInteger getValidUnfilledAmountForDeposit(Deposit deposit) {
        return getValidUnfilledAmountForDeposit(deposit, Long.MAX_VALUE);
    }

    /**
     * Structural match of a fill against the deposit it claims to satisfy.
     */
    boolean validateFillForDeposit(Fill fill, Deposit deposit);
}
