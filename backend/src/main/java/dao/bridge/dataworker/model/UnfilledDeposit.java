package dao.bridge.dataworker.model;

import java.math.BigInteger;

/**
 * Deposit with a positive remainder not yet covered by valid fills. Derived on every pass, never stored.
 */
public record UnfilledDeposit(Deposit deposit, BigInteger unfilledAmount) {

    public UnfilledDeposit {
        if (unfilledAmount == null || unfilledAmount.signum() <= 0) {
            throw new IllegalArgumentException("unfilledAmount must be positive for deposit "
                    + (deposit == null ? "null" : deposit.originChainId() + "/" + deposit.depositId()));
        }
    }
}
