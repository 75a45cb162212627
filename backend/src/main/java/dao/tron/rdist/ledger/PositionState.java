package dao.tron.rdist.ledger;

import java.math.BigInteger;

/**
 * Channel staking position as reported by the contract.
 *
 * @param lockEnd unix seconds at which an active position may be rolled over
 */
public record PositionState(
        boolean paused,
        BigInteger pendingDeposits,
        BigInteger pendingWithdrawals,
        boolean active,
        long lockEnd
) {

    public BigInteger stakeable() {
        return pendingDeposits.subtract(pendingWithdrawals).max(BigInteger.ZERO);
    }

    /**
     * Compounding needs stakeable deposits or an active position to roll over, and an active
     * position must be past its lock.
     */
    public boolean isCompoundable(long nowSeconds) {
        if (paused) return false;
        if (stakeable().signum() == 0 && !active) return false;
        return !active || lockEnd <= nowSeconds;
    }
}
