package dao.tron.rdist.ledger;

/**
 * Result of running a mutation as a constant call. Nothing is broadcast.
 */
public record LedgerSimulation(boolean success, long energyEstimate, String message) {

    public static LedgerSimulation ok(long energyEstimate) {
        return new LedgerSimulation(true, energyEstimate, "ok");
    }

    public static LedgerSimulation failed(String message) {
        return new LedgerSimulation(false, 0L, message);
    }
}
