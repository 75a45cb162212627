package dao.tron.rdist.model;

import lombok.Data;

@Data
public class ClaimRecord {

    private String identity;
    private long epoch;
    private String channel;
    private int index;
    private ClaimStatus status;
    /** Ledger transaction reference once known. */
    private String txRef;
    /** Incremented when a failed claim is retried. */
    private int attempts;
    private long updatedAt; // unix seconds

    public ClaimRecord copy() {
        ClaimRecord c = new ClaimRecord();
        c.setIdentity(identity);
        c.setEpoch(epoch);
        c.setChannel(channel);
        c.setIndex(index);
        c.setStatus(status);
        c.setTxRef(txRef);
        c.setAttempts(attempts);
        c.setUpdatedAt(updatedAt);
        return c;
    }
}
