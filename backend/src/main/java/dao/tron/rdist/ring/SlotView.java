package dao.tron.rdist.ring;

/**
 * Read-only snapshot of one ring slot.
 */
public record SlotView(
        String channel,
        int slotIndex,
        long epoch,
        String rootHex,
        int claimCount,
        int claimedCount
) {
    public int unclaimedCount() {
        return claimCount - claimedCount;
    }
}
