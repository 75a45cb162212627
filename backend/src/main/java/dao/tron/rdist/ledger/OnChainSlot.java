package dao.tron.rdist.ledger;

/**
 * What the contract holds for (channel, epoch). {@code present} is false once the slot was
 * recycled or before the root was ever published.
 */
public record OnChainSlot(
        boolean present,
        String rootHex,
        int claimCount,
        int slotIndex
) {
    public static OnChainSlot absent() {
        return new OnChainSlot(false, null, 0, -1);
    }
}
