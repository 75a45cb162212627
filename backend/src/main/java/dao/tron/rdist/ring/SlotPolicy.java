package dao.tron.rdist.ring;

/**
 * How a newly published epoch picks its ring slot.
 */
public enum SlotPolicy {
    /** Take an empty slot, otherwise evict the slot occupied longest. */
    FIFO,
    /** slot = epoch mod K, as contracts that address slots by epoch do. */
    EPOCH_MODULO
}
