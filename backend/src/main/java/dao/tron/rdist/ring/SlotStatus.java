package dao.tron.rdist.ring;

public enum SlotStatus {
    /** The epoch never occupied a slot. */
    EMPTY,
    OCCUPIED,
    /** The epoch's slot was taken by a newer epoch. Irreversible. */
    EVICTED
}
