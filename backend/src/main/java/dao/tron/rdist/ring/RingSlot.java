package dao.tron.rdist.ring;

import dao.tron.rdist.util.CryptoUtil;

import java.util.Arrays;

/**
 * One slot of a channel ring. Bit {@code i} of the claim bitmap lives in byte {@code i / 8}
 * at position {@code i % 8}, the layout the ring contract uses.
 * Not thread-safe; guarded by the owning {@link ChannelRing}.
 */
final class RingSlot {

    private final int slotIndex;
    private final byte[] claimedBitmap;
    private boolean occupied;
    private long epoch;
    private byte[] root;
    private int claimCount;
    private long occupiedSeq;

    RingSlot(int slotIndex, int maxClaims) {
        this.slotIndex = slotIndex;
        this.claimedBitmap = new byte[Math.max(1, maxClaims / 8)];
    }

    void reset(long epoch, byte[] root, int claimCount, long occupiedSeq) {
        this.occupied = true;
        this.epoch = epoch;
        this.root = root.clone();
        this.claimCount = claimCount;
        this.occupiedSeq = occupiedSeq;
        Arrays.fill(claimedBitmap, (byte) 0);
    }

    boolean testBit(int index) {
        return (claimedBitmap[index / 8] & (1 << (index % 8))) != 0;
    }

    void setBit(int index) {
        claimedBitmap[index / 8] |= (byte) (1 << (index % 8));
    }

    int claimedCount() {
        int n = 0;
        for (byte b : claimedBitmap) n += Integer.bitCount(b & 0xff);
        return n;
    }

    boolean isOccupied() {
        return occupied;
    }

    boolean holds(long epoch) {
        return occupied && this.epoch == epoch;
    }

    int slotIndex() {
        return slotIndex;
    }

    long epoch() {
        return epoch;
    }

    byte[] root() {
        return root.clone();
    }

    int claimCount() {
        return claimCount;
    }

    long occupiedSeq() {
        return occupiedSeq;
    }

    SlotView view(String channel) {
        return new SlotView(channel, slotIndex, epoch, CryptoUtil.toHex0x(root), claimCount, claimedCount());
    }
}
