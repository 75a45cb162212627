package dao.tron.rdist.ring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * K slots of one channel plus the epochs they already lost. Callers synchronize on the instance.
 * <p>
 * Only the most recent evictions are kept by epoch. Older ones fold into a low-water mark: an
 * epoch at or below it that is not in a slot counts as evicted.
 */
final class ChannelRing {

    static final int MIN_EVICTED_RETENTION = 16;

    private final String channel;
    private final RingSlot[] slots;
    private final TreeSet<Long> evictedEpochs = new TreeSet<>();
    private final int evictedRetention;
    private long evictedBelow = -1;
    private long nextSeq = 1;
    private long latestEpoch = -1;

    ChannelRing(String channel, int slotCount, int maxClaims) {
        this.channel = channel;
        this.slots = new RingSlot[slotCount];
        this.evictedRetention = Math.max(MIN_EVICTED_RETENTION, 4 * slotCount);
        for (int i = 0; i < slotCount; i++) {
            slots[i] = new RingSlot(i, maxClaims);
        }
    }

    Optional<RingSlot> slotFor(long epoch) {
        for (RingSlot s : slots) {
            if (s.holds(epoch)) return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Only meaningful for an epoch that {@link #slotFor} does not hold.
     */
    boolean wasEvicted(long epoch) {
        return evictedEpochs.contains(epoch) || epoch <= evictedBelow;
    }

    RingSlot chooseSlot(long epoch, SlotPolicy policy) {
        if (policy == SlotPolicy.EPOCH_MODULO) {
            return slots[(int) Math.floorMod(epoch, (long) slots.length)];
        }
        for (RingSlot s : slots) {
            if (!s.isOccupied()) return s;
        }
        RingSlot oldest = slots[0];
        for (RingSlot s : slots) {
            if (s.occupiedSeq() < oldest.occupiedSeq()) oldest = s;
        }
        return oldest;
    }

    void occupy(RingSlot slot, long epoch, byte[] root, int claimCount) {
        if (slot.isOccupied()) {
            evictedEpochs.add(slot.epoch());
            while (evictedEpochs.size() > evictedRetention) {
                evictedBelow = Math.max(evictedBelow, evictedEpochs.pollFirst());
            }
        }
        slot.reset(epoch, root, claimCount, nextSeq++);
        latestEpoch = Math.max(latestEpoch, epoch);
    }

    List<RingSlot> occupiedByAge() {
        List<RingSlot> out = new ArrayList<>();
        for (RingSlot s : slots) {
            if (s.isOccupied()) out.add(s);
        }
        out.sort(Comparator.comparingLong(RingSlot::occupiedSeq));
        return out;
    }

    int emptyCount() {
        int n = 0;
        for (RingSlot s : slots) {
            if (!s.isOccupied()) n++;
        }
        return n;
    }

    int evictedTracked() {
        return evictedEpochs.size();
    }

    long evictedBelow() {
        return evictedBelow;
    }

    int size() {
        return slots.length;
    }

    long latestEpoch() {
        return latestEpoch;
    }

    String channel() {
        return channel;
    }
}
