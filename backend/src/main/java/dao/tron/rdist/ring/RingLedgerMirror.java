package dao.tron.rdist.ring;

import dao.tron.rdist.config.RingProperties;
import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.exception.PolicyException;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Off-chain model of the contract's per-channel ring buffer: K slots, each holding one published
 * epoch's root and a claim bitmap over up to C leaves.
 * <p>
 * Publishing into a full ring evicts a slot; its unclaimed leaves are forfeited for good.
 */
@Slf4j
@Component
public class RingLedgerMirror {

    private final int slotCount;
    private final int maxClaims;
    private final SlotPolicy policy;
    private final Map<String, ChannelRing> rings = new ConcurrentHashMap<>();

    public RingLedgerMirror(RingProperties props) {
        this.slotCount = props.getSlots();
        this.maxClaims = props.getMaxClaims();
        this.policy = props.getSlotPolicy();
        log.info("RingLedgerMirror initialized: slots={}, maxClaims={}, policy={}", slotCount, maxClaims, policy);
    }

    public int getMaxClaims() {
        return maxClaims;
    }

    public int getSlotCount() {
        return slotCount;
    }

    /**
     * Records a published root. Returns the slot that was overwritten, if any.
     * Occupying again with the same (epoch, root) changes nothing.
     */
    public Optional<SlotView> occupy(String channel, long epoch, byte[] root, int claimCount) {
        if (claimCount < 0 || claimCount > maxClaims) {
            throw new PolicyException(DistributorErrorCode.CAPACITY_EXCEEDED,
                    "claimCount=" + claimCount + " exceeds ring capacity " + maxClaims + " for " + channel + "#" + epoch);
        }
        if (root == null || root.length != CryptoUtil.HASH_BYTES) {
            throw new IllegalArgumentException("root must be 32 bytes");
        }

        ChannelRing ring = ring(channel);
        synchronized (ring) {
            Optional<RingSlot> current = ring.slotFor(epoch);
            if (current.isPresent()) {
                if (!Arrays.equals(current.get().root(), root)) {
                    throw new IntegrityException(DistributorErrorCode.SLOT_CONFLICT,
                            "slot " + current.get().slotIndex() + " of " + channel + " holds epoch " + epoch
                                    + " with root " + CryptoUtil.toHex0x(current.get().root())
                                    + ", refusing " + CryptoUtil.toHex0x(root));
                }
                return Optional.empty();
            }
            if (ring.wasEvicted(epoch)) {
                throw new PolicyException(DistributorErrorCode.SLOT_EVICTED,
                        "epoch " + epoch + " of " + channel + " was already evicted");
            }

            RingSlot slot = ring.chooseSlot(epoch, policy);
            Optional<SlotView> evicted = slot.isOccupied() ? Optional.of(slot.view(channel)) : Optional.empty();
            ring.occupy(slot, epoch, root, claimCount);

            evicted.ifPresent(e -> {
                if (e.unclaimedCount() > 0) {
                    log.warn("Ring slot evicted with unclaimed rewards: channel={}, slot={}, evictedEpoch={}, unclaimed={}, newEpoch={}",
                            channel, e.slotIndex(), e.epoch(), e.unclaimedCount(), epoch);
                } else {
                    log.info("Ring slot recycled: channel={}, slot={}, evictedEpoch={}, newEpoch={}",
                            channel, e.slotIndex(), e.epoch(), epoch);
                }
            });
            return evicted;
        }
    }

    public SlotStatus statusOf(String channel, long epoch) {
        ChannelRing ring = rings.get(channel);
        if (ring == null) return SlotStatus.EMPTY;
        synchronized (ring) {
            if (ring.slotFor(epoch).isPresent()) return SlotStatus.OCCUPIED;
            return ring.wasEvicted(epoch) ? SlotStatus.EVICTED : SlotStatus.EMPTY;
        }
    }

    public Optional<SlotView> find(String channel, long epoch) {
        ChannelRing ring = rings.get(channel);
        if (ring == null) return Optional.empty();
        synchronized (ring) {
            return ring.slotFor(epoch).map(s -> s.view(channel));
        }
    }

    /**
     * True when the epoch is occupied and its bit for {@code index} is set.
     */
    public boolean isClaimed(String channel, long epoch, int index) {
        checkIndex(index);
        ChannelRing ring = rings.get(channel);
        if (ring == null) return false;
        synchronized (ring) {
            return ring.slotFor(epoch).map(s -> s.testBit(index)).orElse(false);
        }
    }

    /**
     * Sets the claim bit. Returns false when it was already set.
     */
    public boolean markClaimed(String channel, long epoch, int index) {
        checkIndex(index);
        ChannelRing ring = ring(channel);
        synchronized (ring) {
            RingSlot slot = ring.slotFor(epoch).orElseThrow(() -> new PolicyException(
                    DistributorErrorCode.SLOT_EVICTED, "epoch " + epoch + " of " + channel + " is not in the ring"));
            if (index >= slot.claimCount()) {
                throw new IllegalArgumentException("index " + index + " >= claimCount " + slot.claimCount());
            }
            if (slot.testBit(index)) return false;
            slot.setBit(index);
            return true;
        }
    }

    public List<SlotView> slots(String channel) {
        ChannelRing ring = rings.get(channel);
        if (ring == null) return List.of();
        synchronized (ring) {
            List<SlotView> out = new ArrayList<>();
            for (RingSlot s : ring.occupiedByAge()) out.add(s.view(channel));
            out.sort(Comparator.comparingInt(SlotView::slotIndex));
            return out;
        }
    }

    /**
     * Occupied slots with unclaimed leaves that will be overwritten within {@code maxDistance}
     * further publishes on their channel.
     */
    public List<EvictionRisk> slotsNearEviction(int maxDistance) {
        List<EvictionRisk> out = new ArrayList<>();
        for (ChannelRing ring : rings.values()) {
            synchronized (ring) {
                List<RingSlot> byAge = ring.occupiedByAge();
                int empty = ring.emptyCount();
                for (int rank = 0; rank < byAge.size(); rank++) {
                    RingSlot s = byAge.get(rank);
                    int unclaimed = s.claimCount() - s.claimedCount();
                    if (unclaimed <= 0) continue;
                    int distance = evictionsAway(ring, s, rank, empty);
                    if (distance <= maxDistance) {
                        out.add(new EvictionRisk(ring.channel(), s.epoch(), s.slotIndex(), distance, unclaimed));
                    }
                }
            }
        }
        out.sort(Comparator.comparingInt(EvictionRisk::evictionsAway).thenComparing(EvictionRisk::channel));
        return out;
    }

    private int evictionsAway(ChannelRing ring, RingSlot slot, int ageRank, int emptySlots) {
        if (policy == SlotPolicy.EPOCH_MODULO) {
            // The next epoch landing here is slot.epoch + K
            long away = slot.epoch() + ring.size() - ring.latestEpoch();
            return (int) Math.max(1, Math.min(Integer.MAX_VALUE, away));
        }
        return emptySlots + ageRank + 1;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= maxClaims) {
            throw new IllegalArgumentException("index " + index + " outside ring capacity " + maxClaims);
        }
    }

    private ChannelRing ring(String channel) {
        return rings.computeIfAbsent(channel, c -> new ChannelRing(c, slotCount, maxClaims));
    }
}
