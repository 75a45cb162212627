package dao.tron.rdist.ring;

/**
 * An occupied slot that still holds unclaimed leaves and will be overwritten after
 * {@code evictionsAway} more publishes on its channel.
 */
public record EvictionRisk(
        String channel,
        long epoch,
        int slotIndex,
        int evictionsAway,
        int unclaimedCount
) {}
