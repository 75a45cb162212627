package dao.tron.rdist.event;

/**
 * Decoded RootPublished event of the reward ring contract.
 *
 * Solidity:
 * event RootPublished(bytes32 indexed channelId, uint64 indexed epoch, bytes32 root, uint32 claimCount, uint32 slot);
 */
public record RootPublishedEvent(
        String channelIdHex,
        long epoch,
        String rootHex,
        int claimCount,
        int slotIndex
) {}
