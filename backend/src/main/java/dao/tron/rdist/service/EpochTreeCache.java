package dao.tron.rdist.service;

import dao.tron.rdist.exception.DistributorErrorCode;
import dao.tron.rdist.exception.IntegrityException;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import dao.tron.rdist.repository.SealedEpochRepository;
import dao.tron.rdist.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trees of sealed epochs, rebuilt from the sealed participants on demand. A rebuilt root that
 * differs from the sealed root is never cached and never served.
 */
@Slf4j
@Component
public class EpochTreeCache {

    private final SealedEpochRepository repository;
    private final MerkleTreeService merkleTreeService;
    private final Clock clock;
    private final Map<EpochKey, CachedTree> trees = new ConcurrentHashMap<>();

    public EpochTreeCache(SealedEpochRepository repository, MerkleTreeService merkleTreeService, Clock clock) {
        this.repository = repository;
        this.merkleTreeService = merkleTreeService;
        this.clock = clock;
    }

    public CachedTree get(SealedEpoch sealed) {
        CachedTree cached = trees.get(sealed.key());
        if (cached != null) return cached;
        CachedTree built = rebuild(sealed);
        CachedTree raced = trees.putIfAbsent(sealed.key(), built);
        return raced != null ? raced : built;
    }

    /**
     * Recompute the tree from the sealed participants, bypassing the cache.
     *
     * @throws IntegrityException when the recomputed root differs from the sealed one
     */
    public CachedTree rebuild(SealedEpoch sealed) {
        List<SealedParticipant> participants = repository.findParticipants(sealed.key());
        if (participants.size() != sealed.getParticipantCount()) {
            throw new IntegrityException(DistributorErrorCode.ROOT_MISMATCH,
                    "sealed " + sealed.key() + " lists " + sealed.getParticipantCount()
                            + " participants but " + participants.size() + " are stored");
        }
        List<List<byte[]>> levels = merkleTreeService.buildLevels(merkleTreeService.leafHashes(participants));
        byte[] root = merkleTreeService.rootOf(levels);
        byte[] expected = CryptoUtil.fromHex32(sealed.getRootHex());
        if (!Arrays.equals(root, expected)) {
            throw new IntegrityException(DistributorErrorCode.ROOT_MISMATCH,
                    "rebuilt root " + CryptoUtil.toHex0x(root) + " != sealed root " + sealed.getRootHex()
                            + " for " + sealed.key());
        }
        log.debug("Rebuilt tree for {}: leaves={}, depth={}", sealed.key(), participants.size(), levels.size());
        return new CachedTree(sealed.getEpoch(), sealed.getChannel(), root, levels,
                participants.size(), clock.instant().getEpochSecond());
    }

    public void evict(EpochKey key) {
        trees.remove(key);
    }

    public void clear() {
        trees.clear();
    }

    public int size() {
        return trees.size();
    }
}
