package dao.tron.rdist.repository;

import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.RejectedEpoch;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySealedEpochRepository implements SealedEpochRepository {

    // key: (epoch, channel)
    private final Map<EpochKey, SealedEpoch> epochsByKey = new ConcurrentHashMap<>();

    // key: (epoch, channel) -> participants ordered by index
    private final Map<EpochKey, List<SealedParticipant>> participantsByKey = new ConcurrentHashMap<>();

    // key: (epoch, channel) -> terminal seal rejection
    private final Map<EpochKey, RejectedEpoch> rejectedByKey = new ConcurrentHashMap<>();

    // key: participantId -> epochs the participant is sealed into
    private final Map<String, Map<EpochKey, SealedParticipant>> byParticipant = new ConcurrentHashMap<>();

    @Override
    public synchronized SealedEpoch saveSealed(SealedEpoch epoch, List<SealedParticipant> participants) {
        EpochKey key = epoch.key();
        SealedEpoch existing = epochsByKey.get(key);
        if (existing != null) {
            return existing.copy();
        }
        if (participants.size() != epoch.getParticipantCount()) {
            throw new IllegalArgumentException("participantCount=" + epoch.getParticipantCount()
                    + " but " + participants.size() + " participants given for " + key);
        }
        for (int i = 0; i < participants.size(); i++) {
            SealedParticipant p = participants.get(i);
            if (p.index() != i || p.epoch() != key.epoch() || !p.channel().equals(key.channel())) {
                throw new IllegalArgumentException("participant " + p + " out of place at position " + i + " of " + key);
            }
        }

        // Participants become visible through the epoch row, which is written last
        participantsByKey.put(key, List.copyOf(participants));
        for (SealedParticipant p : participants) {
            byParticipant.computeIfAbsent(p.participantId(), id -> new ConcurrentHashMap<>()).put(key, p);
        }
        epochsByKey.put(key, epoch.copy());
        return epoch.copy();
    }

    @Override
    public Optional<SealedEpoch> find(EpochKey key) {
        SealedEpoch e = epochsByKey.get(key);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public List<SealedParticipant> findParticipants(EpochKey key) {
        if (!epochsByKey.containsKey(key)) return List.of();
        return participantsByKey.getOrDefault(key, List.of());
    }

    @Override
    public List<SealedParticipant> findByParticipant(String participantId) {
        Map<EpochKey, SealedParticipant> rows = byParticipant.get(participantId);
        if (rows == null) return List.of();
        List<SealedParticipant> out = new ArrayList<>();
        for (Map.Entry<EpochKey, SealedParticipant> e : rows.entrySet()) {
            if (epochsByKey.containsKey(e.getKey())) {
                out.add(e.getValue());
            }
        }
        out.sort(Comparator.comparing(SealedParticipant::channel).thenComparingLong(SealedParticipant::epoch));
        return out;
    }

    @Override
    public List<SealedEpoch> findAll() {
        List<SealedEpoch> out = new ArrayList<>();
        for (SealedEpoch e : epochsByKey.values()) out.add(e.copy());
        out.sort(Comparator.comparing(SealedEpoch::key));
        return out;
    }

    @Override
    public List<SealedEpoch> findUnpublished(String channel) {
        List<SealedEpoch> out = new ArrayList<>();
        for (SealedEpoch e : epochsByKey.values()) {
            if (!e.isPublished() && e.getChannel().equals(channel)) out.add(e.copy());
        }
        out.sort(Comparator.comparingLong(SealedEpoch::getEpoch));
        return out;
    }

    @Override
    public Optional<Long> findLatestSealedEpoch(String channel) {
        return epochsByKey.keySet().stream()
                .filter(k -> k.channel().equals(channel))
                .map(EpochKey::epoch)
                .max(Long::compare);
    }

    @Override
    public synchronized boolean markPublished(EpochKey key, String publishTxId, long publishedAt) {
        SealedEpoch e = epochsByKey.get(key);
        if (e == null) {
            throw new IllegalArgumentException("Sealed epoch not found: " + key);
        }
        if (e.isPublished()) {
            return false;
        }
        SealedEpoch updated = e.copy();
        updated.setPublished(true);
        updated.setPublishTxId(publishTxId);
        updated.setPublishedAt(publishedAt);
        epochsByKey.put(key, updated);
        return true;
    }

    @Override
    public synchronized boolean saveRejected(RejectedEpoch rejected) {
        if (epochsByKey.containsKey(rejected.key())) {
            throw new IllegalArgumentException("Epoch " + rejected.key() + " is already sealed");
        }
        return rejectedByKey.putIfAbsent(rejected.key(), rejected) == null;
    }

    @Override
    public Optional<RejectedEpoch> findRejected(EpochKey key) {
        return Optional.ofNullable(rejectedByKey.get(key));
    }

    @Override
    public List<RejectedEpoch> findAllRejected() {
        List<RejectedEpoch> out = new ArrayList<>(rejectedByKey.values());
        out.sort(Comparator.comparing(RejectedEpoch::key));
        return out;
    }
}
