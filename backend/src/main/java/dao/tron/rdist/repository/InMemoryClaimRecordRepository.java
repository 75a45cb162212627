package dao.tron.rdist.repository;

import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimStatus;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryClaimRecordRepository implements ClaimRecordRepository {

    private record Key(String identity, long epoch, String channel) {}

    private final Map<Key, ClaimRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ClaimRecord> find(String identity, long epoch, String channel) {
        ClaimRecord r = records.get(new Key(identity, epoch, channel));
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public synchronized ClaimRecord insertIfAbsent(ClaimRecord record) {
        Key key = new Key(record.getIdentity(), record.getEpoch(), record.getChannel());
        ClaimRecord stored = records.putIfAbsent(key, record.copy());
        return stored == null ? record.copy() : stored.copy();
    }

    @Override
    public synchronized Optional<ClaimRecord> transition(String identity, long epoch, String channel,
                                                         ClaimStatus expected, ClaimStatus next, String txRef, long now) {
        Key key = new Key(identity, epoch, channel);
        ClaimRecord current = records.get(key);
        if (current == null || current.getStatus() != expected) {
            return Optional.empty();
        }
        ClaimRecord updated = current.copy();
        updated.setStatus(next);
        if (txRef != null) {
            updated.setTxRef(txRef);
        }
        if (expected == ClaimStatus.FAILED && next == ClaimStatus.PENDING) {
            updated.setAttempts(current.getAttempts() + 1);
            updated.setTxRef(null);
        }
        updated.setUpdatedAt(now);
        records.put(key, updated);
        return Optional.of(updated.copy());
    }

    @Override
    public List<ClaimRecord> findByStatus(ClaimStatus status) {
        List<ClaimRecord> out = new ArrayList<>();
        for (ClaimRecord r : records.values()) {
            if (r.getStatus() == status) out.add(r.copy());
        }
        return out;
    }

    @Override
    public List<ClaimRecord> findByIdentity(String identity) {
        List<ClaimRecord> out = new ArrayList<>();
        for (ClaimRecord r : records.values()) {
            if (r.getIdentity().equals(identity)) out.add(r.copy());
        }
        return out;
    }
}
