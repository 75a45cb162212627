package dao.tron.rdist.repository;

import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.ParticipationRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryParticipationStore implements ParticipationStore {

    // key: (epoch, channel) -> rows in arrival order
    private final Map<EpochKey, List<ParticipationRecord>> rowsByKey = new ConcurrentHashMap<>();

    public void append(ParticipationRecord record) {
        rowsByKey.computeIfAbsent(record.key(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public List<ParticipationRecord> findByEpochAndChannel(long epoch, String channel) {
        List<ParticipationRecord> rows = rowsByKey.get(new EpochKey(epoch, channel));
        if (rows == null) return List.of();
        List<ParticipationRecord> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingLong(ParticipationRecord::firstSeen));
        return sorted;
    }

    @Override
    public Set<EpochKey> findEpochKeys() {
        return new TreeSet<>(rowsByKey.keySet());
    }

    @Override
    public Set<String> findChannels() {
        Set<String> channels = new TreeSet<>();
        for (EpochKey key : rowsByKey.keySet()) {
            channels.add(key.channel());
        }
        return channels;
    }
}
