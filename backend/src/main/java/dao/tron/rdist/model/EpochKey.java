package dao.tron.rdist.model;

import java.util.Comparator;

/**
 * Identifies one channel's epoch.
 */
public record EpochKey(long epoch, String channel) implements Comparable<EpochKey> {

    private static final Comparator<EpochKey> ORDER =
            Comparator.comparing(EpochKey::channel).thenComparingLong(EpochKey::epoch);

    @Override
    public int compareTo(EpochKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return channel + "#" + epoch;
    }
}
