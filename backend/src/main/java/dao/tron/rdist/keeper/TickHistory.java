package dao.tron.rdist.keeper;

import dao.tron.rdist.config.KeeperProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;

@Component
public class TickHistory {

    private final int capacity;
    private final Deque<TickReport> reports = new ArrayDeque<>();
    private long lastSuccessAt = -1;

    public TickHistory(KeeperProperties props) {
        this.capacity = Math.max(1, props.getHistorySize());
    }

    public synchronized void record(TickReport report) {
        reports.addFirst(report);
        while (reports.size() > capacity) {
            reports.removeLast();
        }
        if (report.isSuccess()) {
            lastSuccessAt = report.getFinishedAt();
        }
    }

    /**
     * Newest first.
     */
    public synchronized List<TickReport> recent() {
        return new ArrayList<>(reports);
    }

    public synchronized OptionalLong lastSuccessAt() {
        return lastSuccessAt < 0 ? OptionalLong.empty() : OptionalLong.of(lastSuccessAt);
    }
}
