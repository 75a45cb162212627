package dao.tron.rdist.ledger;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Round-robin over ledger endpoints. An endpoint that fails is skipped for the cool-down period;
 * if every endpoint is cooling down, the one that recovers soonest is returned.
 */
@Slf4j
public class EndpointPool<T> {

    private final List<Member<T>> members;
    private final long cooldownMs;
    private final Clock clock;
    private int lastUsed = -1;

    public EndpointPool(List<Member<T>> members, long cooldownMs, Clock clock) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("endpoint pool needs at least one endpoint");
        }
        this.members = List.copyOf(members);
        this.cooldownMs = cooldownMs;
        this.clock = clock;
    }

    public synchronized Member<T> next() {
        long now = clock.millis();
        List<Member<T>> healthy = new ArrayList<>();
        for (Member<T> m : members) {
            if (m.cooldownUntil <= now) healthy.add(m);
        }
        if (!healthy.isEmpty()) {
            lastUsed = (lastUsed + 1) % healthy.size();
            return healthy.get(lastUsed);
        }
        return members.stream().min(Comparator.comparingLong(m -> m.cooldownUntil)).orElseThrow();
    }

    public synchronized void reportFailure(Member<T> member, Throwable error) {
        member.cooldownUntil = clock.millis() + cooldownMs;
        log.warn("Ledger endpoint {} failed ({}); cooling down for {}s",
                member.getName(), error.getMessage(), cooldownMs / 1000);
    }

    public synchronized int healthyCount() {
        long now = clock.millis();
        int n = 0;
        for (Member<T> m : members) {
            if (m.cooldownUntil <= now) n++;
        }
        return n;
    }

    public List<Member<T>> members() {
        return members;
    }

    @Getter
    public static final class Member<T> {
        private final String name;
        private final T client;
        private long cooldownUntil;

        public Member(String name, T client) {
            this.name = name;
            this.client = client;
        }
    }
}
