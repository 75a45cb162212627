package dao.tron.rdist.keeper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Advisory per-channel lock so two keeper passes never work the same channel at once.
 * Holders are identified by an owner token; only the owner can release.
 */
@Slf4j
@Component
public class ChannelLock {

    private final Map<String, String> owners = new ConcurrentHashMap<>();

    public Optional<Lease> tryAcquire(String channel, String instanceId) {
        String token = instanceId + ":" + UUID.randomUUID();
        String current = owners.putIfAbsent(channel, token);
        if (current != null) {
            log.debug("Channel {} is locked by {}", channel, current);
            return Optional.empty();
        }
        return Optional.of(new Lease(channel, token));
    }

    public boolean isLocked(String channel) {
        return owners.containsKey(channel);
    }

    public final class Lease implements AutoCloseable {
        private final String channel;
        private final String token;

        private Lease(String channel, String token) {
            this.channel = channel;
            this.token = token;
        }

        public String token() {
            return token;
        }

        @Override
        public void close() {
            if (!owners.remove(channel, token)) {
                log.warn("Lock for channel {} was not held by {}", channel, token);
            }
        }
    }
}
