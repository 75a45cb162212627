package dao.tron.rdist.keeper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChannelLockTest {

    private final ChannelLock lock = new ChannelLock();

    @Test
    @DisplayName("Only one holder per channel until the lease closes")
    void testExclusive() {
        Optional<ChannelLock.Lease> first = lock.tryAcquire("alpha", "keeper-1");
        assertTrue(first.isPresent());
        assertTrue(lock.isLocked("alpha"));

        assertTrue(lock.tryAcquire("alpha", "keeper-2").isEmpty());
        assertTrue(lock.tryAcquire("beta", "keeper-2").isPresent(), "other channels are independent");

        first.get().close();
        assertFalse(lock.isLocked("alpha"));
        assertTrue(lock.tryAcquire("alpha", "keeper-2").isPresent());
    }

    @Test
    @DisplayName("A stale lease cannot release a newer holder")
    void testStaleRelease() {
        ChannelLock.Lease stale = lock.tryAcquire("alpha", "keeper-1").orElseThrow();
        stale.close();
        ChannelLock.Lease current = lock.tryAcquire("alpha", "keeper-2").orElseThrow();

        stale.close();

        assertTrue(lock.isLocked("alpha"));
        assertTrue(current.token().startsWith("keeper-2:"));
    }

    @Test
    @DisplayName("Try-with-resources releases the channel")
    void testTryWithResources() {
        try (ChannelLock.Lease lease = lock.tryAcquire("alpha", "keeper-1").orElseThrow()) {
            assertTrue(lock.isLocked("alpha"));
        }
        assertFalse(lock.isLocked("alpha"));
    }
}
