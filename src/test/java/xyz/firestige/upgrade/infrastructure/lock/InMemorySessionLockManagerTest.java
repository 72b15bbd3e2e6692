package xyz.firestige.upgrade.infrastructure.lock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionLockManagerTest {

    @Test
    void acquireReleaseAndHolder() {
        InMemorySessionLockManager locks = new InMemorySessionLockManager();

        assertTrue(locks.tryAcquire("edge", "upgrade-a", Duration.ofMinutes(1)));
        assertFalse(locks.tryAcquire("edge", "upgrade-b", Duration.ofMinutes(1)));
        assertEquals("upgrade-a", locks.holder("edge"));

        locks.release("edge", "upgrade-b");
        assertTrue(locks.isHeld("edge"));

        locks.release("edge", "upgrade-a");
        assertFalse(locks.isHeld("edge"));
        assertNull(locks.holder("edge"));
        assertFalse(locks.renew("edge", "upgrade-a", Duration.ofMinutes(1)));
    }
}
