package xyz.firestige.upgrade.infrastructure.execution;

import org.junit.jupiter.api.Test;
import xyz.firestige.upgrade.domain.deployment.PlatformException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedRetryTest {

    @Test
    void retriesTransientFailuresUntilSuccess() {
        BoundedRetry retry = new BoundedRetry(3, Duration.ofMillis(1));
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("start", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new PlatformException("slow start", true);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        BoundedRetry retry = new BoundedRetry(2, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        PlatformException e = assertThrows(PlatformException.class, () -> retry.run("pull", () -> {
            calls.incrementAndGet();
            throw new PlatformException("registry timeout", true);
        }));

        assertEquals("registry timeout", e.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void permanentFailureIsNotRetried() {
        BoundedRetry retry = new BoundedRetry(5, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(PlatformException.class, () -> retry.run("rm", () -> {
            calls.incrementAndGet();
            throw new PlatformException("no such container", false);
        }));
        assertThrows(IllegalStateException.class, () -> retry.run("other", () -> {
            throw new IllegalStateException("bug");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedRetry(0, Duration.ZERO));
    }
}
