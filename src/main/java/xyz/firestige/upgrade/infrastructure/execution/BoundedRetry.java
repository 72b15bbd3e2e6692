package xyz.firestige.upgrade.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.deployment.PlatformException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 有界重试：只重试标记为瞬时故障的 {@link PlatformException}
 * <p>
 * 固定次数、固定退避；其余异常立即抛出。
 */
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    private final int maxAttempts;
    private final Duration backoff;

    public BoundedRetry(int maxAttempts, Duration backoff) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff != null ? backoff : Duration.ZERO;
    }

    public <T> T call(String action, Supplier<T> operation) {
        PlatformException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (PlatformException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                log.warn("瞬时故障, action: {}, attempt: {}/{}, error: {}", action, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep();
                }
            }
        }
        log.error("重试次数耗尽, action: {}, attempts: {}", action, maxAttempts);
        throw last;
    }

    public void run(String action, Runnable operation) {
        call(action, () -> {
            operation.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void sleep() {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException("重试等待被中断", false, e);
        }
    }
}
