package xyz.firestige.upgrade.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;

import java.time.Duration;

/**
 * 有界轮询
 * <p>
 * 固定次数 + 固定间隔 + 截止时间三重约束，任何一项耗尽即停止。
 * 检查抛出异常计为一次失败的尝试，不会中断轮询。
 */
public final class BoundedPolling {

    private static final Logger log = LoggerFactory.getLogger(BoundedPolling.class);

    /**
     * 轮询条件
     */
    @FunctionalInterface
    public interface PollCondition {
        /**
         * @return true 表示条件满足（停止轮询）
         */
        boolean check() throws Exception;
    }

    /**
     * 轮询结果
     */
    public record PollResult(boolean satisfied, int attempts, String lastError) {
    }

    private BoundedPolling() {
    }

    public static PollResult poll(String name, PollCondition condition, int maxAttempts, Duration interval, Deadline deadline) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        int attempts = 0;
        String lastError = null;
        while (attempts < maxAttempts) {
            attempts++;
            try {
                if (condition.check()) {
                    log.debug("轮询成功: {}, attempts={}", name, attempts);
                    return new PollResult(true, attempts, null);
                }
                lastError = "not ready";
                log.debug("轮询未就绪: {}, attempts={}/{}", name, attempts, maxAttempts);
            } catch (Exception e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("轮询检查异常: {}, attempts={}, error={}", name, attempts, lastError);
            }

            if (attempts >= maxAttempts || deadline.isExpired()) {
                break;
            }
            Duration sleep = deadline.cap(interval);
            if (!sleep.isZero()) {
                try {
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new PollResult(false, attempts, "interrupted");
                }
            }
            if (deadline.isExpired()) {
                break;
            }
        }
        log.warn("轮询结束且未满足条件: {}, attempts={}, lastError={}", name, attempts, lastError);
        return new PollResult(false, attempts, lastError);
    }
}
