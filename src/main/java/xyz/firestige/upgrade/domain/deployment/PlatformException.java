package xyz.firestige.upgrade.domain.deployment;

/**
 * 容器平台调用异常
 * <p>
 * retryable 为 true 表示瞬时故障（例如实例启动慢），驱动会在有限次数内重试。
 */
public class PlatformException extends RuntimeException {

    private final boolean retryable;

    public PlatformException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PlatformException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
