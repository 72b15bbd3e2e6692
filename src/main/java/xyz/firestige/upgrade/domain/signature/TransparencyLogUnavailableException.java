package xyz.firestige.upgrade.domain.signature;

/**
 * 透明日志不可达
 * <p>
 * 按签名校验失败处理（硬停止），不作为可重试的瞬时故障。
 */
public class TransparencyLogUnavailableException extends RuntimeException {

    public TransparencyLogUnavailableException(String message) {
        super(message);
    }

    public TransparencyLogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
