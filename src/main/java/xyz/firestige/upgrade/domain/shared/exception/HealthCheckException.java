package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 健康检查异常，重试预算耗尽后才会抛出
 */
public class HealthCheckException extends UpgradeException {

    public HealthCheckException(String message) {
        super(ErrorType.HEALTH_CHECK_ERROR, message);
    }

    public HealthCheckException(String message, Throwable cause) {
        super(ErrorType.HEALTH_CHECK_ERROR, message, cause);
    }
}
