package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 升级异常基类
 * <p>
 * 所有阶段性错误都继承该类，并携带 {@link FailureInfo}，编排器据此决定终止还是回滚。
 */
public class UpgradeException extends RuntimeException {

    private final transient FailureInfo failureInfo;

    public UpgradeException(ErrorType errorType, String message) {
        super(message);
        this.failureInfo = FailureInfo.of(errorType, message);
    }

    public UpgradeException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.failureInfo = FailureInfo.of(errorType, message);
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public ErrorType getErrorType() {
        return failureInfo.getErrorType();
    }
}
