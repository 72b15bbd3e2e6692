package xyz.firestige.upgrade.facade.exception;

import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;

/**
 * 升级操作异常
 * 当升级 / 回滚 / 取消 / 放弃等操作无法执行时抛出
 */
public class UpgradeOperationException extends RuntimeException {

    private final FailureInfo failureInfo;

    public UpgradeOperationException(String message, FailureInfo failureInfo) {
        super(message);
        this.failureInfo = failureInfo;
    }

    public UpgradeOperationException(String message, FailureInfo failureInfo, Throwable cause) {
        super(message, cause);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
