package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 回滚异常
 * <p>
 * 由部署驱动抛出时表示驱动级回滚无法恢复健康状态，需要升级到数据恢复；
 * 由编排器抛出时表示数据恢复也失败，需要人工介入。
 */
public class RollbackException extends UpgradeException {

    public RollbackException(String message) {
        super(ErrorType.ROLLBACK_ERROR, message);
    }

    public RollbackException(String message, Throwable cause) {
        super(ErrorType.ROLLBACK_ERROR, message, cause);
    }
}
