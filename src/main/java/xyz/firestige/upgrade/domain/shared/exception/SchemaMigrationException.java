package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 存储结构变更失败（发生在 DEPLOYING 阶段，触发回滚）
 */
public class SchemaMigrationException extends UpgradeException {

    public SchemaMigrationException(String message) {
        super(ErrorType.DEPLOYMENT_ERROR, message);
    }

    public SchemaMigrationException(String message, Throwable cause) {
        super(ErrorType.DEPLOYMENT_ERROR, message, cause);
    }
}
