package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 备份或恢复异常
 */
public class BackupException extends UpgradeException {

    public BackupException(String message) {
        super(ErrorType.BACKUP_ERROR, message);
    }

    public BackupException(String message, Throwable cause) {
        super(ErrorType.BACKUP_ERROR, message, cause);
    }
}
