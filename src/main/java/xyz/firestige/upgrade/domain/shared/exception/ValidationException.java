package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 预检异常（未发生任何变更）
 */
public class ValidationException extends UpgradeException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorType.VALIDATION_ERROR, message, cause);
    }
}
