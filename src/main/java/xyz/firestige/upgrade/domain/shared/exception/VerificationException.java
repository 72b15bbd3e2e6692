package xyz.firestige.upgrade.domain.shared.exception;

import java.util.List;

/**
 * 镜像签名校验异常
 * <p>
 * 签名失败属于信任失败而非瞬时故障，编排器不会自动重试。
 */
public class VerificationException extends UpgradeException {

    private final List<String> failedRefs;

    public VerificationException(String message, List<String> failedRefs) {
        super(ErrorType.VERIFICATION_ERROR, message);
        this.failedRefs = failedRefs == null ? List.of() : List.copyOf(failedRefs);
    }

    public VerificationException(String message, Throwable cause) {
        super(ErrorType.VERIFICATION_ERROR, message, cause);
        this.failedRefs = List.of();
    }

    public List<String> getFailedRefs() {
        return failedRefs;
    }
}
