package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 会话冲突异常：同一部署目标上已存在未结束的升级会话
 */
public class SessionConflictException extends UpgradeException {

    private final String activeSessionId;

    public SessionConflictException(String message, String activeSessionId) {
        super(ErrorType.SESSION_CONFLICT, message);
        this.activeSessionId = activeSessionId;
    }

    public String getActiveSessionId() {
        return activeSessionId;
    }
}
