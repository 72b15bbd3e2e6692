package xyz.firestige.upgrade.domain.session.event;

import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;

/**
 * 会话失败
 */
public class SessionFailedEvent extends SessionEvent {

    private final FailureInfo failureInfo;

    public SessionFailedEvent(String sessionId, FailureInfo failureInfo) {
        super(sessionId);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
