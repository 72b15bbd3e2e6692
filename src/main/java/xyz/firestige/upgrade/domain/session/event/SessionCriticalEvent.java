package xyz.firestige.upgrade.domain.session.event;

import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;

/**
 * 回滚失败，需要人工介入
 */
public class SessionCriticalEvent extends SessionFailedEvent {

    public SessionCriticalEvent(String sessionId, FailureInfo failureInfo) {
        super(sessionId, failureInfo);
    }
}
