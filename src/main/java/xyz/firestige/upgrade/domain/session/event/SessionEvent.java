package xyz.firestige.upgrade.domain.session.event;

import java.time.LocalDateTime;

/**
 * 升级会话领域事件基类
 */
public abstract class SessionEvent {

    protected final String sessionId;
    protected final LocalDateTime occurredOn;

    protected SessionEvent(String sessionId) {
        this.sessionId = sessionId;
        this.occurredOn = LocalDateTime.now();
    }

    public String getSessionId() {
        return sessionId;
    }

    public LocalDateTime getOccurredOn() {
        return occurredOn;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{sessionId='" + sessionId + "', occurredOn=" + occurredOn + "}";
    }
}
