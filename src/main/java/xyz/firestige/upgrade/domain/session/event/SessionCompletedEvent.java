package xyz.firestige.upgrade.domain.session.event;

/**
 * 升级完成
 */
public class SessionCompletedEvent extends SessionEvent {

    private final String targetVersion;

    public SessionCompletedEvent(String sessionId, String targetVersion) {
        super(sessionId);
        this.targetVersion = targetVersion;
    }

    public String getTargetVersion() {
        return targetVersion;
    }
}
