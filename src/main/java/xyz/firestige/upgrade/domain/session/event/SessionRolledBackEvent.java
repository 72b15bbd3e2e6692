package xyz.firestige.upgrade.domain.session.event;

/**
 * 已回滚到升级前版本
 */
public class SessionRolledBackEvent extends SessionEvent {

    private final String sourceVersion;
    private final boolean dataRestored;

    public SessionRolledBackEvent(String sessionId, String sourceVersion, boolean dataRestored) {
        super(sessionId);
        this.sourceVersion = sourceVersion;
        this.dataRestored = dataRestored;
    }

    public String getSourceVersion() {
        return sourceVersion;
    }

    /**
     * 是否动用了数据恢复（驱动级回滚不足时）
     */
    public boolean isDataRestored() {
        return dataRestored;
    }
}
