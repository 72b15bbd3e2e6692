package xyz.firestige.upgrade.application.orchestration;

import xyz.firestige.upgrade.domain.session.SessionPhase;

/**
 * 对外报告的会话结果
 */
public enum SessionOutcome {

    COMPLETED("completed"),

    ROLLED_BACK("rolled_back"),

    FAILED("failed");

    private final String wireName;

    SessionOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 由终态映射；非终态返回 null
     */
    public static SessionOutcome of(SessionPhase phase) {
        return switch (phase) {
            case COMPLETED -> COMPLETED;
            case ROLLED_BACK -> ROLLED_BACK;
            case FAILED -> FAILED;
            default -> null;
        };
    }
}
