package xyz.firestige.upgrade.domain.session.event;

import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;

/**
 * 阶段结果已记录
 */
public class SessionPhaseChangedEvent extends SessionEvent {

    private final SessionPhase phase;
    private final PhaseOutcome outcome;
    private final String detail;

    public SessionPhaseChangedEvent(String sessionId, SessionPhase phase, PhaseOutcome outcome, String detail) {
        super(sessionId);
        this.phase = phase;
        this.outcome = outcome;
        this.detail = detail;
    }

    public SessionPhase getPhase() {
        return phase;
    }

    public PhaseOutcome getOutcome() {
        return outcome;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "SessionPhaseChangedEvent{sessionId='" + sessionId + "', phase=" + phase + ", outcome=" + outcome + "}";
    }
}
