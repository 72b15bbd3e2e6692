package xyz.firestige.upgrade.application.orchestration;

import xyz.firestige.upgrade.domain.session.PhaseRecord;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;

import java.time.Duration;
import java.util.List;

/**
 * 升级 / 回滚的结果，终态时必定携带完整阶段历史
 */
public class UpgradeResult {

    private final String sessionId;
    private final SessionOutcome outcome;
    private final String sourceVersion;
    private final String targetVersion;
    private final boolean dryRun;
    private final boolean manualInterventionRequired;
    private final FailureInfo failureInfo;
    private final List<PhaseRecord> phaseHistory;
    private final List<String> dryRunReport;
    private final Duration estimatedDuration;

    private UpgradeResult(UpdateSession session, Duration estimatedDuration) {
        this.sessionId = session.getSessionId().getValue();
        this.outcome = SessionOutcome.of(session.getPhase());
        this.sourceVersion = session.getSourceVersion();
        this.targetVersion = session.getTargetVersion();
        this.dryRun = session.isDryRun();
        this.manualInterventionRequired = session.isManualInterventionRequired();
        this.failureInfo = session.getFailureInfo();
        this.phaseHistory = List.copyOf(session.getPhaseHistory());
        this.dryRunReport = List.copyOf(session.getDryRunReport());
        this.estimatedDuration = estimatedDuration;
    }

    public static UpgradeResult of(UpdateSession session) {
        return new UpgradeResult(session, null);
    }

    public static UpgradeResult of(UpdateSession session, Duration estimatedDuration) {
        return new UpgradeResult(session, estimatedDuration);
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionOutcome getOutcome() {
        return outcome;
    }

    public String getSourceVersion() {
        return sourceVersion;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isManualInterventionRequired() {
        return manualInterventionRequired;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public List<PhaseRecord> getPhaseHistory() {
        return phaseHistory;
    }

    public List<String> getDryRunReport() {
        return dryRunReport;
    }

    /**
     * 仅演练会话提供
     */
    public Duration getEstimatedDuration() {
        return estimatedDuration;
    }

    @Override
    public String toString() {
        return "UpgradeResult{" +
                "sessionId='" + sessionId + '\'' +
                ", outcome=" + outcome +
                ", " + sourceVersion + " -> " + targetVersion +
                ", manualInterventionRequired=" + manualInterventionRequired +
                '}';
    }
}
