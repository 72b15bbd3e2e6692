package xyz.firestige.upgrade.application.query;

import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.session.PhaseRecord;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.signature.VerificationResult;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 会话状态视图：持久化记录 + 从平台实时读取的实例状态
 * <p>
 * session 为空表示还没有任何会话记录，此时只返回实例状态。
 */
public record SessionStatus(String sessionId,
                            SessionPhase phase,
                            String strategy,
                            String sourceVersion,
                            String targetVersion,
                            boolean dryRun,
                            LocalDateTime startedAt,
                            LocalDateTime finishedAt,
                            boolean manualInterventionRequired,
                            FailureInfo failureInfo,
                            List<PhaseRecord> phaseHistory,
                            List<BackupRecord> backupRefs,
                            Map<String, VerificationResult> verificationResults,
                            List<DeploymentUnit> units) {

    public static SessionStatus of(UpdateSession s, List<DeploymentUnit> units) {
        return new SessionStatus(s.getSessionId().getValue(), s.getPhase(), s.getStrategy().getWireName(),
                s.getSourceVersion(), s.getTargetVersion(), s.isDryRun(), s.getStartedAt(), s.getFinishedAt(),
                s.isManualInterventionRequired(), s.getFailureInfo(), List.copyOf(s.getPhaseHistory()),
                List.copyOf(s.getBackupRefs()), s.getVerificationResults(), List.copyOf(units));
    }

    public static SessionStatus unitsOnly(List<DeploymentUnit> units) {
        return new SessionStatus(null, null, null, null, null, false, null, null, false, null,
                List.of(), List.of(), null, List.copyOf(units));
    }

    public boolean hasSession() {
        return sessionId != null;
    }
}
