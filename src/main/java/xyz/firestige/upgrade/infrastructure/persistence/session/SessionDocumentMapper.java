package xyz.firestige.upgrade.infrastructure.persistence.session;

import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * UpdateSession 与持久化文档之间的转换
 */
public final class SessionDocumentMapper {

    private SessionDocumentMapper() {
    }

    public static SessionDocument toDocument(UpdateSession s) {
        SessionDocument d = new SessionDocument();
        d.sessionId = s.getSessionId().getValue();
        d.deploymentTarget = s.getDeploymentTarget();
        d.strategy = s.getStrategy().getWireName();
        d.sourceVersion = s.getSourceVersion();
        d.targetVersion = s.getTargetVersion();
        d.dryRun = s.isDryRun();
        d.skipBackup = s.isSkipBackup();
        d.verifySignatures = s.isVerifySignatures();
        d.phaseTimeoutSeconds = s.getPhaseTimeout().toSeconds();
        d.startedAt = s.getStartedAt();
        d.finishedAt = s.getFinishedAt();
        d.phase = s.getPhase().name();
        d.phaseHistory = new ArrayList<>(s.getPhaseHistory());
        d.backupRefs = new ArrayList<>(s.getBackupRefs());
        d.verificationResults = s.getVerificationResults() == null ? null : new LinkedHashMap<>(s.getVerificationResults());
        d.rollbackPoint = s.getRollbackPoint();
        d.dataMigrated = s.isDataMigrated();
        d.manualInterventionRequired = s.isManualInterventionRequired();
        d.failureInfo = s.getFailureInfo();
        d.dryRunReport = new ArrayList<>(s.getDryRunReport());
        return d;
    }

    public static UpdateSession toDomain(SessionDocument d) {
        return UpdateSession.builder()
                .sessionId(SessionId.of(d.sessionId))
                .deploymentTarget(d.deploymentTarget)
                .strategy(DeploymentStrategyType.fromName(d.strategy))
                .sourceVersion(d.sourceVersion)
                .targetVersion(d.targetVersion)
                .dryRun(d.dryRun)
                .skipBackup(d.skipBackup)
                .verifySignatures(d.verifySignatures)
                .phaseTimeout(Duration.ofSeconds(d.phaseTimeoutSeconds))
                .startedAt(d.startedAt)
                .finishedAt(d.finishedAt)
                .phase(SessionPhase.valueOf(d.phase))
                .phaseHistory(d.phaseHistory)
                .backupRefs(d.backupRefs)
                .verificationResults(d.verificationResults)
                .rollbackPoint(d.rollbackPoint)
                .dataMigrated(d.dataMigrated)
                .manualInterventionRequired(d.manualInterventionRequired)
                .failureInfo(d.failureInfo)
                .dryRunReport(d.dryRunReport)
                .build();
    }
}
