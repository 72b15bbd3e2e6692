package xyz.firestige.upgrade.infrastructure.persistence.session;

import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.session.PhaseRecord;
import xyz.firestige.upgrade.domain.session.RollbackPoint;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.signature.VerificationResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 会话持久化文档：字段与 UpdateSession 一一对应，运维人员可直接阅读
 */
public class SessionDocument {

    public int formatVersion = 1;
    public String sessionId;
    public String deploymentTarget;
    public String strategy;
    public String sourceVersion;
    public String targetVersion;
    public boolean dryRun;
    public boolean skipBackup;
    public boolean verifySignatures;
    public long phaseTimeoutSeconds;
    public LocalDateTime startedAt;
    public LocalDateTime finishedAt;
    public String phase;
    public List<PhaseRecord> phaseHistory = new ArrayList<>();
    public List<BackupRecord> backupRefs = new ArrayList<>();
    public Map<String, VerificationResult> verificationResults;
    public RollbackPoint rollbackPoint;
    public boolean dataMigrated;
    public boolean manualInterventionRequired;
    public FailureInfo failureInfo;
    public List<String> dryRunReport = new ArrayList<>();
}
