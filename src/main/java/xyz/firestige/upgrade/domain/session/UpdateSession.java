package xyz.firestige.upgrade.domain.session;

import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.event.SessionCompletedEvent;
import xyz.firestige.upgrade.domain.session.event.SessionCriticalEvent;
import xyz.firestige.upgrade.domain.session.event.SessionEvent;
import xyz.firestige.upgrade.domain.session.event.SessionFailedEvent;
import xyz.firestige.upgrade.domain.session.event.SessionPhaseChangedEvent;
import xyz.firestige.upgrade.domain.session.event.SessionRolledBackEvent;
import xyz.firestige.upgrade.domain.session.event.SessionStartedEvent;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.domain.signature.VerificationResult;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 升级会话聚合根
 * <p>
 * 职责：
 * 1. 保护阶段推进不变式（只能按 {@link SessionPhase#allowedNext()} 推进）
 * 2. 维护只追加的阶段历史，作为审计记录和崩溃后恢复的依据
 * 3. 持有回滚点（源版本清单 + 备份记录）
 * 4. 收集领域事件，由应用层在持久化后发布
 * <p>
 * 终态之后聚合不再接受任何变更。
 */
public class UpdateSession {

    private final SessionId sessionId;
    private final String deploymentTarget;
    private final DeploymentStrategyType strategy;
    private final String sourceVersion;
    private final String targetVersion;
    private final boolean dryRun;
    private final boolean skipBackup;
    private final boolean verifySignatures;
    private final Duration phaseTimeout;
    private final LocalDateTime startedAt;

    private SessionPhase phase;
    private final List<PhaseRecord> phaseHistory;
    private final List<BackupRecord> backupRefs;
    private Map<String, VerificationResult> verificationResults;
    private RollbackPoint rollbackPoint;
    private boolean dataMigrated;
    private boolean manualInterventionRequired;
    private FailureInfo failureInfo;
    private final List<String> dryRunReport;
    private LocalDateTime finishedAt;

    private final List<SessionEvent> domainEvents = new ArrayList<>();

    private UpdateSession(Builder b) {
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId cannot be null");
        this.deploymentTarget = Objects.requireNonNull(b.deploymentTarget, "deploymentTarget cannot be null");
        this.strategy = Objects.requireNonNull(b.strategy, "strategy cannot be null");
        this.sourceVersion = Objects.requireNonNull(b.sourceVersion, "sourceVersion cannot be null");
        this.targetVersion = Objects.requireNonNull(b.targetVersion, "targetVersion cannot be null");
        this.dryRun = b.dryRun;
        this.skipBackup = b.skipBackup;
        this.verifySignatures = b.verifySignatures;
        this.phaseTimeout = b.phaseTimeout != null ? b.phaseTimeout : Duration.ofMinutes(10);
        this.startedAt = b.startedAt != null ? b.startedAt : LocalDateTime.now();
        this.phase = b.phase != null ? b.phase : SessionPhase.CREATED;
        this.phaseHistory = new ArrayList<>(b.phaseHistory);
        this.backupRefs = new ArrayList<>(b.backupRefs);
        this.verificationResults = b.verificationResults == null ? null : new LinkedHashMap<>(b.verificationResults);
        this.rollbackPoint = b.rollbackPoint;
        this.dataMigrated = b.dataMigrated;
        this.manualInterventionRequired = b.manualInterventionRequired;
        this.failureInfo = b.failureInfo;
        this.dryRunReport = new ArrayList<>(b.dryRunReport);
        this.finishedAt = b.finishedAt;
    }

    public static UpdateSession start(SessionId sessionId,
                                      String deploymentTarget,
                                      DeploymentStrategyType strategy,
                                      ReleaseManifest source,
                                      String targetVersion,
                                      boolean dryRun,
                                      boolean skipBackup,
                                      boolean verifySignatures,
                                      Duration phaseTimeout) {
        return start(sessionId, deploymentTarget, strategy, source, Map.of(), targetVersion,
                dryRun, skipBackup, verifySignatures, phaseTimeout);
    }

    /**
     * 开启新会话：回滚点的源版本清单与在线实例数在此刻冻结
     */
    public static UpdateSession start(SessionId sessionId,
                                      String deploymentTarget,
                                      DeploymentStrategyType strategy,
                                      ReleaseManifest source,
                                      Map<String, Integer> sourceUnitCounts,
                                      String targetVersion,
                                      boolean dryRun,
                                      boolean skipBackup,
                                      boolean verifySignatures,
                                      Duration phaseTimeout) {
        UpdateSession session = builder()
                .sessionId(sessionId)
                .deploymentTarget(deploymentTarget)
                .strategy(strategy)
                .sourceVersion(source.version())
                .targetVersion(targetVersion)
                .dryRun(dryRun)
                .skipBackup(skipBackup)
                .verifySignatures(verifySignatures)
                .phaseTimeout(phaseTimeout)
                .rollbackPoint(RollbackPoint.of(source, sourceUnitCounts))
                .build();
        session.phaseHistory.add(PhaseRecord.now(SessionPhase.CREATED, PhaseOutcome.SUCCESS,
                String.format("%s -> %s, strategy: %s%s", source.version(), targetVersion, strategy,
                        dryRun ? ", dry-run" : "")));
        session.addDomainEvent(new SessionStartedEvent(sessionId.getValue(), source.version(), targetVersion, strategy, dryRun));
        return session;
    }

    // ============================================
    // 事件管理
    // ============================================

    public List<SessionEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    public void clearDomainEvents() {
        domainEvents.clear();
    }

    private void addDomainEvent(SessionEvent event) {
        this.domainEvents.add(event);
    }

    // ============================================
    // 业务行为
    // ============================================

    /**
     * 进入下一阶段
     * 不变式：只能按阶段转换表推进；终态不可再变更
     */
    public void enterPhase(SessionPhase next) {
        ensureNotTerminal("进入阶段 " + next);
        if (phase == next) {
            return;
        }
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("不允许的阶段转换: %s -> %s, sessionId: %s", phase, next, sessionId)
            );
        }
        if (next.isTerminal()) {
            throw new IllegalStateException(
                String.format("终态必须通过 complete/rolledBack/fail 进入，目标: %s, sessionId: %s", next, sessionId)
            );
        }
        this.phase = next;
    }

    /**
     * 记录当前阶段的结果（追加历史）
     */
    public void recordOutcome(PhaseOutcome outcome, String detail) {
        ensureNotTerminal("记录阶段结果");
        PhaseRecord record = PhaseRecord.now(phase, outcome, detail);
        phaseHistory.add(record);
        addDomainEvent(new SessionPhaseChangedEvent(sessionId.getValue(), phase, outcome, detail));
    }

    /**
     * 挂载本次会话的备份记录并冻结回滚点
     * 不变式：只能在 BACKING_UP 阶段挂载一次
     */
    public void attachBackups(List<BackupRecord> records) {
        if (phase != SessionPhase.BACKING_UP) {
            throw new IllegalStateException(
                String.format("只有 BACKING_UP 阶段可以挂载备份记录，当前阶段: %s, sessionId: %s", phase, sessionId)
            );
        }
        if (dryRun) {
            throw new IllegalStateException(String.format("演练会话不允许产生备份记录, sessionId: %s", sessionId));
        }
        this.backupRefs.addAll(records);
        this.rollbackPoint = rollbackPoint.withBackups(records);
    }

    /**
     * 标记即将改动存储结构，之后的任何回滚都必须恢复数据
     * 不变式：只能在非演练会话的 DEPLOYING 阶段标记
     */
    public void markDataMigrated() {
        if (phase != SessionPhase.DEPLOYING || dryRun) {
            throw new IllegalStateException(
                String.format("只有非演练会话的 DEPLOYING 阶段可以改动存储结构，当前阶段: %s, sessionId: %s", phase, sessionId)
            );
        }
        this.dataMigrated = true;
    }

    /**
     * 记录签名校验结果
     * 不变式：一个会话只写入一次
     */
    public void recordVerificationResults(List<VerificationResult> results) {
        if (verificationResults != null) {
            throw new IllegalStateException(
                String.format("签名校验结果已存在，不允许覆盖, sessionId: %s", sessionId)
            );
        }
        Map<String, VerificationResult> map = new LinkedHashMap<>();
        for (VerificationResult r : results) {
            map.put(r.imageRef(), r);
        }
        this.verificationResults = map;
    }

    /**
     * 追加一条演练报告
     */
    public void reportWouldDo(String line) {
        dryRunReport.add(line);
    }

    public void complete() {
        transitionToTerminal(SessionPhase.COMPLETED, "升级完成");
        addDomainEvent(new SessionCompletedEvent(sessionId.getValue(), targetVersion));
    }

    public void markRolledBack(boolean dataRestored) {
        transitionToTerminal(SessionPhase.ROLLED_BACK,
                dataRestored ? "已回滚（含数据恢复）" : "已回滚");
        addDomainEvent(new SessionRolledBackEvent(sessionId.getValue(), sourceVersion, dataRestored));
    }

    /**
     * 会话失败
     *
     * @param failure  失败信息
     * @param critical 是否为回滚也失败的严重情况（需要人工介入）
     */
    public void fail(FailureInfo failure, boolean critical) {
        this.failureInfo = failure;
        this.manualInterventionRequired = critical;
        transitionToTerminal(SessionPhase.FAILED, failure != null ? failure.getErrorMessage() : null);
        addDomainEvent(critical
                ? new SessionCriticalEvent(sessionId.getValue(), failure)
                : new SessionFailedEvent(sessionId.getValue(), failure));
    }

    /**
     * 操作员放弃会话（崩溃后遗留的非终态记录）
     * <p>
     * 不经过阶段转换表直接进入 FAILED；已发生变更的会话标记为需要人工介入。
     */
    public void abandon(String operator) {
        ensureNotTerminal("放弃会话");
        boolean mutated = phase.isMutating();
        String message = String.format("会话被操作员 %s 放弃, 放弃时阶段: %s", operator, phase);
        this.failureInfo = FailureInfo.of(ErrorType.CANCELLED, message, phase.name());
        this.manualInterventionRequired = mutated;
        this.phase = SessionPhase.FAILED;
        this.finishedAt = LocalDateTime.now();
        phaseHistory.add(PhaseRecord.now(SessionPhase.FAILED, PhaseOutcome.FAILURE, message));
        addDomainEvent(new SessionPhaseChangedEvent(sessionId.getValue(), SessionPhase.FAILED, PhaseOutcome.FAILURE, message));
        addDomainEvent(mutated
                ? new SessionCriticalEvent(sessionId.getValue(), failureInfo)
                : new SessionFailedEvent(sessionId.getValue(), failureInfo));
    }

    /**
     * 记录最近一次失败，但不改变阶段（例如进入回滚分支前）
     */
    public void noteFailure(FailureInfo failure) {
        ensureNotTerminal("记录失败信息");
        this.failureInfo = failure;
    }

    private void transitionToTerminal(SessionPhase terminal, String detail) {
        ensureNotTerminal("进入终态 " + terminal);
        if (!phase.canTransitionTo(terminal)) {
            throw new IllegalStateException(
                String.format("不允许的阶段转换: %s -> %s, sessionId: %s", phase, terminal, sessionId)
            );
        }
        this.phase = terminal;
        this.finishedAt = LocalDateTime.now();
        PhaseOutcome outcome = terminal == SessionPhase.FAILED ? PhaseOutcome.FAILURE : PhaseOutcome.SUCCESS;
        phaseHistory.add(PhaseRecord.now(terminal, outcome, detail));
        addDomainEvent(new SessionPhaseChangedEvent(sessionId.getValue(), terminal, outcome, detail));
    }

    private void ensureNotTerminal(String action) {
        if (phase.isTerminal()) {
            throw new IllegalStateException(
                String.format("会话已处于终态，不允许%s，当前阶段: %s, sessionId: %s", action, phase, sessionId)
            );
        }
    }

    // ============================================
    // 查询方法
    // ============================================

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    /**
     * 是否占用部署目标（非终态且非演练）
     */
    public boolean holdsTarget() {
        return !dryRun && !phase.isTerminal();
    }

    /**
     * 最近一次某阶段的结果
     */
    public PhaseOutcome lastOutcomeOf(SessionPhase p) {
        for (int i = phaseHistory.size() - 1; i >= 0; i--) {
            if (phaseHistory.get(i).phase() == p) {
                return phaseHistory.get(i).outcome();
            }
        }
        return null;
    }

    public SessionId getSessionId() {
        return sessionId;
    }

    public String getDeploymentTarget() {
        return deploymentTarget;
    }

    public DeploymentStrategyType getStrategy() {
        return strategy;
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

    public boolean isSkipBackup() {
        return skipBackup;
    }

    public boolean isVerifySignatures() {
        return verifySignatures;
    }

    public Duration getPhaseTimeout() {
        return phaseTimeout;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public SessionPhase getPhase() {
        return phase;
    }

    public List<PhaseRecord> getPhaseHistory() {
        return Collections.unmodifiableList(phaseHistory);
    }

    public List<BackupRecord> getBackupRefs() {
        return Collections.unmodifiableList(backupRefs);
    }

    public Map<String, VerificationResult> getVerificationResults() {
        return verificationResults == null ? null : Collections.unmodifiableMap(verificationResults);
    }

    public RollbackPoint getRollbackPoint() {
        return rollbackPoint;
    }

    public boolean isDataMigrated() {
        return dataMigrated;
    }

    public boolean isManualInterventionRequired() {
        return manualInterventionRequired;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public List<String> getDryRunReport() {
        return Collections.unmodifiableList(dryRunReport);
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    @Override
    public String toString() {
        return "UpdateSession{" +
                "sessionId=" + sessionId +
                ", target=" + deploymentTarget +
                ", " + sourceVersion + " -> " + targetVersion +
                ", strategy=" + strategy +
                ", phase=" + phase +
                ", dryRun=" + dryRun +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 构建器，供会话创建和仓储重建使用
     */
    public static class Builder {
        private SessionId sessionId;
        private String deploymentTarget;
        private DeploymentStrategyType strategy;
        private String sourceVersion;
        private String targetVersion;
        private boolean dryRun;
        private boolean skipBackup;
        private boolean verifySignatures = true;
        private Duration phaseTimeout;
        private LocalDateTime startedAt;
        private SessionPhase phase;
        private List<PhaseRecord> phaseHistory = List.of();
        private List<BackupRecord> backupRefs = List.of();
        private Map<String, VerificationResult> verificationResults;
        private RollbackPoint rollbackPoint;
        private boolean dataMigrated;
        private boolean manualInterventionRequired;
        private FailureInfo failureInfo;
        private List<String> dryRunReport = List.of();
        private LocalDateTime finishedAt;

        public Builder sessionId(SessionId sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder deploymentTarget(String deploymentTarget) {
            this.deploymentTarget = deploymentTarget;
            return this;
        }

        public Builder strategy(DeploymentStrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder sourceVersion(String sourceVersion) {
            this.sourceVersion = sourceVersion;
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder skipBackup(boolean skipBackup) {
            this.skipBackup = skipBackup;
            return this;
        }

        public Builder verifySignatures(boolean verifySignatures) {
            this.verifySignatures = verifySignatures;
            return this;
        }

        public Builder phaseTimeout(Duration phaseTimeout) {
            this.phaseTimeout = phaseTimeout;
            return this;
        }

        public Builder startedAt(LocalDateTime startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder phase(SessionPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder phaseHistory(List<PhaseRecord> phaseHistory) {
            this.phaseHistory = phaseHistory == null ? List.of() : phaseHistory;
            return this;
        }

        public Builder backupRefs(List<BackupRecord> backupRefs) {
            this.backupRefs = backupRefs == null ? List.of() : backupRefs;
            return this;
        }

        public Builder verificationResults(Map<String, VerificationResult> verificationResults) {
            this.verificationResults = verificationResults;
            return this;
        }

        public Builder rollbackPoint(RollbackPoint rollbackPoint) {
            this.rollbackPoint = rollbackPoint;
            return this;
        }

        public Builder dataMigrated(boolean dataMigrated) {
            this.dataMigrated = dataMigrated;
            return this;
        }

        public Builder manualInterventionRequired(boolean manualInterventionRequired) {
            this.manualInterventionRequired = manualInterventionRequired;
            return this;
        }

        public Builder failureInfo(FailureInfo failureInfo) {
            this.failureInfo = failureInfo;
            return this;
        }

        public Builder dryRunReport(List<String> dryRunReport) {
            this.dryRunReport = dryRunReport == null ? List.of() : dryRunReport;
            return this;
        }

        public Builder finishedAt(LocalDateTime finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public UpdateSession build() {
            return new UpdateSession(this);
        }
    }
}
