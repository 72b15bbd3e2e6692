package xyz.firestige.upgrade.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.rollback.RollbackCoordinator;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.application.validation.CurrentReleaseResolver;
import xyz.firestige.upgrade.application.validation.PreflightValidator;
import xyz.firestige.upgrade.application.validation.PreflightValidator.PreflightResult;
import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentOutcome;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.health.HealthReport;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.DeploymentException;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.exception.HealthCheckException;
import xyz.firestige.upgrade.domain.shared.exception.UpgradeException;
import xyz.firestige.upgrade.domain.shared.exception.VerificationException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.domain.signature.SignatureVerifier;
import xyz.firestige.upgrade.domain.signature.VerificationReport;
import xyz.firestige.upgrade.infrastructure.backup.DatabaseMigrator;
import xyz.firestige.upgrade.infrastructure.deployment.DeploymentDriverFactory;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 升级编排器：单线程顺序状态机
 * <p>
 * CREATED → VALIDATING → BACKING_UP → VERIFYING_SIGNATURES → DEPLOYING → HEALTH_CHECKING → FINALIZING → COMPLETED
 * <ul>
 *   <li>变更前的阶段失败 → FAILED</li>
 *   <li>DEPLOYING 及之后失败或被取消 → ROLLING_BACK（见 {@link RollbackCoordinator}）</li>
 * </ul>
 * 每个阶段先落盘再执行，阶段结束后追加结果。目标版本附带的结构变更在 DEPLOYING 开头、切换实例之前执行。
 * 演练会话以 SIMULATED 代替备份、部署和收尾，
 * 并在预检结束后立即释放部署目标锁。
 */
public class UpdateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UpdateOrchestrator.class);

    private static final Duration ESTIMATE_BASE = Duration.ofSeconds(30);
    private static final Duration ESTIMATE_PER_IMAGE = Duration.ofSeconds(15);
    private static final Duration ESTIMATE_CUTOVER = Duration.ofSeconds(60);
    private static final Duration ESTIMATE_PER_SCHEMA_CHANGE = Duration.ofSeconds(10);

    private final String deploymentTarget;
    private final SessionStateManager stateManager;
    private final PreflightValidator preflightValidator;
    private final CurrentReleaseResolver releaseResolver;
    private final DeploymentDriverFactory driverFactory;
    private final DatabaseMigrator migrator;
    private final SignatureVerifier signatureVerifier;
    private final HealthEvaluator healthEvaluator;
    private final RollbackCoordinator rollbackCoordinator;
    private final List<String> storeIds;
    private final Duration defaultPhaseTimeout;
    private final Duration signatureTimeout;

    private final Map<SessionId, SessionRuntimeContext> running = new ConcurrentHashMap<>();

    public UpdateOrchestrator(String deploymentTarget,
                              SessionStateManager stateManager,
                              PreflightValidator preflightValidator,
                              CurrentReleaseResolver releaseResolver,
                              DeploymentDriverFactory driverFactory,
                              DatabaseMigrator migrator,
                              SignatureVerifier signatureVerifier,
                              HealthEvaluator healthEvaluator,
                              RollbackCoordinator rollbackCoordinator,
                              List<String> storeIds,
                              Duration defaultPhaseTimeout,
                              Duration signatureTimeout) {
        this.deploymentTarget = deploymentTarget;
        this.stateManager = stateManager;
        this.preflightValidator = preflightValidator;
        this.releaseResolver = releaseResolver;
        this.driverFactory = driverFactory;
        this.migrator = migrator;
        this.signatureVerifier = signatureVerifier;
        this.healthEvaluator = healthEvaluator;
        this.rollbackCoordinator = rollbackCoordinator;
        this.storeIds = storeIds != null ? storeIds : List.of();
        this.defaultPhaseTimeout = defaultPhaseTimeout;
        this.signatureTimeout = signatureTimeout;
    }

    /**
     * 执行一次升级，直到会话进入终态
     *
     * @throws xyz.firestige.upgrade.domain.shared.exception.SessionConflictException 已有未结束的会话
     * @throws xyz.firestige.upgrade.domain.shared.exception.ValidationException     无法确定当前版本
     */
    public UpgradeResult upgrade(UpgradeRequest request) {
        DeploymentStrategyType strategy = DeploymentStrategyType.fromName(request.getStrategy());
        DeploymentDriver driver = driverFactory.forStrategy(strategy);

        stateManager.assertNoActiveSession(deploymentTarget, null);
        List<DeploymentUnit> current = driver.status();
        ReleaseManifest source = releaseResolver.resolve(current);
        Duration phaseTimeout = request.getTimeoutSeconds() != null
                ? Duration.ofSeconds(request.getTimeoutSeconds()) : defaultPhaseTimeout;

        UpdateSession session = UpdateSession.start(SessionId.generate(), deploymentTarget, strategy, source,
                releaseResolver.countLiveUnits(current), request.getTargetVersion(), request.isDryRun(), request.isSkipBackup(),
                request.isVerifySignatures(), phaseTimeout);
        stateManager.create(session);

        SessionRuntimeContext context = new SessionRuntimeContext(session.getSessionId(), deploymentTarget);
        running.put(session.getSessionId(), context);
        Duration estimate = null;
        try {
            estimate = execute(session, driver, context);
        } catch (RuntimeException e) {
            // 状态机之外的意外错误：保证会话仍然进入终态
            log.error("编排过程出现未处理异常, sessionId: {}", session.getSessionId(), e);
            terminateUnexpected(session, driver, e);
        } finally {
            running.remove(session.getSessionId());
            context.clearMdc();
        }
        log.info("会话结束, sessionId: {}, phase: {}", session.getSessionId(), session.getPhase());
        return UpgradeResult.of(session, estimate);
    }

    /**
     * 请求取消正在本进程中运行的会话
     *
     * @return false 表示该会话不在本进程中运行
     */
    public boolean cancel(SessionId sessionId, String operator) {
        SessionRuntimeContext context = running.get(sessionId);
        if (context == null) {
            return false;
        }
        context.requestCancel(operator);
        log.warn("已请求取消会话, sessionId: {}, operator: {}", sessionId, operator);
        return true;
    }

    public boolean isRunning(SessionId sessionId) {
        return running.containsKey(sessionId);
    }

    private Duration execute(UpdateSession session, DeploymentDriver driver, SessionRuntimeContext ctx) {
        // ---------- VALIDATING ----------
        PreflightResult preflight;
        try {
            enter(session, SessionPhase.VALIDATING, ctx);
            preflight = preflightValidator.validate(session, driver, Deadline.after(session.getPhaseTimeout()));
            stateManager.appendPhase(session, SessionPhase.VALIDATING, PhaseOutcome.SUCCESS, preflight.summary());
        } catch (RuntimeException e) {
            failBeforeMutation(session, e, ErrorType.VALIDATION_ERROR);
            return null;
        } finally {
            if (session.isDryRun()) {
                stateManager.releaseLock(session);
            }
        }
        ReleaseManifest target = preflight.target();
        if (cancelledBeforeMutation(session, ctx)) {
            return null;
        }

        // ---------- BACKING_UP ----------
        try {
            enter(session, SessionPhase.BACKING_UP, ctx);
            backup(session);
        } catch (RuntimeException e) {
            failBeforeMutation(session, e, ErrorType.BACKUP_ERROR);
            return null;
        }
        if (cancelledBeforeMutation(session, ctx)) {
            return null;
        }

        // ---------- VERIFYING_SIGNATURES ----------
        try {
            enter(session, SessionPhase.VERIFYING_SIGNATURES, ctx);
            verifySignatures(session, target);
        } catch (RuntimeException e) {
            failBeforeMutation(session, e, ErrorType.VERIFICATION_ERROR);
            return null;
        }
        if (cancelledBeforeMutation(session, ctx)) {
            return null;
        }

        // ---------- DEPLOYING ----------
        try {
            enter(session, SessionPhase.DEPLOYING, ctx);
            deploy(session, driver, target, preflight.schemaChanges());
            checkCancelled(ctx);
        } catch (RuntimeException e) {
            rollback(session, driver, e, ErrorType.DEPLOYMENT_ERROR, ctx);
            return null;
        }

        // ---------- HEALTH_CHECKING ----------
        try {
            enter(session, SessionPhase.HEALTH_CHECKING, ctx);
            healthCheck(session, driver);
            checkCancelled(ctx);
        } catch (RuntimeException e) {
            rollback(session, driver, e, ErrorType.HEALTH_CHECK_ERROR, ctx);
            return null;
        }

        // ---------- FINALIZING ----------
        try {
            enter(session, SessionPhase.FINALIZING, ctx);
            finalizeDeployment(session, driver, target);
        } catch (RuntimeException e) {
            rollback(session, driver, e, ErrorType.DEPLOYMENT_ERROR, ctx);
            return null;
        }

        session.complete();
        stateManager.save(session);
        log.info("升级完成, sessionId: {}, {} -> {}", session.getSessionId(), session.getSourceVersion(), session.getTargetVersion());
        return session.isDryRun() ? estimate(session, target, preflight.schemaChanges()) : null;
    }

    private void enter(UpdateSession session, SessionPhase phase, SessionRuntimeContext ctx) {
        ctx.injectMdc(phase);
        stateManager.enterPhase(session, phase);
    }

    private void backup(UpdateSession session) {
        if (session.isDryRun()) {
            for (String storeId : storeIds) {
                session.reportWouldDo("would back up store " + storeId + " and verify its SHA-256 checksum");
            }
            stateManager.appendPhase(session, SessionPhase.BACKING_UP, PhaseOutcome.SIMULATED,
                    "演练：将备份 " + storeIds.size() + " 个存储");
            return;
        }
        if (session.isSkipBackup()) {
            log.warn("已按请求跳过备份，回滚时无法恢复数据, sessionId: {}", session.getSessionId());
            stateManager.appendPhase(session, SessionPhase.BACKING_UP, PhaseOutcome.SKIPPED, "按请求跳过备份（不推荐）");
            return;
        }
        // 任一存储失败时已创建的备份不挂载到会话，保留供人工检查
        List<BackupRecord> records = new ArrayList<>();
        for (String storeId : storeIds) {
            records.add(migrator.backup(storeId, "pre-upgrade " + session.getSessionId()));
        }
        session.attachBackups(records);
        stateManager.appendPhase(session, SessionPhase.BACKING_UP, PhaseOutcome.SUCCESS,
                "已备份: " + records.stream().map(BackupRecord::backupId).collect(Collectors.toList()));
    }

    private void verifySignatures(UpdateSession session, ReleaseManifest target) {
        if (!session.isVerifySignatures()) {
            log.warn("已按请求跳过签名校验, sessionId: {}", session.getSessionId());
            stateManager.appendPhase(session, SessionPhase.VERIFYING_SIGNATURES, PhaseOutcome.SKIPPED, "按请求跳过签名校验");
            return;
        }
        Deadline phaseDeadline = Deadline.after(session.getPhaseTimeout());
        Duration perCheck = phaseDeadline.cap(signatureTimeout);
        VerificationReport report = signatureVerifier.verifyAll(target.imageRefs(), perCheck, phaseDeadline);
        session.recordVerificationResults(report.results());
        if (!report.allVerified()) {
            throw new VerificationException("镜像签名校验未通过: " + report.failureSummary(), report.failedRefs());
        }
        stateManager.appendPhase(session, SessionPhase.VERIFYING_SIGNATURES, PhaseOutcome.SUCCESS,
                report.results().size() + " 个镜像签名校验通过");
    }

    private void deploy(UpdateSession session, DeploymentDriver driver, ReleaseManifest target,
                        List<SchemaChange> schemaChanges) {
        if (session.isDryRun()) {
            for (SchemaChange change : schemaChanges) {
                session.reportWouldDo(String.format("would apply schema change %s to store %s: %s",
                        change.id(), change.storeId(), change.description()));
            }
            for (String line : driver.describePlan(session.getRollbackPoint().source(), target)) {
                session.reportWouldDo(line);
            }
            stateManager.appendPhase(session, SessionPhase.DEPLOYING, PhaseOutcome.SIMULATED,
                    "演练：" + driver.strategy() + " 部署计划已生成");
            return;
        }
        Deadline deadline = Deadline.after(session.getPhaseTimeout());
        String migrated = "";
        if (!schemaChanges.isEmpty()) {
            // 标记先于变更落盘
            session.markDataMigrated();
            stateManager.save(session);
            migrator.migrateSchema(schemaChanges);
            migrated = String.format("已执行结构变更 %s; ",
                    schemaChanges.stream().map(SchemaChange::id).collect(Collectors.toList()));
        }
        if (deadline.isExpired()) {
            throw new DeploymentException("结构变更耗尽了 DEPLOYING 阶段的时间预算");
        }
        DeploymentOutcome outcome = driver.deploy(target, deadline);
        stateManager.appendPhase(session, SessionPhase.DEPLOYING, PhaseOutcome.SUCCESS, migrated + outcome.detail());
    }

    private void healthCheck(UpdateSession session, DeploymentDriver driver) {
        List<DeploymentUnit> live = driver.status().stream()
                .filter(DeploymentUnit::live)
                .collect(Collectors.toList());
        HealthReport report = healthEvaluator.evaluate(live, storeIds, Deadline.after(session.getPhaseTimeout()));
        if (session.isDryRun()) {
            // 演练只读取当前系统的健康状态，不影响结果
            stateManager.appendPhase(session, SessionPhase.HEALTH_CHECKING, PhaseOutcome.SIMULATED,
                    "演练：当前系统 " + report.summary());
            return;
        }
        if (live.isEmpty()) {
            throw new HealthCheckException("部署后没有在线实例");
        }
        List<String> missing = missingUnits(session.getRollbackPoint().unitCounts(), live);
        if (!missing.isEmpty()) {
            throw new HealthCheckException("部署后在线实例数与升级前不一致: " + missing);
        }
        if (!report.isHealthy()) {
            throw new HealthCheckException("部署后健康检查未通过: " + report.summary());
        }
        stateManager.appendPhase(session, SessionPhase.HEALTH_CHECKING, PhaseOutcome.SUCCESS, report.summary());
    }

    private static List<String> missingUnits(Map<String, Integer> expected, List<DeploymentUnit> live) {
        Map<String, Integer> actual = new LinkedHashMap<>();
        for (DeploymentUnit u : live) {
            actual.merge(u.service(), 1, Integer::sum);
        }
        List<String> mismatches = new ArrayList<>();
        for (Map.Entry<String, Integer> e : expected.entrySet()) {
            int count = actual.getOrDefault(e.getKey(), 0);
            if (count != e.getValue()) {
                mismatches.add(String.format("%s 需要 %d, 实际 %d", e.getKey(), e.getValue(), count));
            }
        }
        return mismatches;
    }

    private void finalizeDeployment(UpdateSession session, DeploymentDriver driver, ReleaseManifest target) {
        if (session.isDryRun()) {
            session.reportWouldDo("would finalize " + driver.strategy() + " deployment of " + target.version());
            stateManager.appendPhase(session, SessionPhase.FINALIZING, PhaseOutcome.SIMULATED, "演练：将执行收尾");
            return;
        }
        DeploymentOutcome outcome = driver.finalizeDeployment(target);
        stateManager.appendPhase(session, SessionPhase.FINALIZING, PhaseOutcome.SUCCESS, outcome.detail());
    }

    private boolean cancelledBeforeMutation(UpdateSession session, SessionRuntimeContext ctx) {
        if (!ctx.isCancelRequested()) {
            return false;
        }
        String message = "操作员取消: " + ctx.getCancelledBy();
        FailureInfo failure = FailureInfo.of(ErrorType.CANCELLED, message, session.getPhase().name());
        session.fail(failure, false);
        stateManager.save(session);
        log.warn("会话在变更前被取消, sessionId: {}, phase: {}", session.getSessionId(), failure.getFailedAt());
        return true;
    }

    private void checkCancelled(SessionRuntimeContext ctx) {
        if (ctx.isCancelRequested()) {
            throw new UpgradeException(ErrorType.CANCELLED, "操作员取消: " + ctx.getCancelledBy());
        }
    }

    private void failBeforeMutation(UpdateSession session, RuntimeException e, ErrorType defaultType) {
        SessionPhase phase = session.getPhase();
        FailureInfo failure = FailureInfo.fromException(e, defaultType, phase.name());
        log.error("阶段失败，会话终止, sessionId: {}, phase: {}, error: {}", session.getSessionId(), phase, e.getMessage());
        if (!session.isTerminal()) {
            session.recordOutcome(PhaseOutcome.FAILURE, failure.getErrorMessage());
            session.fail(failure, false);
            stateManager.save(session);
        }
    }

    private void rollback(UpdateSession session, DeploymentDriver driver, RuntimeException e,
                          ErrorType defaultType, SessionRuntimeContext ctx) {
        FailureInfo failure = FailureInfo.fromException(e, defaultType, session.getPhase().name());
        log.error("阶段失败，进入回滚, sessionId: {}, phase: {}, error: {}", session.getSessionId(), session.getPhase(), e.getMessage());
        ctx.injectMdc(SessionPhase.ROLLING_BACK);
        rollbackCoordinator.rollback(session, driver, failure);
    }

    private void terminateUnexpected(UpdateSession session, DeploymentDriver driver, RuntimeException e) {
        if (session.isTerminal()) {
            return;
        }
        FailureInfo failure = FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, session.getPhase().name());
        if (session.getPhase().isMutating()) {
            rollbackCoordinator.rollback(session, driver, failure);
        } else {
            session.fail(failure, false);
            stateManager.save(session);
        }
    }

    private Duration estimate(UpdateSession session, ReleaseManifest target, List<SchemaChange> schemaChanges) {
        Duration d = ESTIMATE_BASE.plus(ESTIMATE_PER_IMAGE.multipliedBy(target.imageRefs().size()))
                .plus(ESTIMATE_PER_SCHEMA_CHANGE.multipliedBy(schemaChanges.size()));
        if (session.getStrategy() == DeploymentStrategyType.PARALLEL_CUTOVER) {
            d = d.plus(ESTIMATE_CUTOVER);
        }
        return d;
    }
}
