package xyz.firestige.upgrade.application.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentOutcome;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.health.HealthReport;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.exception.RollbackException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.backup.DatabaseMigrator;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 回滚协调器
 * <p>
 * 两级回滚：
 * <ol>
 *   <li>驱动级回滚 + 对恢复后的在线实例做健康门禁；会话已改动存储结构时先按备份恢复数据</li>
 *   <li>驱动无法恢复健康状态时：按回滚点的备份记录恢复每个存储，再重新部署源版本</li>
 * </ol>
 * 第二级也失败时会话进入 FAILED 并标记需要人工介入，这是唯一无法自愈的情况。
 * <p>
 * 编排器自动回滚和操作员手动回滚共用此流程。
 */
public class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    private final SessionStateManager stateManager;
    private final DatabaseMigrator migrator;
    private final HealthEvaluator healthEvaluator;

    public RollbackCoordinator(SessionStateManager stateManager,
                               DatabaseMigrator migrator,
                               HealthEvaluator healthEvaluator) {
        this.stateManager = stateManager;
        this.migrator = migrator;
        this.healthEvaluator = healthEvaluator;
    }

    /**
     * 从当前阶段进入回滚分支并执行到终态
     *
     * @param cause 触发回滚的失败，null 表示操作员主动回滚
     */
    public void rollback(UpdateSession session, DeploymentDriver driver, FailureInfo cause) {
        if (cause != null) {
            session.noteFailure(cause);
            if (session.getPhase() != SessionPhase.ROLLING_BACK) {
                stateManager.appendPhase(session, session.getPhase(), PhaseOutcome.FAILURE, cause.getErrorMessage());
            }
        }
        stateManager.enterPhase(session, SessionPhase.ROLLING_BACK);
        log.warn("开始回滚, sessionId: {}, 回滚到: {}", session.getSessionId(), session.getSourceVersion());

        if (session.isDryRun()) {
            session.reportWouldDo("would roll back to " + session.getSourceVersion() + " (nothing was changed)");
            stateManager.appendPhase(session, SessionPhase.ROLLING_BACK, PhaseOutcome.SIMULATED, "演练会话未发生变更，无需回滚");
            session.markRolledBack(false);
            stateManager.save(session);
            return;
        }

        ReleaseManifest source = session.getRollbackPoint().source();
        boolean dataRestored = session.isDataMigrated();
        String driverFailure;
        try {
            if (dataRestored) {
                restoreData(session);
            }
            Deadline deadline = Deadline.after(session.getPhaseTimeout());
            DeploymentOutcome outcome = driver.rollback(source, deadline);
            HealthReport gate = gate(driver, source, deadline);
            if (gate.isHealthy()) {
                stateManager.appendPhase(session, SessionPhase.ROLLING_BACK, PhaseOutcome.SUCCESS,
                        (dataRestored ? String.format("已恢复 %d 个存储, ", session.getBackupRefs().size()) : "")
                                + "驱动级回滚完成: " + outcome.detail());
                session.markRolledBack(dataRestored);
                stateManager.save(session);
                log.info("回滚完成（驱动级）, sessionId: {}", session.getSessionId());
                return;
            }
            driverFailure = "回滚后健康检查未通过: " + gate.summary();
        } catch (RuntimeException e) {
            driverFailure = e.getMessage();
        }
        log.warn("驱动级回滚未能恢复健康状态，升级为数据恢复, sessionId: {}, reason: {}",
                session.getSessionId(), driverFailure);
        stateManager.appendPhase(session, SessionPhase.ROLLING_BACK, PhaseOutcome.FAILURE,
                "驱动级回滚失败: " + driverFailure);

        try {
            restoreData(session);
            Deadline deadline = Deadline.after(session.getPhaseTimeout());
            DeploymentOutcome outcome = driver.redeploy(source, deadline);
            HealthReport gate = gate(driver, source, deadline);
            if (!gate.isHealthy()) {
                throw new RollbackException("重新部署源版本后健康检查未通过: " + gate.summary());
            }
            stateManager.appendPhase(session, SessionPhase.ROLLING_BACK, PhaseOutcome.SUCCESS,
                    String.format("已恢复 %d 个存储并重新部署源版本: %s", session.getBackupRefs().size(), outcome.detail()));
            session.markRolledBack(true);
            stateManager.save(session);
            log.info("回滚完成（数据恢复 + 重新部署）, sessionId: {}", session.getSessionId());
        } catch (RuntimeException e) {
            FailureInfo failure = FailureInfo.of(ErrorType.ROLLBACK_ERROR,
                    "回滚失败，需要人工介入: " + e.getMessage(), SessionPhase.ROLLING_BACK.name());
            stateManager.appendPhase(session, SessionPhase.ROLLING_BACK, PhaseOutcome.FAILURE, failure.getErrorMessage());
            session.fail(failure, true);
            stateManager.save(session);
            log.error("回滚失败，需要人工介入, sessionId: {}, sourceVersion: {}, backups: {}",
                    session.getSessionId(), session.getSourceVersion(),
                    session.getBackupRefs().stream().map(BackupRecord::backupId).collect(Collectors.toList()), e);
        }
    }

    private void restoreData(UpdateSession session) {
        List<BackupRecord> backups = session.getRollbackPoint().backupRefs();
        if (backups.isEmpty()) {
            log.warn("回滚点没有备份记录，跳过数据恢复, sessionId: {}", session.getSessionId());
            return;
        }
        for (BackupRecord record : backups) {
            try {
                migrator.restore(record.storeId(), record);
            } catch (RuntimeException e) {
                throw new RollbackException(String.format("恢复存储 %s 失败: %s", record.storeId(), e.getMessage()), e);
            }
        }
    }

    /**
     * 回滚后的健康门禁：在线实例必须全部运行源版本且健康
     */
    private HealthReport gate(DeploymentDriver driver, ReleaseManifest source, Deadline deadline) {
        List<DeploymentUnit> live = driver.status().stream()
                .filter(DeploymentUnit::live)
                .collect(Collectors.toList());
        List<String> wrong = live.stream()
                .filter(u -> !source.version().equals(u.currentVersion()))
                .map(DeploymentUnit::identity)
                .collect(Collectors.toList());
        if (live.isEmpty() || !wrong.isEmpty()) {
            throw new RollbackException("在线实例未回到源版本 " + source.version() + ": " + wrong);
        }
        return healthEvaluator.evaluate(live, List.of(), deadline);
    }
}
