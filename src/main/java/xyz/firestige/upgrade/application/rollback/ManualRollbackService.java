package xyz.firestige.upgrade.application.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.orchestration.UpdateOrchestrator;
import xyz.firestige.upgrade.application.orchestration.UpgradeResult;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.infrastructure.deployment.DeploymentDriverFactory;

import java.util.Optional;

/**
 * 操作员发起的回滚
 * <p>
 * 目标是崩溃或中断后遗留的非终态会话：
 * <ul>
 *   <li>尚未发生变更（预检 / 备份 / 签名校验）：直接结束为 FAILED</li>
 *   <li>已发生变更：走完整的回滚流程</li>
 * </ul>
 * 已结束的会话不再回滚；完成后的版本需要发起新的"降级"升级会话。
 */
public class ManualRollbackService {

    private static final Logger log = LoggerFactory.getLogger(ManualRollbackService.class);

    private final SessionStateManager stateManager;
    private final DeploymentDriverFactory driverFactory;
    private final RollbackCoordinator rollbackCoordinator;
    private final UpdateOrchestrator orchestrator;

    public ManualRollbackService(SessionStateManager stateManager,
                                 DeploymentDriverFactory driverFactory,
                                 RollbackCoordinator rollbackCoordinator,
                                 UpdateOrchestrator orchestrator) {
        this.stateManager = stateManager;
        this.driverFactory = driverFactory;
        this.rollbackCoordinator = rollbackCoordinator;
        this.orchestrator = orchestrator;
    }

    /**
     * 回滚指定会话；未指定时取最近一个未完成的会话
     *
     * @throws ValidationException 找不到会话、会话已结束或仍在本进程中运行
     */
    public UpgradeResult rollback(Optional<SessionId> sessionId) {
        UpdateSession session = sessionId
                .map(stateManager::get)
                .orElseGet(() -> stateManager.latestNotCompleted()
                        .orElseThrow(() -> new ValidationException("没有可回滚的会话")));
        log.info("手动回滚, sessionId: {}, phase: {}", session.getSessionId(), session.getPhase());

        if (session.isTerminal()) {
            throw new ValidationException(String.format("会话已结束，无需回滚, sessionId: %s, phase: %s",
                    session.getSessionId(), session.getPhase()));
        }
        if (orchestrator.isRunning(session.getSessionId())) {
            throw new ValidationException("会话仍在运行，请使用取消: " + session.getSessionId());
        }
        if (!session.isDryRun()) {
            stateManager.reacquire(session);
        }

        FailureInfo cause = FailureInfo.of(ErrorType.CANCELLED, "操作员手动回滚", session.getPhase().name());
        if (!session.getPhase().isMutating()) {
            session.recordOutcome(PhaseOutcome.FAILURE, cause.getErrorMessage());
            session.fail(cause, false);
            stateManager.save(session);
            log.info("会话尚未发生变更，已直接结束, sessionId: {}", session.getSessionId());
            return UpgradeResult.of(session);
        }

        DeploymentDriver driver = driverFactory.forStrategy(session.getStrategy());
        rollbackCoordinator.rollback(session, driver, cause);
        return UpgradeResult.of(session);
    }
}
