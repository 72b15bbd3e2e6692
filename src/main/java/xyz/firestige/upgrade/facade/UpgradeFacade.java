package xyz.firestige.upgrade.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.orchestration.UpdateOrchestrator;
import xyz.firestige.upgrade.application.orchestration.UpgradeRequest;
import xyz.firestige.upgrade.application.orchestration.UpgradeResult;
import xyz.firestige.upgrade.application.query.SessionQueryService;
import xyz.firestige.upgrade.application.query.SessionStatus;
import xyz.firestige.upgrade.application.query.SignatureReverificationService;
import xyz.firestige.upgrade.application.rollback.ManualRollbackService;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.exception.UpgradeException;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.domain.signature.VerificationReport;
import xyz.firestige.upgrade.facade.exception.UpgradeOperationException;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 升级操作 Facade
 * <p>
 * 职责：
 * 1. 参数校验（快速失败）
 * 2. 调用应用服务
 * 3. 异常转换：会话创建前的错误 → {@link UpgradeOperationException}
 * <p>
 * 会话一旦创建，失败不再以异常形式抛出，而是体现在 {@link UpgradeResult} 中。
 */
public class UpgradeFacade {

    private static final Logger logger = LoggerFactory.getLogger(UpgradeFacade.class);

    private final UpdateOrchestrator orchestrator;
    private final ManualRollbackService rollbackService;
    private final SessionQueryService queryService;
    private final SignatureReverificationService reverificationService;
    private final SessionStateManager stateManager;
    private final Validator validator;
    private final int keepSessions;

    public UpgradeFacade(UpdateOrchestrator orchestrator,
                         ManualRollbackService rollbackService,
                         SessionQueryService queryService,
                         SignatureReverificationService reverificationService,
                         SessionStateManager stateManager,
                         Validator validator,
                         int keepSessions) {
        this.orchestrator = orchestrator;
        this.rollbackService = rollbackService;
        this.queryService = queryService;
        this.reverificationService = reverificationService;
        this.stateManager = stateManager;
        this.validator = validator;
        this.keepSessions = keepSessions;
    }

    /**
     * 发起升级
     */
    public UpgradeResult upgrade(UpgradeRequest request) {
        logger.info("[Facade] 发起升级: {}", request);
        if (request == null) {
            throw new IllegalArgumentException("升级请求不能为空");
        }
        Set<ConstraintViolation<UpgradeRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] 升级请求校验失败: {}", errorDetail);
            throw new IllegalArgumentException("升级请求校验失败: " + errorDetail);
        }
        UpgradeResult result = invoke("升级", () -> orchestrator.upgrade(request));
        logger.info("[Facade] 升级结束: {}", result);
        return result;
    }

    /**
     * 回滚指定会话；未指定时回滚最近一个未完成的会话
     */
    public UpgradeResult rollback(Optional<String> sessionId) {
        logger.info("[Facade] 发起回滚: {}", sessionId.orElse("<latest>"));
        UpgradeResult result = invoke("回滚", () -> rollbackService.rollback(sessionId.map(SessionId::of)));
        logger.info("[Facade] 回滚结束: {}", result);
        return result;
    }

    /**
     * 查询会话状态；未指定时返回最近一个会话
     */
    public SessionStatus status(Optional<String> sessionId) {
        logger.debug("[Facade] 查询会话状态: {}", sessionId.orElse("<latest>"));
        return invoke("查询状态", () -> queryService.status(sessionId.map(SessionId::of)));
    }

    /**
     * 取消本进程中正在运行的会话，在下一个阶段边界生效
     */
    public void cancel(String sessionId, String operator) {
        logger.info("[Facade] 取消会话: {}, operator: {}", sessionId, operator);
        SessionId id = invoke("取消", () -> SessionId.of(sessionId));
        if (!orchestrator.cancel(id, operator)) {
            throw new UpgradeOperationException("会话不在本进程中运行: " + sessionId,
                    FailureInfo.of(ErrorType.VALIDATION_ERROR, "会话不在本进程中运行: " + sessionId));
        }
    }

    /**
     * 放弃崩溃后遗留的会话并释放部署目标
     */
    public SessionStatus abandon(String sessionId, String operator) {
        logger.warn("[Facade] 放弃会话: {}, operator: {}", sessionId, operator);
        return invoke("放弃会话", () -> {
            SessionId id = SessionId.of(sessionId);
            if (orchestrator.isRunning(id)) {
                throw new UpgradeOperationException("会话仍在运行，请使用取消: " + sessionId,
                        FailureInfo.of(ErrorType.VALIDATION_ERROR, "会话仍在运行: " + sessionId));
            }
            stateManager.abandon(id, operator);
            return queryService.status(Optional.of(id));
        });
    }

    /**
     * 按保留数清理历史会话记录
     *
     * @return 删除的记录数
     */
    public int pruneHistory() {
        int removed = stateManager.prune(keepSessions);
        logger.info("[Facade] 清理历史会话 {} 条, 保留: {}", removed, keepSessions);
        return removed;
    }

    /**
     * 重新校验会话目标版本的镜像签名（不修改会话记录）
     */
    public VerificationReport reverifySignatures(String sessionId) {
        return invoke("重新校验签名", () -> reverificationService.reverify(SessionId.of(sessionId)));
    }

    private <T> T invoke(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (UpgradeOperationException e) {
            throw e;
        } catch (UpgradeException e) {
            logger.warn("[Facade] {}失败: {}", action, e.getMessage());
            throw new UpgradeOperationException(action + "失败: " + e.getMessage(), e.getFailureInfo(), e);
        } catch (IllegalArgumentException e) {
            logger.warn("[Facade] {}参数错误: {}", action, e.getMessage());
            throw new UpgradeOperationException(action + "失败: " + e.getMessage(),
                    FailureInfo.of(ErrorType.VALIDATION_ERROR, e.getMessage()), e);
        }
    }
}
