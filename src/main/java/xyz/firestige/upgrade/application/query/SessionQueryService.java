package xyz.firestige.upgrade.application.query;

import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.infrastructure.deployment.DeploymentDriverFactory;

import java.util.List;
import java.util.Optional;

/**
 * 会话查询服务
 * <p>
 * 实例状态每次都通过驱动的 status() 现读，不使用任何缓存，升级进行中查询也不会看到过期数据。
 */
public class SessionQueryService {

    private final SessionStateManager stateManager;
    private final DeploymentDriverFactory driverFactory;

    public SessionQueryService(SessionStateManager stateManager, DeploymentDriverFactory driverFactory) {
        this.stateManager = stateManager;
        this.driverFactory = driverFactory;
    }

    /**
     * 查询指定会话；未指定时返回最近一个会话
     */
    public SessionStatus status(Optional<SessionId> sessionId) {
        Optional<UpdateSession> session = sessionId.isPresent()
                ? Optional.of(stateManager.get(sessionId.get()))
                : stateManager.latest();
        DeploymentStrategyType strategy = session.map(UpdateSession::getStrategy)
                .orElse(DeploymentStrategyType.PARALLEL_CUTOVER);
        List<DeploymentUnit> units = driverFactory.forStrategy(strategy).status();
        return session.map(s -> SessionStatus.of(s, units))
                .orElseGet(() -> SessionStatus.unitsOnly(units));
    }

    public List<UpdateSession> activeSessions() {
        return stateManager.listActive();
    }
}
