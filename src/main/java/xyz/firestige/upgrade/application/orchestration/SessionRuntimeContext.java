package xyz.firestige.upgrade.application.orchestration;

import org.slf4j.MDC;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;

/**
 * 会话运行时上下文：MDC 与取消标志
 * <p>
 * 取消只在阶段边界检查，不打断正在执行的外部调用。
 */
public class SessionRuntimeContext {
    private final SessionId sessionId;
    private final String deploymentTarget;
    private volatile boolean cancelRequested;
    private volatile String cancelledBy;

    public SessionRuntimeContext(SessionId sessionId, String deploymentTarget) {
        this.sessionId = sessionId;
        this.deploymentTarget = deploymentTarget;
    }

    public void injectMdc(SessionPhase phase) {
        MDC.put("sessionId", sessionId.getValue());
        MDC.put("target", deploymentTarget);
        if (phase != null) {
            MDC.put("phase", phase.name());
        }
    }

    public void clearMdc() {
        MDC.remove("sessionId");
        MDC.remove("target");
        MDC.remove("phase");
    }

    public boolean isCancelRequested() { return cancelRequested; }

    public void requestCancel(String operator) {
        this.cancelledBy = operator;
        this.cancelRequested = true;
    }

    public String getCancelledBy() { return cancelledBy; }

    public SessionId getSessionId() { return sessionId; }

    public String getDeploymentTarget() { return deploymentTarget; }
}
