package xyz.firestige.upgrade.domain.session.event;

import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;

/**
 * 会话已创建
 */
public class SessionStartedEvent extends SessionEvent {

    private final String sourceVersion;
    private final String targetVersion;
    private final DeploymentStrategyType strategy;
    private final boolean dryRun;

    public SessionStartedEvent(String sessionId, String sourceVersion, String targetVersion,
                               DeploymentStrategyType strategy, boolean dryRun) {
        super(sessionId);
        this.sourceVersion = sourceVersion;
        this.targetVersion = targetVersion;
        this.strategy = strategy;
        this.dryRun = dryRun;
    }

    public String getSourceVersion() {
        return sourceVersion;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public DeploymentStrategyType getStrategy() {
        return strategy;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
