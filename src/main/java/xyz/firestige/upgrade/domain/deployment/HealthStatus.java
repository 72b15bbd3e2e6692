package xyz.firestige.upgrade.domain.deployment;

/**
 * 实例健康状态
 */
public enum HealthStatus {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
