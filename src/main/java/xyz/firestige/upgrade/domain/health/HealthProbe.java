package xyz.firestige.upgrade.domain.health;

import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;

/**
 * 健康探针（外部协作方）
 * <p>
 * 每次调用自带超时；抛出异常等同于一次失败的探测。
 */
public interface HealthProbe {

    /**
     * 探测服务实例
     */
    boolean probeUnit(DeploymentUnit unit);

    /**
     * 探测持久化存储
     */
    boolean probeStore(String storeId);
}
