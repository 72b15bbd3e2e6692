package xyz.firestige.upgrade.domain.deployment;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 容器平台（外部协作方）
 * <p>
 * 部署驱动只通过该接口读写实例，所有状态都可以从 {@link #listUnits()} 重新推导，
 * 因此回滚可以在另一个进程里基于平台现状完成。
 */
public interface ContainerPlatform {

    /**
     * 所有实例（包含未接流量的备用代）
     */
    List<DeploymentUnit> listUnits();

    /**
     * 当前接收流量的代
     */
    String liveGeneration();

    /**
     * 启动一个新实例（不接流量）
     */
    DeploymentUnit startUnit(String service, int ordinal, String generation, String image, String version);

    /**
     * 原地替换实例的镜像和版本
     */
    DeploymentUnit replaceUnit(String identity, String image, String version);

    void removeUnit(String identity);

    /**
     * 摘除流量
     */
    void drain(String identity);

    /**
     * 接入流量
     */
    void admit(String identity);

    /**
     * 原子切换流量指针到指定代
     */
    void switchTraffic(String generation);

    void pullImage(String image);

    boolean imageAvailable(String image);

    void recordHealth(String identity, HealthStatus status, LocalDateTime checkedAt);

    /**
     * 可容纳的实例数上限
     */
    int capacity();
}
