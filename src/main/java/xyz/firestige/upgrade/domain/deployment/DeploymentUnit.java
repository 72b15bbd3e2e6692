package xyz.firestige.upgrade.domain.deployment;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 部署单元：一个运行中的服务副本
 * <p>
 * 部署单元是唯一的可变事实来源，始终通过 {@link DeploymentDriver#status()} 读取，
 * 编排器不缓存它们。
 *
 * @param identity       实例标识（service-generation-ordinal）
 * @param service        服务名
 * @param ordinal        服务内序号
 * @param generation     所属代（并行切换用 blue/green，顺序替换固定为当前代）
 * @param image          当前运行的镜像
 * @param currentVersion 当前版本
 * @param desiredVersion 期望版本
 * @param healthStatus   最近一次健康状态
 * @param lastCheckedAt  最近一次健康检查时间
 * @param live           是否接收流量
 */
public record DeploymentUnit(String identity,
                             String service,
                             int ordinal,
                             String generation,
                             String image,
                             String currentVersion,
                             String desiredVersion,
                             HealthStatus healthStatus,
                             LocalDateTime lastCheckedAt,
                             boolean live) {

    public DeploymentUnit {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(service, "service cannot be null");
        healthStatus = healthStatus != null ? healthStatus : HealthStatus.UNKNOWN;
    }

    public static String identityOf(String service, String generation, int ordinal) {
        return service + "-" + generation + "-" + ordinal;
    }

    public boolean runs(String version) {
        return Objects.equals(currentVersion, version);
    }

    public DeploymentUnit withHealth(HealthStatus status, LocalDateTime checkedAt) {
        return new DeploymentUnit(identity, service, ordinal, generation, image, currentVersion, desiredVersion,
                status, checkedAt, live);
    }

    public DeploymentUnit withLive(boolean live) {
        return new DeploymentUnit(identity, service, ordinal, generation, image, currentVersion, desiredVersion,
                healthStatus, lastCheckedAt, live);
    }

    public DeploymentUnit withRelease(String image, String version) {
        return new DeploymentUnit(identity, service, ordinal, generation, image, version, version,
                HealthStatus.UNKNOWN, null, live);
    }

    public DeploymentUnit withDesired(String version) {
        return new DeploymentUnit(identity, service, ordinal, generation, image, currentVersion, version,
                healthStatus, lastCheckedAt, live);
    }
}
