package xyz.firestige.upgrade.infrastructure.deployment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.shared.exception.DeploymentException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.execution.BoundedRetry;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 部署驱动公共部分：平台访问、有界重试、实例排序、镜像拉取
 */
public abstract class AbstractDeploymentDriver implements DeploymentDriver {

    private static final Logger log = LoggerFactory.getLogger(AbstractDeploymentDriver.class);

    protected final ContainerPlatform platform;
    protected final HealthEvaluator healthEvaluator;
    protected final BoundedRetry retry;
    private final List<String> serviceOrder;

    protected AbstractDeploymentDriver(ContainerPlatform platform,
                                       HealthEvaluator healthEvaluator,
                                       BoundedRetry retry,
                                       List<String> serviceOrder) {
        this.platform = platform;
        this.healthEvaluator = healthEvaluator;
        this.retry = retry;
        this.serviceOrder = serviceOrder != null ? serviceOrder : List.of();
    }

    @Override
    public List<DeploymentUnit> status() {
        return platform.listUnits();
    }

    /**
     * 指定代的实例，按配置的服务顺序、再按序号排列
     */
    protected List<DeploymentUnit> unitsOf(String generation) {
        return platform.listUnits().stream()
                .filter(u -> generation.equals(u.generation()))
                .sorted(unitOrder())
                .collect(Collectors.toList());
    }

    protected Comparator<DeploymentUnit> unitOrder() {
        return Comparator.<DeploymentUnit>comparingInt(u -> {
                    int idx = serviceOrder.indexOf(u.service());
                    return idx < 0 ? Integer.MAX_VALUE : idx;
                })
                .thenComparing(DeploymentUnit::service)
                .thenComparingInt(DeploymentUnit::ordinal);
    }

    protected void pullImages(ReleaseManifest manifest) {
        for (String image : manifest.imageRefs()) {
            log.info("拉取镜像: {}", image);
            retry.run("pull " + image, () -> platform.pullImage(image));
        }
    }

    protected void ensureTime(Deadline deadline, String action) {
        if (deadline.isExpired()) {
            throw new DeploymentException(String.format("阶段预算耗尽, 未完成动作: %s", action));
        }
    }

    protected static boolean onRelease(DeploymentUnit unit, ReleaseManifest manifest) {
        return unit.runs(manifest.version())
                && manifest.covers(unit.service())
                && manifest.imageOf(unit.service()).equals(unit.image());
    }

    protected static List<String> identities(List<DeploymentUnit> units) {
        List<String> ids = new ArrayList<>();
        for (DeploymentUnit u : units) {
            ids.add(u.identity());
        }
        return ids;
    }
}
