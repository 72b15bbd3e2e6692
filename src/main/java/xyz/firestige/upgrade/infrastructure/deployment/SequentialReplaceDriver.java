package xyz.firestige.upgrade.infrastructure.deployment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentOutcome;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.PlatformException;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.shared.exception.DeploymentException;
import xyz.firestige.upgrade.domain.shared.exception.RollbackException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.execution.BoundedRetry;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 顺序替换驱动（滚动）
 * <p>
 * 每个实例：摘流 → 替换 → 隔离健康检查 → 接流，然后才处理下一个。
 * 任一实例失败立即停止，未处理的实例保持原样。
 * <p>
 * 回滚从平台现状推导：凡是不在源版本上、或被摘流的在线代实例，按部署顺序的逆序恢复。
 */
public class SequentialReplaceDriver extends AbstractDeploymentDriver {

    private static final Logger log = LoggerFactory.getLogger(SequentialReplaceDriver.class);

    public SequentialReplaceDriver(ContainerPlatform platform,
                                   HealthEvaluator healthEvaluator,
                                   BoundedRetry retry,
                                   List<String> serviceOrder) {
        super(platform, healthEvaluator, retry, serviceOrder);
    }

    @Override
    public DeploymentStrategyType strategy() {
        return DeploymentStrategyType.SEQUENTIAL_REPLACE;
    }

    @Override
    public List<String> describePlan(ReleaseManifest source, ReleaseManifest target) {
        List<String> plan = new ArrayList<>();
        plan.add(String.format("would pull %d image(s): %s", target.imageRefs().size(), target.imageRefs()));
        for (DeploymentUnit u : unitsOf(platform.liveGeneration())) {
            plan.add(String.format("would replace %s: %s -> %s (drain, replace, health-check, admit)",
                    u.identity(), u.image(), target.covers(u.service()) ? target.imageOf(u.service()) : "?"));
        }
        plan.add("would finalize: no extra resources to release");
        return plan;
    }

    @Override
    public DeploymentOutcome deploy(ReleaseManifest target, Deadline deadline) {
        try {
            pullImages(target);
        } catch (PlatformException e) {
            throw new DeploymentException("拉取镜像失败: " + e.getMessage(), e);
        }
        List<DeploymentUnit> order = unitsOf(platform.liveGeneration());
        List<String> replaced = new ArrayList<>();
        int total = order.size();
        for (DeploymentUnit unit : order) {
            if (!target.covers(unit.service())) {
                throw new DeploymentException(String.format("目标版本未包含服务 %s 的镜像", unit.service()));
            }
            if (onRelease(unit, target) && unit.live()) {
                continue;
            }
            ensureTime(deadline, "替换 " + unit.identity());
            log.info("替换实例 ({}/{}): {}, {} -> {}", replaced.size() + 1, total, unit.identity(),
                    unit.currentVersion(), target.version());
            try {
                retry.run("drain " + unit.identity(), () -> platform.drain(unit.identity()));
                DeploymentUnit next = retry.call("replace " + unit.identity(),
                        () -> platform.replaceUnit(unit.identity(), target.imageOf(unit.service()), target.version()));
                if (!healthEvaluator.awaitHealthy(next, deadline)) {
                    throw new DeploymentException(String.format(
                            "实例健康检查未通过: %s，已停止后续替换（已替换 %d/%d）", unit.identity(), replaced.size() + 1, total));
                }
                retry.run("admit " + unit.identity(), () -> platform.admit(unit.identity()));
            } catch (PlatformException e) {
                throw new DeploymentException(String.format("替换实例失败: %s, 原因: %s", unit.identity(), e.getMessage()), e);
            }
            replaced.add(unit.identity());
        }
        return new DeploymentOutcome(replaced, String.format("已替换 %d/%d 个实例", replaced.size(), total));
    }

    @Override
    public DeploymentOutcome rollback(ReleaseManifest source, Deadline deadline) {
        return restoreTo(source, deadline, "回滚");
    }

    @Override
    public DeploymentOutcome redeploy(ReleaseManifest source, Deadline deadline) {
        try {
            pullImages(source);
        } catch (PlatformException e) {
            throw new RollbackException("拉取源版本镜像失败: " + e.getMessage(), e);
        }
        return restoreTo(source, deadline, "重新部署");
    }

    @Override
    public DeploymentOutcome finalizeDeployment(ReleaseManifest target) {
        List<DeploymentUnit> units = unitsOf(platform.liveGeneration());
        List<String> lagging = new ArrayList<>();
        for (DeploymentUnit u : units) {
            if (!onRelease(u, target) || !u.live()) {
                lagging.add(u.identity());
            }
        }
        if (!lagging.isEmpty()) {
            throw new DeploymentException("收尾时发现实例不在目标版本或未接流量: " + lagging);
        }
        return new DeploymentOutcome(List.of(), "滚动部署无需释放额外资源");
    }

    private DeploymentOutcome restoreTo(ReleaseManifest source, Deadline deadline, String action) {
        List<DeploymentUnit> order = unitsOf(platform.liveGeneration());
        Collections.reverse(order);
        List<String> restored = new ArrayList<>();
        for (DeploymentUnit unit : order) {
            boolean atSource = onRelease(unit, source);
            if (atSource && unit.live()) {
                continue;
            }
            if (deadline.isExpired()) {
                throw new RollbackException(String.format("%s预算耗尽, 已恢复: %s", action, restored));
            }
            log.info("{}实例: {}, {} -> {}", action, unit.identity(), unit.currentVersion(), source.version());
            try {
                DeploymentUnit current = unit;
                if (!atSource) {
                    retry.run("drain " + unit.identity(), () -> platform.drain(unit.identity()));
                    current = retry.call("restore " + unit.identity(),
                            () -> platform.replaceUnit(unit.identity(), source.imageOf(unit.service()), source.version()));
                }
                if (!healthEvaluator.awaitHealthy(current, deadline)) {
                    throw new RollbackException(String.format("%s后实例不健康: %s", action, unit.identity()));
                }
                retry.run("admit " + unit.identity(), () -> platform.admit(unit.identity()));
            } catch (PlatformException | IllegalArgumentException e) {
                throw new RollbackException(String.format("%s实例失败: %s, 原因: %s", action, unit.identity(), e.getMessage()), e);
            }
            restored.add(unit.identity());
        }
        log.info("{}完成, 恢复实例: {}", action, restored);
        return new DeploymentOutcome(restored, String.format("%s %d 个实例到 %s", action, restored.size(), source.version()));
    }
}
