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
import xyz.firestige.upgrade.domain.shared.exception.UpgradeException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.execution.BoundedRetry;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 并行切换驱动（蓝绿）
 * <p>
 * 部署：在备用代上并发启动全部新实例 → 全部健康 → 原子切换流量指针。旧代保持原样。
 * <p>
 * 回滚（从平台现状推导）：
 * <ul>
 *   <li>切流前：在线代仍是源版本，直接丢弃备用代</li>
 *   <li>切流后：旧代仍存在且健康时把指针切回去；否则抛出 {@link RollbackException}，由编排器升级到数据恢复</li>
 * </ul>
 * 收尾：宽限期后释放旧代；宽限期为 0 时立即释放。计划中的释放只删除收尾时登记的那批实例，
 * 新的部署、回滚或进程退出都会先处理掉它。
 */
public class ParallelCutoverDriver extends AbstractDeploymentDriver {

    private static final Logger log = LoggerFactory.getLogger(ParallelCutoverDriver.class);

    public static final String BLUE = "blue";
    public static final String GREEN = "green";

    private static final long COLLECT_GRACE_MS = 1000;

    private final ExecutorService startPool;
    private final ScheduledExecutorService retirementScheduler;
    private final Duration gracePeriod;
    private volatile PendingRetirement pendingRetirement;

    private record PendingRetirement(String generation, List<DeploymentUnit> units, ScheduledFuture<?> future) {
    }

    public ParallelCutoverDriver(ContainerPlatform platform,
                                 HealthEvaluator healthEvaluator,
                                 BoundedRetry retry,
                                 List<String> serviceOrder,
                                 ExecutorService startPool,
                                 ScheduledExecutorService retirementScheduler,
                                 Duration gracePeriod) {
        super(platform, healthEvaluator, retry, serviceOrder);
        this.startPool = startPool;
        this.retirementScheduler = retirementScheduler;
        this.gracePeriod = gracePeriod != null ? gracePeriod : Duration.ZERO;
    }

    @Override
    public DeploymentStrategyType strategy() {
        return DeploymentStrategyType.PARALLEL_CUTOVER;
    }

    public static String other(String generation) {
        return BLUE.equals(generation) ? GREEN : BLUE;
    }

    @Override
    public List<String> describePlan(ReleaseManifest source, ReleaseManifest target) {
        String live = platform.liveGeneration();
        String standby = other(live);
        List<String> plan = new ArrayList<>();
        plan.add(String.format("would pull %d image(s): %s", target.imageRefs().size(), target.imageRefs()));
        for (DeploymentUnit u : unitsOf(live)) {
            plan.add(String.format("would start %s on %s generation with %s",
                    DeploymentUnit.identityOf(u.service(), standby, u.ordinal()), standby,
                    target.covers(u.service()) ? target.imageOf(u.service()) : "?"));
        }
        plan.add(String.format("would switch traffic %s -> %s after all new units are healthy", live, standby));
        plan.add(String.format("would retire %s generation after grace period %ss", live, gracePeriod.toSeconds()));
        return plan;
    }

    @Override
    public DeploymentOutcome deploy(ReleaseManifest target, Deadline deadline) {
        cancelPendingRetirement();
        String live = platform.liveGeneration();
        String standby = other(live);
        List<DeploymentUnit> liveUnits = unitsOf(live);
        for (DeploymentUnit u : liveUnits) {
            if (!target.covers(u.service())) {
                throw new DeploymentException(String.format("目标版本未包含服务 %s 的镜像", u.service()));
            }
        }

        try {
            pullImages(target);
            removeAll(unitsOf(standby), "清理备用代残留实例");
        } catch (PlatformException e) {
            throw new DeploymentException("准备备用代失败: " + e.getMessage(), e);
        }

        log.info("并发启动新代实例, generation: {}, count: {}", standby, liveUnits.size());
        List<Future<DeploymentUnit>> futures = new ArrayList<>();
        for (DeploymentUnit u : liveUnits) {
            futures.add(startPool.submit(() -> startAndAwait(u, standby, target, deadline)));
        }
        List<String> started = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            DeploymentUnit origin = liveUnits.get(i);
            try {
                long waitMs = deadline.remaining().toMillis() + COLLECT_GRACE_MS;
                started.add(futures.get(i).get(waitMs, TimeUnit.MILLISECONDS).identity());
            } catch (TimeoutException e) {
                futures.get(i).cancel(true);
                failures.add(origin.service() + "#" + origin.ordinal() + ": 超过截止时间");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failures.add(origin.service() + "#" + origin.ordinal() + ": " + cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeploymentException("等待新代实例时被中断", e);
            }
        }
        if (!failures.isEmpty()) {
            throw new DeploymentException("新代实例未全部就绪，未切换流量: " + failures);
        }

        ensureTime(deadline, "切换流量");
        try {
            retry.run("switch traffic " + standby, () -> platform.switchTraffic(standby));
        } catch (PlatformException e) {
            throw new DeploymentException("切换流量失败: " + e.getMessage(), e);
        }
        log.info("流量已切换, {} -> {}", live, standby);
        return new DeploymentOutcome(started, String.format("新代 %s 已接流量（%d 个实例），旧代 %s 保留", standby, started.size(), live));
    }

    private DeploymentUnit startAndAwait(DeploymentUnit origin, String generation, ReleaseManifest release, Deadline deadline) {
        DeploymentUnit unit = retry.call("start " + origin.service() + "#" + origin.ordinal(),
                () -> platform.startUnit(origin.service(), origin.ordinal(), generation,
                        release.imageOf(origin.service()), release.version()));
        if (!healthEvaluator.awaitHealthy(unit, deadline)) {
            throw new DeploymentException("新实例健康检查未通过: " + unit.identity());
        }
        return unit;
    }

    @Override
    public DeploymentOutcome rollback(ReleaseManifest source, Deadline deadline) {
        cancelPendingRetirement();
        String live = platform.liveGeneration();
        List<DeploymentUnit> liveUnits = unitsOf(live);
        boolean cutOver = liveUnits.stream().anyMatch(u -> !onRelease(u, source));

        try {
            if (!cutOver) {
                List<DeploymentUnit> standby = unitsOf(other(live));
                removeAll(standby, "丢弃新代");
                log.info("切流前回滚: 已丢弃新代 {} 个实例", standby.size());
                return new DeploymentOutcome(identities(standby), "切流前回滚，已丢弃新代");
            }

            String old = other(live);
            List<DeploymentUnit> oldUnits = unitsOf(old);
            if (oldUnits.size() < liveUnits.size() || oldUnits.stream().anyMatch(u -> !onRelease(u, source))) {
                throw new RollbackException(String.format("旧代 %s 已不存在或不在源版本 %s，无法切回", old, source.version()));
            }
            for (DeploymentUnit u : oldUnits) {
                if (!healthEvaluator.awaitHealthy(u, deadline)) {
                    throw new RollbackException("旧代实例不健康，无法切回: " + u.identity());
                }
            }
            retry.run("switch traffic " + old, () -> platform.switchTraffic(old));
            log.info("切流后回滚: 流量已切回 {}", old);
            removeAll(liveUnits, "释放失败的新代");
            return new DeploymentOutcome(identities(oldUnits), String.format("流量已切回旧代 %s", old));
        } catch (PlatformException e) {
            throw new RollbackException("驱动级回滚失败: " + e.getMessage(), e);
        }
    }

    @Override
    public DeploymentOutcome redeploy(ReleaseManifest source, Deadline deadline) {
        cancelPendingRetirement();
        String live = platform.liveGeneration();
        String standby = other(live);
        List<DeploymentUnit> template = unitsOf(live);
        if (template.isEmpty()) {
            template = unitsOf(standby);
        }
        try {
            pullImages(source);
            List<DeploymentUnit> standbyUnits = unitsOf(standby);
            removeAll(standbyUnits, "清理备用代");
            List<String> started = new ArrayList<>();
            for (DeploymentUnit u : template) {
                started.add(startAndAwait(u, standby, source, deadline).identity());
            }
            retry.run("switch traffic " + standby, () -> platform.switchTraffic(standby));
            removeAll(unitsOf(live), "释放旧在线代");
            log.info("已重新部署源版本 {} 到 {} 代", source.version(), standby);
            return new DeploymentOutcome(started, String.format("源版本 %s 已重新部署到 %s 代", source.version(), standby));
        } catch (PlatformException | UpgradeException e) {
            throw new RollbackException("重新部署源版本失败: " + e.getMessage(), e);
        }
    }

    @Override
    public DeploymentOutcome finalizeDeployment(ReleaseManifest target) {
        String live = platform.liveGeneration();
        List<DeploymentUnit> liveUnits = unitsOf(live);
        if (liveUnits.isEmpty() || liveUnits.stream().anyMatch(u -> !onRelease(u, target))) {
            throw new DeploymentException(String.format("在线代 %s 不在目标版本 %s，拒绝释放旧代", live, target.version()));
        }
        String old = other(live);
        List<DeploymentUnit> oldUnits = unitsOf(old);
        if (gracePeriod.isZero() || gracePeriod.isNegative()) {
            try {
                removeAll(oldUnits, "释放旧代");
            } catch (PlatformException e) {
                throw new DeploymentException("释放旧代失败: " + e.getMessage(), e);
            }
            return new DeploymentOutcome(identities(oldUnits), String.format("旧代 %s 已释放", old));
        }
        cancelPendingRetirement();
        ScheduledFuture<?> future = retirementScheduler.schedule(() -> retire(old, oldUnits),
                gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        pendingRetirement = new PendingRetirement(old, oldUnits, future);
        log.info("旧代 {} 将在 {}s 后释放", old, gracePeriod.toSeconds());
        return new DeploymentOutcome(identities(oldUnits), String.format("旧代 %s 将在宽限期 %ss 后释放", old, gracePeriod.toSeconds()));
    }

    private void retire(String generation, List<DeploymentUnit> scheduled) {
        if (generation.equals(platform.liveGeneration())) {
            log.warn("待释放的代已重新接流量，跳过释放: {}", generation);
            return;
        }
        List<DeploymentUnit> stale = unitsOf(generation).stream()
                .filter(current -> scheduled.stream().anyMatch(r -> sameRelease(r, current)))
                .collect(Collectors.toList());
        if (stale.size() < scheduled.size()) {
            log.warn("旧代 {} 已有实例被替换，只释放登记时的实例: {}", generation, identities(stale));
        }
        try {
            removeAll(stale, "宽限期结束，释放旧代");
        } catch (PlatformException e) {
            log.warn("释放旧代失败，需要人工清理, generation: {}, error: {}", generation, e.getMessage());
        }
    }

    private static boolean sameRelease(DeploymentUnit scheduled, DeploymentUnit current) {
        return scheduled.identity().equals(current.identity())
                && Objects.equals(scheduled.image(), current.image())
                && Objects.equals(scheduled.currentVersion(), current.currentVersion());
    }

    private void cancelPendingRetirement() {
        PendingRetirement pending = pendingRetirement;
        pendingRetirement = null;
        if (pending != null && pending.future().cancel(false)) {
            log.info("已取消旧代 {} 的计划释放", pending.generation());
        }
    }

    /**
     * 进程退出时立即执行尚未到期的释放，避免旧代实例无人回收
     */
    public void close() {
        PendingRetirement pending = pendingRetirement;
        pendingRetirement = null;
        if (pending != null && pending.future().cancel(false)) {
            log.info("进程退出，提前释放旧代: {}", pending.generation());
            retire(pending.generation(), pending.units());
        }
    }

    private void removeAll(List<DeploymentUnit> units, String reason) {
        for (DeploymentUnit u : units) {
            log.info("{}: 删除实例 {}", reason, u.identity());
            retry.run("remove " + u.identity(), () -> platform.removeUnit(u.identity()));
        }
    }
}
