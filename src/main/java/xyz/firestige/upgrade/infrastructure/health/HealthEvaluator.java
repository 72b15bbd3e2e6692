package xyz.firestige.upgrade.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.domain.health.HealthProbe;
import xyz.firestige.upgrade.domain.health.HealthReport;
import xyz.firestige.upgrade.domain.health.TargetHealth;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.execution.BoundedPolling;
import xyz.firestige.upgrade.infrastructure.execution.BoundedPolling.PollResult;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 健康评估器
 * <p>
 * 职责：
 * <ul>
 *   <li>并发探测多个实例和存储，每个对象都是有界轮询（次数 + 间隔 + 截止时间）</li>
 *   <li>汇总结论：全部通过 HEALTHY，部分通过 DEGRADED，全部失败 UNHEALTHY</li>
 *   <li>为驱动提供单实例隔离检查 {@link #awaitHealthy}</li>
 * </ul>
 * 实例探测结果回写到平台，使 status() 能看到最近一次健康状态。
 */
public class HealthEvaluator {

    private static final Logger log = LoggerFactory.getLogger(HealthEvaluator.class);

    /**
     * 截止时间之后等待探测线程收尾的余量
     */
    private static final long COLLECT_GRACE_MS = 500;

    private final HealthProbe probe;
    private final ContainerPlatform platform;
    private final ExecutorService executor;
    private final int maxAttempts;
    private final Duration interval;

    public HealthEvaluator(HealthProbe probe, ContainerPlatform platform, ExecutorService executor,
                           int maxAttempts, Duration interval) {
        this.probe = probe;
        this.platform = platform;
        this.executor = executor;
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    /**
     * 评估一组实例和存储
     */
    public HealthReport evaluate(List<DeploymentUnit> units, List<String> storeIds, Deadline deadline) {
        log.info("开始健康检查, 实例数: {}, 存储数: {}", units.size(), storeIds.size());
        List<String> names = new ArrayList<>();
        List<Future<TargetHealth>> futures = new ArrayList<>();
        for (DeploymentUnit unit : units) {
            names.add(unit.identity());
            futures.add(executor.submit(() -> checkUnit(unit, deadline)));
        }
        for (String storeId : storeIds) {
            names.add(storeId);
            futures.add(executor.submit(() -> checkStore(storeId, deadline)));
        }

        List<TargetHealth> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            boolean store = i >= units.size();
            results.add(collect(names.get(i), store, futures.get(i), deadline));
        }

        HealthReport report = HealthReport.of(results);
        log.info("健康检查结束, 结论: {}", report.summary());
        return report;
    }

    /**
     * 单实例隔离检查，供驱动在接入流量前调用
     */
    public boolean awaitHealthy(DeploymentUnit unit, Deadline deadline) {
        TargetHealth result = checkUnit(unit, deadline);
        if (!result.healthy()) {
            log.warn("实例健康检查未通过, unit: {}, attempts: {}, reason: {}", unit.identity(), result.attempts(), result.detail());
        }
        return result.healthy();
    }

    private TargetHealth checkUnit(DeploymentUnit unit, Deadline deadline) {
        PollResult r = BoundedPolling.poll("unit:" + unit.identity(), () -> probe.probeUnit(unit), maxAttempts, interval, deadline);
        platform.recordHealth(unit.identity(), r.satisfied() ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY, LocalDateTime.now());
        return new TargetHealth(unit.identity(), false, r.satisfied(), r.attempts(), r.lastError());
    }

    private TargetHealth checkStore(String storeId, Deadline deadline) {
        PollResult r = BoundedPolling.poll("store:" + storeId, () -> probe.probeStore(storeId), maxAttempts, interval, deadline);
        return new TargetHealth(storeId, true, r.satisfied(), r.attempts(), r.lastError());
    }

    private TargetHealth collect(String name, boolean store, Future<TargetHealth> future, Deadline deadline) {
        long waitMs = deadline.remaining().toMillis() + COLLECT_GRACE_MS;
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new TargetHealth(name, store, false, 0, "超过截止时间");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new TargetHealth(name, store, false, 0, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new TargetHealth(name, store, false, 0, "interrupted");
        }
    }
}
