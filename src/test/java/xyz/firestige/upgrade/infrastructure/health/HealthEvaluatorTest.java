package xyz.firestige.upgrade.infrastructure.health;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.domain.health.HealthProbe;
import xyz.firestige.upgrade.domain.health.HealthReport;
import xyz.firestige.upgrade.domain.health.HealthVerdict;
import xyz.firestige.upgrade.domain.health.TargetHealth;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.deployment.InMemoryContainerPlatform;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HealthEvaluator 测试
 */
@DisplayName("健康评估器测试")
class HealthEvaluatorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private InMemoryContainerPlatform platform;
    private InMemoryHealthProbe probe;
    private HealthEvaluator evaluator;

    @BeforeEach
    void setUp() {
        platform = new InMemoryContainerPlatform("blue", 8);
        platform.seed("api", 2, "registry.test/api:1.0.0", "1.0.0");
        probe = new InMemoryHealthProbe();
        evaluator = new HealthEvaluator(probe, platform, pool, 3, Duration.ofMillis(5));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("全部通过为 HEALTHY，结果回写平台")
    void allHealthy() {
        HealthReport report = evaluator.evaluate(platform.listUnits(), List.of("db"), deadline());

        assertThat(report.verdict()).isEqualTo(HealthVerdict.HEALTHY);
        assertThat(report.targets()).extracting(TargetHealth::name).containsExactly("api-blue-0", "api-blue-1", "db");
        assertThat(report.targets()).allMatch(t -> t.attempts() == 1);
        assertThat(platform.listUnits()).allMatch(u -> u.healthStatus() == HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("部分通过为 DEGRADED，列出未通过对象")
    void partiallyHealthy() {
        probe.markStoreUnhealthy("db");

        HealthReport report = evaluator.evaluate(platform.listUnits(), List.of("db"), deadline());

        assertThat(report.verdict()).isEqualTo(HealthVerdict.DEGRADED);
        assertThat(report.isHealthy()).isFalse();
        assertThat(report.unhealthyTargets()).containsExactly("db");
        assertThat(report.targets().get(2).attempts()).isEqualTo(3);
        assertThat(report.summary()).contains("db");
    }

    @Test
    @DisplayName("全部失败为 UNHEALTHY，实例状态回写为不健康")
    void allUnhealthy() {
        probe.markImageUnhealthy("registry.test/api:1.0.0");

        HealthReport report = evaluator.evaluate(platform.listUnits(), List.of(), deadline());

        assertThat(report.verdict()).isEqualTo(HealthVerdict.UNHEALTHY);
        assertThat(platform.listUnits()).allMatch(u -> u.healthStatus() == HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("探测在若干次失败后恢复则通过")
    void recoversWithinAttempts() {
        AtomicInteger calls = new AtomicInteger();
        HealthProbe flaky = new HealthProbe() {
            @Override
            public boolean probeUnit(DeploymentUnit unit) {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("connection refused");
                }
                return true;
            }

            @Override
            public boolean probeStore(String storeId) {
                return true;
            }
        };
        HealthEvaluator patient = new HealthEvaluator(flaky, platform, pool, 3, Duration.ofMillis(5));

        DeploymentUnit unit = platform.listUnits().get(0);

        assertThat(patient.awaitHealthy(unit, deadline())).isTrue();
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("截止时间到达后不再等待探测")
    void respectsDeadline() {
        HealthProbe hanging = new HealthProbe() {
            @Override
            public boolean probeUnit(DeploymentUnit unit) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return true;
            }

            @Override
            public boolean probeStore(String storeId) {
                return true;
            }
        };
        HealthEvaluator slow = new HealthEvaluator(hanging, platform, pool, 1, Duration.ZERO);
        long start = System.nanoTime();

        HealthReport report = slow.evaluate(platform.listUnits(), List.of(), Deadline.after(Duration.ofMillis(100)));

        assertThat(report.verdict()).isEqualTo(HealthVerdict.UNHEALTHY);
        assertThat(report.targets()).allMatch(t -> "超过截止时间".equals(t.detail()));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(5));
    }
}
