package xyz.firestige.upgrade.infrastructure.deployment;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.upgrade.domain.deployment.DeploymentOutcome;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.shared.exception.DeploymentException;
import xyz.firestige.upgrade.domain.shared.exception.RollbackException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.execution.BoundedRetry;
import xyz.firestige.upgrade.testutil.UpgradeTestFixture;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.upgrade.infrastructure.deployment.ParallelCutoverDriver.BLUE;
import static xyz.firestige.upgrade.infrastructure.deployment.ParallelCutoverDriver.GREEN;
import static xyz.firestige.upgrade.testutil.UpgradeTestFixture.SOURCE_VERSION;
import static xyz.firestige.upgrade.testutil.UpgradeTestFixture.TARGET_VERSION;
import static xyz.firestige.upgrade.testutil.UpgradeTestFixture.image;

/**
 * ParallelCutoverDriver 测试
 */
@DisplayName("并行切换驱动测试")
class ParallelCutoverDriverTest {

    @TempDir
    Path backupRoot;

    private UpgradeTestFixture fx;
    private ParallelCutoverDriver driver;

    @BeforeEach
    void setUp() {
        fx = new UpgradeTestFixture(backupRoot);
        driver = fx.parallelDriver;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("新代全部健康后切流，旧代保留到收尾")
    void cutsOverAfterAllHealthy() {
        DeploymentOutcome outcome = driver.deploy(fx.target(), deadline());

        assertThat(outcome.affectedUnits()).containsExactlyInAnyOrder("api-green-0", "api-green-1", "web-green-0");
        assertThat(fx.platform.liveGeneration()).isEqualTo(GREEN);
        assertThat(unitsOf(BLUE)).hasSize(3).allMatch(u -> u.runs(SOURCE_VERSION) && !u.live());
        assertThat(unitsOf(GREEN)).allMatch(u -> u.runs(TARGET_VERSION) && u.live());

        driver.finalizeDeployment(fx.target());

        assertThat(unitsOf(BLUE)).isEmpty();
    }

    @Test
    @DisplayName("新代不健康时不切流；回滚丢弃新代")
    void failureBeforeCutover() {
        fx.probe.markImageUnhealthy(image("web", TARGET_VERSION));

        assertThatThrownBy(() -> driver.deploy(fx.target(), deadline()))
                .isInstanceOf(DeploymentException.class)
                .hasMessageContaining("未切换流量");
        assertThat(fx.platform.liveGeneration()).isEqualTo(BLUE);

        driver.rollback(fx.source(), deadline());

        assertThat(unitsOf(GREEN)).isEmpty();
        assertThat(unitsOf(BLUE)).hasSize(3).allMatch(DeploymentUnit::live);
    }

    @Test
    @DisplayName("切流后回滚：流量切回旧代并释放新代")
    void rollbackAfterCutover() {
        driver.deploy(fx.target(), deadline());

        DeploymentOutcome outcome = driver.rollback(fx.source(), deadline());

        assertThat(fx.platform.liveGeneration()).isEqualTo(BLUE);
        assertThat(outcome.affectedUnits()).containsExactly("api-blue-0", "api-blue-1", "web-blue-0");
        assertThat(unitsOf(GREEN)).isEmpty();
    }

    @Test
    @DisplayName("旧代已释放时驱动级回滚失败；重新部署源版本到备用代")
    void redeployAfterRetirement() {
        driver.deploy(fx.target(), deadline());
        driver.finalizeDeployment(fx.target());

        assertThatThrownBy(() -> driver.rollback(fx.source(), deadline()))
                .isInstanceOf(RollbackException.class)
                .hasMessageContaining("无法切回");

        driver.redeploy(fx.source(), deadline());

        assertThat(fx.platform.liveGeneration()).isEqualTo(BLUE);
        assertThat(driver.status()).hasSize(3).allMatch(u -> u.live() && u.runs(SOURCE_VERSION));
    }

    @Test
    @DisplayName("宽限期内回滚会取消旧代的计划释放")
    void rollbackCancelsPendingRetirement() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ParallelCutoverDriver graceful = new ParallelCutoverDriver(fx.platform, fx.healthEvaluator,
                    new BoundedRetry(1, Duration.ZERO), UpgradeTestFixture.SERVICES, pool, scheduler,
                    Duration.ofMillis(300));
            graceful.deploy(fx.target(), deadline());
            DeploymentOutcome finalized = graceful.finalizeDeployment(fx.target());
            assertThat(finalized.detail()).contains("宽限期");

            graceful.rollback(fx.source(), deadline());

            assertThat(fx.platform.liveGeneration()).isEqualTo(BLUE);
            sleep(600);
            assertThat(unitsOf(BLUE)).hasSize(3);
        } finally {
            pool.shutdownNow();
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("宽限期内开始新的部署：旧代的计划释放被取消，新部署的实例不受影响")
    void nextDeployInsideGracePeriodKeepsNewUnits() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ParallelCutoverDriver graceful = new ParallelCutoverDriver(fx.platform, fx.healthEvaluator,
                    new BoundedRetry(1, Duration.ZERO), UpgradeTestFixture.SERVICES, pool, scheduler,
                    Duration.ofMillis(200));
            graceful.deploy(fx.target(), deadline());
            graceful.finalizeDeployment(fx.target());

            // 紧接着把 2.0.0 升回 1.0.0，新实例落在即将被释放的 blue 代上
            graceful.deploy(fx.source(), deadline());
            sleep(600);

            assertThat(fx.platform.liveGeneration()).isEqualTo(BLUE);
            assertThat(unitsOf(BLUE)).hasSize(3).allMatch(u -> u.live() && u.runs(SOURCE_VERSION));
            assertThat(unitsOf(GREEN)).hasSize(3).allMatch(u -> !u.live() && u.runs(TARGET_VERSION));
        } finally {
            pool.shutdownNow();
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("进程退出时立即执行未到期的旧代释放")
    void closeRetiresPendingGenerationImmediately() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ParallelCutoverDriver graceful = new ParallelCutoverDriver(fx.platform, fx.healthEvaluator,
                    new BoundedRetry(1, Duration.ZERO), UpgradeTestFixture.SERVICES, pool, scheduler,
                    Duration.ofMinutes(10));
            graceful.deploy(fx.target(), deadline());
            graceful.finalizeDeployment(fx.target());
            assertThat(unitsOf(BLUE)).hasSize(3);

            graceful.close();

            assertThat(unitsOf(BLUE)).isEmpty();
            assertThat(unitsOf(GREEN)).hasSize(3).allMatch(DeploymentUnit::live);
        } finally {
            pool.shutdownNow();
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("收尾前在线代必须全部在目标版本")
    void finalizeRequiresTargetLive() {
        assertThatThrownBy(() -> driver.finalizeDeployment(fx.target()))
                .isInstanceOf(DeploymentException.class);
        assertThat(unitsOf(BLUE)).hasSize(3);
    }

    @Test
    @DisplayName("演练计划描述切换步骤，不改动平台")
    void describesPlan() {
        List<String> plan = driver.describePlan(fx.source(), fx.target());

        assertThat(plan).contains("would start api-green-0 on green generation with registry.test/api:2.0.0",
                "would switch traffic blue -> green after all new units are healthy");
        assertThat(unitsOf(GREEN)).isEmpty();
    }

    private List<DeploymentUnit> unitsOf(String generation) {
        return driver.status().stream().filter(u -> u.generation().equals(generation)).collect(Collectors.toList());
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(10));
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
