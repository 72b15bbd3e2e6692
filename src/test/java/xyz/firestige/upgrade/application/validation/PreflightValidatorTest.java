package xyz.firestige.upgrade.application.validation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.upgrade.application.validation.PreflightValidator.PreflightResult;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.release.ReleaseCatalog;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.SessionConflictException;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.infrastructure.deployment.InMemoryContainerPlatform;
import xyz.firestige.upgrade.infrastructure.deployment.ParallelCutoverDriver;
import xyz.firestige.upgrade.infrastructure.release.ConfiguredReleaseCatalog;
import xyz.firestige.upgrade.testutil.UpgradeTestFixture;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static xyz.firestige.upgrade.testutil.UpgradeTestFixture.image;

/**
 * PreflightValidator 测试
 */
@DisplayName("升级预检测试")
class PreflightValidatorTest {

    @TempDir
    Path backupRoot;

    private UpgradeTestFixture fx;

    @BeforeEach
    void setUp() {
        fx = new UpgradeTestFixture(backupRoot);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("全部检查通过，返回目标版本清单")
    void passes() {
        PreflightResult result = validator(fx.catalog, fx.platform, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline());

        assertThat(result.target().version()).isEqualTo("2.0.0");
        assertThat(result.checks()).contains("目标版本 2.0.0 已找到", "2 个镜像可达", "会话排他", "容量 6/16");
        assertThat(result.summary()).contains("备份空间充足");
    }

    @Test
    @DisplayName("目标版本不存在")
    void unknownVersion() {
        assertThatThrownBy(() -> validator(fx.catalog, fx.platform, 0L)
                .validate(session("9.9.9", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("目标版本不存在: 9.9.9")
                .hasMessageContaining("1.0.0");
    }

    @Test
    @DisplayName("目标版本与当前版本相同")
    void sameVersion() {
        assertThatThrownBy(() -> validator(fx.catalog, fx.platform, 0L)
                .validate(session("1.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("当前已运行目标版本");
    }

    @Test
    @DisplayName("目标版本缺少在线服务")
    void uncoveredService() {
        ReleaseCatalog catalog = new ConfiguredReleaseCatalog(Map.of(
                "1.0.0", Map.of("api", image("api", "1.0.0"), "web", image("web", "1.0.0")),
                "3.0.0", Map.of("api", image("api", "2.0.0"))));

        assertThatThrownBy(() -> validator(catalog, fx.platform, 0L)
                .validate(session("3.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("未包含服务: [web]");
    }

    @Test
    @DisplayName("目标镜像不可达")
    void imageUnreachable() {
        ReleaseCatalog catalog = new ConfiguredReleaseCatalog(Map.of(
                "1.0.0", Map.of("api", image("api", "1.0.0"), "web", image("web", "1.0.0")),
                "3.0.0", Map.of("api", image("api", "3.0.0"), "web", image("web", "2.0.0"))));

        assertThatThrownBy(() -> validator(catalog, fx.platform, 0L)
                .validate(session("3.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(image("api", "3.0.0"));
    }

    @Test
    @DisplayName("存在遗留的未结束会话")
    void staleSessionConflicts() {
        UpdateSession stale = fx.sessionAt(SessionPhase.DEPLOYING, DeploymentStrategyType.PARALLEL_CUTOVER, false);

        assertThatThrownBy(() -> validator(fx.catalog, fx.platform, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(SessionConflictException.class)
                .hasMessageContaining(stale.getSessionId().getValue());
    }

    @Test
    @DisplayName("当前系统全部不健康时拒绝；部分降级时放行")
    void currentHealthGate() {
        fx.probe.markStoreUnhealthy(UpgradeTestFixture.STORE);
        PreflightResult degraded = validator(fx.catalog, fx.platform, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline());
        assertThat(degraded.checks()).contains("当前系统 DEGRADED");

        fx.probe.markImageUnhealthy(image("api", "1.0.0"));
        fx.probe.markImageUnhealthy(image("web", "1.0.0"));
        assertThatThrownBy(() -> validator(fx.catalog, fx.platform, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("当前系统不健康");
    }

    @Test
    @DisplayName("容量：并行切换需要两倍在线实例，顺序替换只需一倍")
    void capacityDependsOnStrategy() {
        InMemoryContainerPlatform small = new InMemoryContainerPlatform(ParallelCutoverDriver.BLUE, 4);
        small.seed("api", 2, image("api", "1.0.0"), "1.0.0");
        small.seed("web", 1, image("web", "1.0.0"), "1.0.0");
        small.publish(image("api", "2.0.0"));
        small.publish(image("web", "2.0.0"));
        DeploymentDriver driver = mock(DeploymentDriver.class);
        when(driver.status()).thenReturn(small.listUnits());

        assertThatThrownBy(() -> validator(fx.catalog, small, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), driver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("需要: 6, 可用: 4");

        PreflightResult sequential = validator(fx.catalog, small, 0L)
                .validate(session("2.0.0", DeploymentStrategyType.SEQUENTIAL_REPLACE, false), driver, deadline());
        assertThat(sequential.checks()).contains("容量 3/4");
    }

    @Test
    @DisplayName("备份空间不足时拒绝；演练跳过容量与空间检查")
    void diskSpace() {
        PreflightValidator strict = validator(fx.catalog, fx.platform, Long.MAX_VALUE);

        assertThatThrownBy(() -> strict
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, false), fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("可用空间不足");

        PreflightResult dryRun = strict
                .validate(session("2.0.0", DeploymentStrategyType.PARALLEL_CUTOVER, true), fx.parallelDriver, deadline());
        assertThat(dryRun.checks()).noneMatch(c -> c.startsWith("容量") || c.startsWith("备份"));
    }

    @Test
    @DisplayName("目标版本的结构变更随预检结果返回")
    void schemaChangesReturned() {
        PreflightResult result = validator(fx.catalog, fx.platform, 0L)
                .validate(session(UpgradeTestFixture.MIGRATING_VERSION, DeploymentStrategyType.PARALLEL_CUTOVER, false),
                        fx.parallelDriver, deadline());

        assertThat(result.schemaChanges()).extracting(SchemaChange::id)
                .containsExactlyElementsOf(UpgradeTestFixture.SCHEMA_CHANGE_IDS);
        assertThat(result.checks()).contains("2 个结构变更");
    }

    @Test
    @DisplayName("结构变更作用于未配置备份的存储时拒绝")
    void schemaChangeOnUnknownStore() {
        ReleaseCatalog catalog = new ConfiguredReleaseCatalog(UpgradeTestFixture.releases(), Map.of(
                UpgradeTestFixture.MIGRATING_VERSION,
                List.of(new SchemaChange("001-cache-layout", "cache", "cache layout", List.of(), List.of()))));

        assertThatThrownBy(() -> validator(catalog, fx.platform, 0L)
                .validate(session(UpgradeTestFixture.MIGRATING_VERSION, DeploymentStrategyType.PARALLEL_CUTOVER, false),
                        fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("未配置备份的存储: [cache]");
    }

    @Test
    @DisplayName("目标版本带结构变更时不允许跳过备份")
    void schemaChangesRequireBackup() {
        UpdateSession skipBackup = UpdateSession.start(SessionId.generate(), UpgradeTestFixture.TARGET,
                DeploymentStrategyType.PARALLEL_CUTOVER, fx.source(), UpgradeTestFixture.MIGRATING_VERSION,
                false, true, true, Duration.ofSeconds(10));

        assertThatThrownBy(() -> validator(fx.catalog, fx.platform, 0L)
                .validate(skipBackup, fx.parallelDriver, deadline()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("不允许跳过备份");
    }

    private PreflightValidator validator(ReleaseCatalog catalog, ContainerPlatform platform, long minFreeDisk) {
        return new PreflightValidator(catalog, platform, fx.stateManager, fx.healthEvaluator, fx.migrator,
                List.of(UpgradeTestFixture.STORE), true, minFreeDisk);
    }

    private UpdateSession session(String targetVersion, DeploymentStrategyType strategy, boolean dryRun) {
        return UpdateSession.start(SessionId.generate(), UpgradeTestFixture.TARGET, strategy, fx.source(),
                targetVersion, dryRun, false, true, Duration.ofSeconds(10));
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(5));
    }
}
