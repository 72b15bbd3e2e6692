package xyz.firestige.upgrade.application.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.health.HealthReport;
import xyz.firestige.upgrade.domain.health.HealthVerdict;
import xyz.firestige.upgrade.domain.release.ReleaseCatalog;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.backup.DatabaseMigrator;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 升级预检
 * <p>
 * 检查项（按顺序，任一失败抛出 {@link ValidationException}，此时尚未发生任何变更）：
 * <ol>
 *   <li>目标版本存在于版本目录，且与当前版本不同</li>
 *   <li>目标版本覆盖所有在线服务，每个镜像可达</li>
 *   <li>目标版本的结构变更只作用于已配置备份的存储，且本次没有跳过备份</li>
 *   <li>会话排他</li>
 *   <li>当前系统不是 UNHEALTHY</li>
 *   <li>非演练：平台容量满足所选策略，备份目录可用空间充足</li>
 * </ol>
 */
public class PreflightValidator {

    private static final Logger log = LoggerFactory.getLogger(PreflightValidator.class);

    private final ReleaseCatalog catalog;
    private final ContainerPlatform platform;
    private final SessionStateManager stateManager;
    private final HealthEvaluator healthEvaluator;
    private final DatabaseMigrator migrator;
    private final List<String> storeIds;
    private final boolean checkCurrentHealth;
    private final long minFreeDiskBytes;

    public PreflightValidator(ReleaseCatalog catalog,
                              ContainerPlatform platform,
                              SessionStateManager stateManager,
                              HealthEvaluator healthEvaluator,
                              DatabaseMigrator migrator,
                              List<String> storeIds,
                              boolean checkCurrentHealth,
                              long minFreeDiskBytes) {
        this.catalog = catalog;
        this.platform = platform;
        this.stateManager = stateManager;
        this.healthEvaluator = healthEvaluator;
        this.migrator = migrator;
        this.storeIds = storeIds != null ? storeIds : List.of();
        this.checkCurrentHealth = checkCurrentHealth;
        this.minFreeDiskBytes = minFreeDiskBytes;
    }

    /**
     * 执行预检
     *
     * @return 预检结果：目标版本清单与每项检查的说明
     * @throws ValidationException 任一检查失败
     */
    public PreflightResult validate(UpdateSession session, DeploymentDriver driver, Deadline deadline) {
        List<String> checks = new ArrayList<>();

        ReleaseManifest target = catalog.find(session.getTargetVersion())
                .orElseThrow(() -> new ValidationException(String.format(
                        "目标版本不存在: %s, 可用版本: %s", session.getTargetVersion(), catalog.versions())));
        if (target.version().equals(session.getSourceVersion())) {
            throw new ValidationException("当前已运行目标版本: " + target.version());
        }
        checks.add("目标版本 " + target.version() + " 已找到");

        List<DeploymentUnit> live = driver.status().stream()
                .filter(DeploymentUnit::live)
                .collect(Collectors.toList());
        List<String> uncovered = live.stream()
                .map(DeploymentUnit::service)
                .distinct()
                .filter(s -> !target.covers(s))
                .collect(Collectors.toList());
        if (!uncovered.isEmpty()) {
            throw new ValidationException(String.format("目标版本 %s 未包含服务: %s", target.version(), uncovered));
        }
        List<String> unreachable = new ArrayList<>();
        for (String image : target.imageRefs()) {
            if (!platform.imageAvailable(image)) {
                unreachable.add(image);
            }
        }
        if (!unreachable.isEmpty()) {
            throw new ValidationException("目标镜像不可达: " + unreachable);
        }
        checks.add(target.imageRefs().size() + " 个镜像可达");

        List<SchemaChange> schemaChanges = catalog.schemaChanges(target.version());
        if (!schemaChanges.isEmpty()) {
            List<String> unknownStores = schemaChanges.stream()
                    .map(SchemaChange::storeId)
                    .filter(id -> !storeIds.contains(id))
                    .distinct()
                    .collect(Collectors.toList());
            if (!unknownStores.isEmpty()) {
                throw new ValidationException("结构变更作用于未配置备份的存储: " + unknownStores);
            }
            if (session.isSkipBackup()) {
                throw new ValidationException(String.format(
                        "目标版本 %s 包含 %d 个结构变更，不允许跳过备份", target.version(), schemaChanges.size()));
            }
            checks.add(schemaChanges.size() + " 个结构变更");
        }

        stateManager.assertNoActiveSession(session.getDeploymentTarget(), session.getSessionId());
        checks.add("会话排他");

        if (checkCurrentHealth) {
            HealthReport report = healthEvaluator.evaluate(live, storeIds, deadline);
            if (report.verdict() == HealthVerdict.UNHEALTHY) {
                throw new ValidationException("当前系统不健康，拒绝升级: " + report.summary());
            }
            if (report.verdict() == HealthVerdict.DEGRADED) {
                log.warn("当前系统处于降级状态, sessionId: {}, detail: {}", session.getSessionId(), report.summary());
            }
            checks.add("当前系统 " + report.verdict());
        }

        if (!session.isDryRun()) {
            int required = session.getStrategy().requiredCapacity(live.size());
            if (platform.capacity() < required) {
                throw new ValidationException(String.format(
                        "平台容量不足, 策略: %s, 需要: %d, 可用: %d", session.getStrategy(), required, platform.capacity()));
            }
            checks.add(String.format("容量 %d/%d", required, platform.capacity()));

            if (!session.isSkipBackup() && !storeIds.isEmpty()) {
                long free = migrator.usableSpace();
                if (free < minFreeDiskBytes) {
                    throw new ValidationException(String.format(
                            "备份目录可用空间不足, 需要: %d, 可用: %d", minFreeDiskBytes, free));
                }
                checks.add("备份空间充足");
            }
        }
        return new PreflightResult(target, schemaChanges, checks);
    }

    public record PreflightResult(ReleaseManifest target, List<SchemaChange> schemaChanges, List<String> checks) {

        public String summary() {
            return String.join("; ", checks);
        }
    }
}
