package xyz.firestige.upgrade.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.upgrade.application.orchestration.UpdateOrchestrator;
import xyz.firestige.upgrade.application.query.SessionQueryService;
import xyz.firestige.upgrade.application.query.SignatureReverificationService;
import xyz.firestige.upgrade.application.rollback.ManualRollbackService;
import xyz.firestige.upgrade.application.rollback.RollbackCoordinator;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.application.validation.CurrentReleaseResolver;
import xyz.firestige.upgrade.application.validation.PreflightValidator;
import xyz.firestige.upgrade.domain.backup.BackupRestoreAdapter;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.health.HealthProbe;
import xyz.firestige.upgrade.domain.release.ReleaseCatalog;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.SessionRepository;
import xyz.firestige.upgrade.domain.shared.event.DomainEventPublisher;
import xyz.firestige.upgrade.domain.signature.ImageSignatureLookup;
import xyz.firestige.upgrade.domain.signature.SignatureVerifier;
import xyz.firestige.upgrade.facade.UpgradeFacade;
import xyz.firestige.upgrade.infrastructure.backup.CommandBackupRestoreAdapter;
import xyz.firestige.upgrade.infrastructure.backup.DatabaseMigrator;
import xyz.firestige.upgrade.infrastructure.backup.InMemoryBackupRestoreAdapter;
import xyz.firestige.upgrade.infrastructure.deployment.DeploymentDriverFactory;
import xyz.firestige.upgrade.infrastructure.deployment.DockerContainerPlatform;
import xyz.firestige.upgrade.infrastructure.deployment.InMemoryContainerPlatform;
import xyz.firestige.upgrade.infrastructure.deployment.ParallelCutoverDriver;
import xyz.firestige.upgrade.infrastructure.deployment.SequentialReplaceDriver;
import xyz.firestige.upgrade.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.upgrade.infrastructure.execution.BoundedRetry;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.health.HealthEvaluator;
import xyz.firestige.upgrade.infrastructure.health.HttpHealthProbe;
import xyz.firestige.upgrade.infrastructure.health.InMemoryHealthProbe;
import xyz.firestige.upgrade.infrastructure.lock.FileSessionLockManager;
import xyz.firestige.upgrade.infrastructure.lock.InMemorySessionLockManager;
import xyz.firestige.upgrade.infrastructure.lock.RedisSessionLockManager;
import xyz.firestige.upgrade.infrastructure.lock.SessionLockManager;
import xyz.firestige.upgrade.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.upgrade.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.upgrade.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.upgrade.infrastructure.persistence.session.FileSessionRepository;
import xyz.firestige.upgrade.infrastructure.persistence.session.InMemorySessionRepository;
import xyz.firestige.upgrade.infrastructure.release.ConfiguredReleaseCatalog;
import xyz.firestige.upgrade.infrastructure.signature.CosignSignatureLookup;
import xyz.firestige.upgrade.infrastructure.signature.InMemorySignatureLookup;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 升级编排引擎装配
 * <p>
 * 按 upgrade.* 配置选择各协作方实现：
 * <pre>
 * upgrade:
 *   platform: docker          # docker 或 memory
 *   state.lock-type: file     # file / redis / memory
 *   signature.lookup: cosign  # cosign 或 memory
 *   backup.adapter: command   # command 或 memory
 *   health.probe: http        # http 或 memory
 * </pre>
 * memory 组合用于模拟运行和测试，启动时按 upgrade.simulation.current-version 放置初始实例。
 */
@Configuration
@EnableConfigurationProperties(UpgradeProperties.class)
public class UpgradeConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(UpgradeConfiguration.class);

    // ========== 基础设施 Bean ==========

    @Bean
    public Validator validator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    @Bean
    public CommandExecutor commandExecutor() {
        return new CommandExecutor();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor(UpgradeProperties properties) {
        return Executors.newFixedThreadPool(properties.getHealth().getParallelism(), namedThreads("upgrade-health-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService signatureExecutor(UpgradeProperties properties) {
        return Executors.newFixedThreadPool(properties.getSignature().getParallelism(), namedThreads("upgrade-signature-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService unitStartExecutor(UpgradeProperties properties) {
        return Executors.newFixedThreadPool(properties.getDeployment().getStartParallelism(), namedThreads("upgrade-start-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService retirementScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("upgrade-retire-"));
    }

    @Bean
    public MetricsRegistry metricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.info("[Config] 未发现 MeterRegistry, 使用 NoopMetricsRegistry");
            return new NoopMetricsRegistry();
        }
        return new MicrometerMetricsRegistry(registry);
    }

    @Bean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    // ========== 状态与锁 ==========

    @Bean
    public SessionRepository sessionRepository(UpgradeProperties properties, ObjectMapper objectMapper) {
        if (properties.getState().getRepository() == UpgradeProperties.RepositoryType.MEMORY) {
            logger.info("[Config] 装配 InMemory 会话存储");
            return new InMemorySessionRepository();
        }
        Path dir = Path.of(properties.getState().getDir(), "sessions");
        logger.info("[Config] 装配文件会话存储: {}", dir);
        return new FileSessionRepository(dir, objectMapper);
    }

    @Bean
    public SessionLockManager sessionLockManager(UpgradeProperties properties,
                                                 ObjectProvider<StringRedisTemplate> redisTemplate) {
        UpgradeProperties.State state = properties.getState();
        switch (state.getLockType()) {
            case REDIS: {
                StringRedisTemplate template = redisTemplate.getIfAvailable();
                if (template == null) {
                    throw new IllegalStateException("lock-type=redis 但未配置 Redis 连接");
                }
                logger.info("[Config] 装配 Redis 会话锁, keyPrefix: {}", state.getRedisKeyPrefix());
                return new RedisSessionLockManager(template, state.getRedisKeyPrefix());
            }
            case MEMORY:
                logger.info("[Config] 装配 InMemory 会话锁");
                return new InMemorySessionLockManager();
            default:
                Path lockDir = Path.of(state.getDir(), "locks");
                logger.info("[Config] 装配文件会话锁: {}", lockDir);
                return new FileSessionLockManager(lockDir);
        }
    }

    @Bean
    public SessionStateManager sessionStateManager(SessionRepository sessionRepository,
                                                   SessionLockManager sessionLockManager,
                                                   DomainEventPublisher domainEventPublisher,
                                                   MetricsRegistry metricsRegistry,
                                                   UpgradeProperties properties) {
        return new SessionStateManager(sessionRepository, sessionLockManager, domainEventPublisher,
                metricsRegistry, properties.getState().getLockTtl());
    }

    // ========== 版本目录与平台 ==========

    @Bean
    public ReleaseCatalog releaseCatalog(UpgradeProperties properties) {
        Map<String, List<SchemaChange>> schemaChanges = new LinkedHashMap<>();
        properties.getSchemaChanges().forEach((version, specs) -> schemaChanges.put(version, specs.stream()
                .map(c -> new SchemaChange(c.getId(), c.getStore(), c.getDescription(), c.getCommand(), c.getVerifyCommand()))
                .collect(Collectors.toList())));
        return new ConfiguredReleaseCatalog(properties.getReleases(), schemaChanges);
    }

    @Bean
    public ContainerPlatform containerPlatform(UpgradeProperties properties,
                                               ReleaseCatalog releaseCatalog,
                                               CommandExecutor commandExecutor,
                                               ObjectMapper objectMapper) {
        UpgradeProperties.Deployment deployment = properties.getDeployment();
        UpgradeProperties.Docker docker = properties.getDocker();
        if (properties.getPlatform() == UpgradeProperties.PlatformType.DOCKER) {
            Map<String, List<String>> runArgs = new LinkedHashMap<>();
            properties.getServices().forEach(s -> runArgs.put(s.getName(), s.getRunArgs()));
            logger.info("[Config] 装配 Docker 平台, docker: {}, prefix: {}", docker.getPath(), docker.getNamePrefix());
            return new DockerContainerPlatform(commandExecutor, objectMapper, docker.getPath(), docker.getNamePrefix(),
                    docker.getNetwork(), runArgs, Path.of(docker.getRoutingFile()), docker.getDefaultGeneration(),
                    deployment.getCapacity(), docker.getCommandTimeout(), docker.getPullTimeout());
        }

        InMemoryContainerPlatform platform = new InMemoryContainerPlatform(docker.getDefaultGeneration(),
                deployment.getCapacity());
        releaseCatalog.versions().forEach(v -> releaseCatalog.find(v)
                .ifPresent(m -> m.imageRefs().forEach(platform::publish)));
        String current = properties.getSimulation().getCurrentVersion();
        if (current != null) {
            ReleaseManifest manifest = releaseCatalog.find(current)
                    .orElseThrow(() -> new IllegalStateException("模拟初始版本不在版本目录中: " + current));
            properties.getServices().forEach(s ->
                    platform.seed(s.getName(), s.getReplicas(), manifest.imageOf(s.getName()), current));
        }
        logger.info("[Config] 装配 InMemory 平台, 初始版本: {}", current);
        return platform;
    }

    // ========== 健康检查 ==========

    @Bean
    public HealthProbe healthProbe(UpgradeProperties properties,
                                   ObjectProvider<RestTemplate> restTemplate,
                                   CommandExecutor commandExecutor) {
        UpgradeProperties.Health health = properties.getHealth();
        if (health.getProbe() == UpgradeProperties.ProbeType.MEMORY) {
            return new InMemoryHealthProbe();
        }
        Map<String, String> serviceUrls = new LinkedHashMap<>();
        properties.getServices().stream()
                .filter(s -> s.getHealthUrl() != null)
                .forEach(s -> serviceUrls.put(s.getName(), s.getHealthUrl()));
        Map<String, HttpHealthProbe.StoreHealthCheck> storeChecks = new LinkedHashMap<>();
        properties.getStores().forEach(s -> storeChecks.put(s.getId(),
                new HttpHealthProbe.StoreHealthCheck(s.getHealthUrl(), s.getHealthCommand())));
        return new HttpHealthProbe(restTemplate.getObject(), commandExecutor, health.getUnitUrlTemplate(),
                serviceUrls, storeChecks, health.getCommandTimeout());
    }

    @Bean
    public HealthEvaluator healthEvaluator(HealthProbe healthProbe,
                                           ContainerPlatform containerPlatform,
                                           ExecutorService healthCheckExecutor,
                                           UpgradeProperties properties) {
        UpgradeProperties.Health health = properties.getHealth();
        return new HealthEvaluator(healthProbe, containerPlatform, healthCheckExecutor,
                health.getMaxAttempts(), health.getInterval());
    }

    // ========== 备份 ==========

    @Bean
    public BackupRestoreAdapter backupRestoreAdapter(UpgradeProperties properties, CommandExecutor commandExecutor) {
        if (properties.getBackup().getAdapter() == UpgradeProperties.AdapterType.MEMORY) {
            InMemoryBackupRestoreAdapter adapter = new InMemoryBackupRestoreAdapter();
            String current = properties.getSimulation().getCurrentVersion();
            properties.getStores().forEach(s -> adapter.put(s.getId(),
                    (s.getId() + "@" + current).getBytes(StandardCharsets.UTF_8)));
            return adapter;
        }
        Map<String, CommandBackupRestoreAdapter.StoreCommands> commands = new LinkedHashMap<>();
        properties.getStores().forEach(s -> commands.put(s.getId(),
                new CommandBackupRestoreAdapter.StoreCommands(s.getExportCommand(), s.getImportCommand())));
        return new CommandBackupRestoreAdapter(commandExecutor, commands);
    }

    @Bean
    public DatabaseMigrator databaseMigrator(BackupRestoreAdapter backupRestoreAdapter,
                                             UpgradeProperties properties,
                                             ObjectMapper objectMapper) {
        UpgradeProperties.Backup backup = properties.getBackup();
        return new DatabaseMigrator(backupRestoreAdapter, Path.of(backup.getDir()), backup.getMaxBackups(),
                backup.isSafetyBackupBeforeRestore(), backup.getOperationTimeout(), objectMapper);
    }

    // ========== 签名 ==========

    @Bean
    public ImageSignatureLookup imageSignatureLookup(UpgradeProperties properties,
                                                     CommandExecutor commandExecutor,
                                                     ObjectMapper objectMapper) {
        UpgradeProperties.Signature signature = properties.getSignature();
        if (signature.getLookup() == UpgradeProperties.LookupType.MEMORY) {
            return new InMemorySignatureLookup();
        }
        return new CosignSignatureLookup(commandExecutor, objectMapper, signature.getCosignPath(),
                signature.isKeyless(), signature.getPublicKeyPath(), signature.getIdentityRegexp(),
                signature.getOidcIssuerRegexp(), signature.getTrustedSigners());
    }

    @Bean
    public SignatureVerifier signatureVerifier(ImageSignatureLookup imageSignatureLookup,
                                               ExecutorService signatureExecutor) {
        return new SignatureVerifier(imageSignatureLookup, signatureExecutor);
    }

    // ========== 部署驱动 ==========

    @Bean
    public BoundedRetry deploymentRetry(UpgradeProperties properties) {
        UpgradeProperties.Deployment deployment = properties.getDeployment();
        return new BoundedRetry(deployment.getRetryAttempts(), deployment.getRetryBackoff());
    }

    @Bean
    public SequentialReplaceDriver sequentialReplaceDriver(ContainerPlatform containerPlatform,
                                                           HealthEvaluator healthEvaluator,
                                                           BoundedRetry deploymentRetry,
                                                           UpgradeProperties properties) {
        return new SequentialReplaceDriver(containerPlatform, healthEvaluator, deploymentRetry,
                properties.serviceOrder());
    }

    @Bean(destroyMethod = "close")
    public ParallelCutoverDriver parallelCutoverDriver(ContainerPlatform containerPlatform,
                                                       HealthEvaluator healthEvaluator,
                                                       BoundedRetry deploymentRetry,
                                                       ExecutorService unitStartExecutor,
                                                       ScheduledExecutorService retirementScheduler,
                                                       UpgradeProperties properties) {
        return new ParallelCutoverDriver(containerPlatform, healthEvaluator, deploymentRetry,
                properties.serviceOrder(), unitStartExecutor, retirementScheduler,
                properties.getDeployment().getGracePeriod());
    }

    @Bean
    public DeploymentDriverFactory deploymentDriverFactory(List<DeploymentDriver> drivers) {
        return new DeploymentDriverFactory(drivers);
    }

    // ========== Application Service ==========

    @Bean
    public CurrentReleaseResolver currentReleaseResolver() {
        return new CurrentReleaseResolver();
    }

    @Bean
    public PreflightValidator preflightValidator(ReleaseCatalog releaseCatalog,
                                                 ContainerPlatform containerPlatform,
                                                 SessionStateManager sessionStateManager,
                                                 HealthEvaluator healthEvaluator,
                                                 DatabaseMigrator databaseMigrator,
                                                 UpgradeProperties properties) {
        return new PreflightValidator(releaseCatalog, containerPlatform, sessionStateManager, healthEvaluator,
                databaseMigrator, properties.storeIds(), properties.getHealth().isPreflightCheck(),
                properties.getBackup().getMinFreeDiskBytes());
    }

    @Bean
    public RollbackCoordinator rollbackCoordinator(SessionStateManager sessionStateManager,
                                                   DatabaseMigrator databaseMigrator,
                                                   HealthEvaluator healthEvaluator) {
        return new RollbackCoordinator(sessionStateManager, databaseMigrator, healthEvaluator);
    }

    @Bean
    public UpdateOrchestrator updateOrchestrator(SessionStateManager sessionStateManager,
                                                 PreflightValidator preflightValidator,
                                                 CurrentReleaseResolver currentReleaseResolver,
                                                 DeploymentDriverFactory deploymentDriverFactory,
                                                 DatabaseMigrator databaseMigrator,
                                                 SignatureVerifier signatureVerifier,
                                                 HealthEvaluator healthEvaluator,
                                                 RollbackCoordinator rollbackCoordinator,
                                                 UpgradeProperties properties) {
        return new UpdateOrchestrator(properties.getTarget(), sessionStateManager, preflightValidator,
                currentReleaseResolver, deploymentDriverFactory, databaseMigrator, signatureVerifier,
                healthEvaluator, rollbackCoordinator, properties.storeIds(),
                properties.getDeployment().getPhaseTimeout(), properties.getSignature().getTimeout());
    }

    @Bean
    public ManualRollbackService manualRollbackService(SessionStateManager sessionStateManager,
                                                       DeploymentDriverFactory deploymentDriverFactory,
                                                       RollbackCoordinator rollbackCoordinator,
                                                       UpdateOrchestrator updateOrchestrator) {
        return new ManualRollbackService(sessionStateManager, deploymentDriverFactory, rollbackCoordinator,
                updateOrchestrator);
    }

    @Bean
    public SessionQueryService sessionQueryService(SessionStateManager sessionStateManager,
                                                   DeploymentDriverFactory deploymentDriverFactory) {
        return new SessionQueryService(sessionStateManager, deploymentDriverFactory);
    }

    @Bean
    public SignatureReverificationService signatureReverificationService(SessionStateManager sessionStateManager,
                                                                         ReleaseCatalog releaseCatalog,
                                                                         SignatureVerifier signatureVerifier,
                                                                         UpgradeProperties properties) {
        return new SignatureReverificationService(sessionStateManager, releaseCatalog, signatureVerifier,
                properties.getSignature().getTimeout());
    }

    // ========== Facade ==========

    @Bean
    public UpgradeFacade upgradeFacade(UpdateOrchestrator updateOrchestrator,
                                       ManualRollbackService manualRollbackService,
                                       SessionQueryService sessionQueryService,
                                       SignatureReverificationService signatureReverificationService,
                                       SessionStateManager sessionStateManager,
                                       Validator validator,
                                       UpgradeProperties properties) {
        return new UpgradeFacade(updateOrchestrator, manualRollbackService, sessionQueryService,
                signatureReverificationService, sessionStateManager, validator,
                properties.getState().getKeepSessions());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
