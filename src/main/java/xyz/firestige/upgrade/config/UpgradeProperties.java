package xyz.firestige.upgrade.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 升级编排配置
 * prefix: upgrade
 */
@ConfigurationProperties(prefix = "upgrade")
@Validated
public class UpgradeProperties {

    public enum PlatformType { MEMORY, DOCKER }

    public enum LockType { FILE, REDIS, MEMORY }

    public enum RepositoryType { FILE, MEMORY }

    public enum AdapterType { COMMAND, MEMORY }

    public enum ProbeType { HTTP, MEMORY }

    public enum LookupType { COSIGN, MEMORY }

    /** 部署目标名称，也是会话锁的粒度 */
    @NotBlank
    private String target = "default";

    @NotNull
    private PlatformType platform = PlatformType.MEMORY;

    /** 服务列表，顺序即顺序替换时的处理顺序 */
    @Valid
    private List<ServiceSpec> services = new ArrayList<>();

    /** 需要备份的持久化存储 */
    @Valid
    private List<StoreSpec> stores = new ArrayList<>();

    /** 版本目录: version -> (service -> image) */
    private Map<String, Map<String, String>> releases = new LinkedHashMap<>();

    /** 随版本发布的结构变更: version -> 变更列表（按执行顺序） */
    @Valid
    private Map<String, List<SchemaChangeSpec>> schemaChanges = new LinkedHashMap<>();

    @Valid @NotNull
    private State state = new State();
    @Valid @NotNull
    private Signature signature = new Signature();
    @Valid @NotNull
    private Backup backup = new Backup();
    @Valid @NotNull
    private Deployment deployment = new Deployment();
    @Valid @NotNull
    private Docker docker = new Docker();
    @Valid @NotNull
    private Health health = new Health();
    @NotNull
    private Simulation simulation = new Simulation();
    @NotNull
    private Cli cli = new Cli();

    // ========== Service ==========
    public static class ServiceSpec {
        @NotBlank
        private String name;
        @Min(1)
        private int replicas = 1;
        /** 覆盖默认的实例健康检查 URL 模板 */
        private String healthUrl;
        /** docker run 额外参数 */
        private List<String> runArgs = new ArrayList<>();
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }
        public String getHealthUrl() { return healthUrl; }
        public void setHealthUrl(String healthUrl) { this.healthUrl = healthUrl; }
        public List<String> getRunArgs() { return runArgs; }
        public void setRunArgs(List<String> runArgs) { this.runArgs = runArgs; }
    }

    // ========== Store ==========
    public static class StoreSpec {
        @NotBlank
        private String id;
        /** 导出命令，{file} 替换为备份文件路径 */
        private List<String> exportCommand = new ArrayList<>();
        /** 导入命令，{file} 替换为备份文件路径 */
        private List<String> importCommand = new ArrayList<>();
        private String healthUrl;
        private List<String> healthCommand = new ArrayList<>();
        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public List<String> getExportCommand() { return exportCommand; }
        public void setExportCommand(List<String> exportCommand) { this.exportCommand = exportCommand; }
        public List<String> getImportCommand() { return importCommand; }
        public void setImportCommand(List<String> importCommand) { this.importCommand = importCommand; }
        public String getHealthUrl() { return healthUrl; }
        public void setHealthUrl(String healthUrl) { this.healthUrl = healthUrl; }
        public List<String> getHealthCommand() { return healthCommand; }
        public void setHealthCommand(List<String> healthCommand) { this.healthCommand = healthCommand; }
    }

    // ========== Schema change ==========
    public static class SchemaChangeSpec {
        @NotBlank
        private String id;
        @NotBlank
        private String store;
        private String description;
        private List<String> command = new ArrayList<>();
        /** 退出码为 0 视为变更已生效 */
        private List<String> verifyCommand = new ArrayList<>();
        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public List<String> getVerifyCommand() { return verifyCommand; }
        public void setVerifyCommand(List<String> verifyCommand) { this.verifyCommand = verifyCommand; }
    }

    // ========== State ==========
    public static class State {
        /** 会话记录与锁文件所在目录 */
        @NotBlank
        private String dir = "./upgrade-state";
        @NotNull
        private RepositoryType repository = RepositoryType.FILE;
        @NotNull
        private LockType lockType = LockType.FILE;
        /** Redis 锁的过期时间，每个阶段边界续租 */
        private Duration lockTtl = Duration.ofMinutes(30);
        private String redisKeyPrefix = "upgrade:lock:target:";
        @Min(1)
        private int keepSessions = 20;
        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public RepositoryType getRepository() { return repository; }
        public void setRepository(RepositoryType repository) { this.repository = repository; }
        public LockType getLockType() { return lockType; }
        public void setLockType(LockType lockType) { this.lockType = lockType; }
        public Duration getLockTtl() { return lockTtl; }
        public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }
        public String getRedisKeyPrefix() { return redisKeyPrefix; }
        public void setRedisKeyPrefix(String redisKeyPrefix) { this.redisKeyPrefix = redisKeyPrefix; }
        public int getKeepSessions() { return keepSessions; }
        public void setKeepSessions(int keepSessions) { this.keepSessions = keepSessions; }
    }

    // ========== Signature ==========
    public static class Signature {
        @NotNull
        private LookupType lookup = LookupType.COSIGN;
        @Min(1)
        private int parallelism = 3;
        /** 单个镜像的校验超时 */
        private Duration timeout = Duration.ofSeconds(30);
        private String cosignPath = "cosign";
        private boolean keyless = true;
        private String publicKeyPath;
        private String identityRegexp = ".*";
        private String oidcIssuerRegexp = ".*";
        private List<String> trustedSigners = new ArrayList<>();
        public LookupType getLookup() { return lookup; }
        public void setLookup(LookupType lookup) { this.lookup = lookup; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public String getCosignPath() { return cosignPath; }
        public void setCosignPath(String cosignPath) { this.cosignPath = cosignPath; }
        public boolean isKeyless() { return keyless; }
        public void setKeyless(boolean keyless) { this.keyless = keyless; }
        public String getPublicKeyPath() { return publicKeyPath; }
        public void setPublicKeyPath(String publicKeyPath) { this.publicKeyPath = publicKeyPath; }
        public String getIdentityRegexp() { return identityRegexp; }
        public void setIdentityRegexp(String identityRegexp) { this.identityRegexp = identityRegexp; }
        public String getOidcIssuerRegexp() { return oidcIssuerRegexp; }
        public void setOidcIssuerRegexp(String oidcIssuerRegexp) { this.oidcIssuerRegexp = oidcIssuerRegexp; }
        public List<String> getTrustedSigners() { return trustedSigners; }
        public void setTrustedSigners(List<String> trustedSigners) { this.trustedSigners = trustedSigners; }
    }

    // ========== Backup ==========
    public static class Backup {
        @NotNull
        private AdapterType adapter = AdapterType.COMMAND;
        @NotBlank
        private String dir = "./upgrade-backups";
        @Min(1)
        private int maxBackups = 10;
        private boolean safetyBackupBeforeRestore = true;
        private Duration operationTimeout = Duration.ofMinutes(10);
        /** 备份目录所在磁盘的最小可用空间（字节） */
        private long minFreeDiskBytes = 1024L * 1024 * 1024;
        public AdapterType getAdapter() { return adapter; }
        public void setAdapter(AdapterType adapter) { this.adapter = adapter; }
        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public int getMaxBackups() { return maxBackups; }
        public void setMaxBackups(int maxBackups) { this.maxBackups = maxBackups; }
        public boolean isSafetyBackupBeforeRestore() { return safetyBackupBeforeRestore; }
        public void setSafetyBackupBeforeRestore(boolean v) { this.safetyBackupBeforeRestore = v; }
        public Duration getOperationTimeout() { return operationTimeout; }
        public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }
        public long getMinFreeDiskBytes() { return minFreeDiskBytes; }
        public void setMinFreeDiskBytes(long minFreeDiskBytes) { this.minFreeDiskBytes = minFreeDiskBytes; }
    }

    // ========== Deployment ==========
    public static class Deployment {
        /** 每个阶段的默认时间预算，请求可覆盖 */
        private Duration phaseTimeout = Duration.ofMinutes(10);
        /** 并行切换后保留旧代的宽限期，0 表示收尾时立即释放 */
        private Duration gracePeriod = Duration.ofMinutes(5);
        @Min(1)
        private int retryAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(2);
        @Min(1)
        private int startParallelism = 4;
        /** 平台可容纳的实例数 */
        @Min(1)
        private int capacity = 64;
        public Duration getPhaseTimeout() { return phaseTimeout; }
        public void setPhaseTimeout(Duration phaseTimeout) { this.phaseTimeout = phaseTimeout; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public int getStartParallelism() { return startParallelism; }
        public void setStartParallelism(int startParallelism) { this.startParallelism = startParallelism; }
        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    // ========== Docker ==========
    public static class Docker {
        private String path = "docker";
        private String namePrefix = "upgrade-";
        private String network;
        /** 边缘代理读取的路由文件 */
        private String routingFile = "./upgrade-state/routing.json";
        private String defaultGeneration = "blue";
        private Duration commandTimeout = Duration.ofSeconds(60);
        private Duration pullTimeout = Duration.ofMinutes(5);
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
        public String getRoutingFile() { return routingFile; }
        public void setRoutingFile(String routingFile) { this.routingFile = routingFile; }
        public String getDefaultGeneration() { return defaultGeneration; }
        public void setDefaultGeneration(String defaultGeneration) { this.defaultGeneration = defaultGeneration; }
        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
        public Duration getPullTimeout() { return pullTimeout; }
        public void setPullTimeout(Duration pullTimeout) { this.pullTimeout = pullTimeout; }
    }

    // ========== Health ==========
    public static class Health {
        @NotNull
        private ProbeType probe = ProbeType.HTTP;
        @Min(1)
        private int maxAttempts = 10;
        private Duration interval = Duration.ofSeconds(3);
        @Min(1)
        private int parallelism = 8;
        /** 占位符: {identity} {service} {generation} {ordinal} */
        private String unitUrlTemplate = "http://{identity}:8080/health";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(10);
        /** 预检时拒绝在 UNHEALTHY 的系统上升级 */
        private boolean preflightCheck = true;
        public ProbeType getProbe() { return probe; }
        public void setProbe(ProbeType probe) { this.probe = probe; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public String getUnitUrlTemplate() { return unitUrlTemplate; }
        public void setUnitUrlTemplate(String unitUrlTemplate) { this.unitUrlTemplate = unitUrlTemplate; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
        public boolean isPreflightCheck() { return preflightCheck; }
        public void setPreflightCheck(boolean preflightCheck) { this.preflightCheck = preflightCheck; }
    }

    // ========== Simulation (platform=memory) ==========
    public static class Simulation {
        /** 内存平台启动时部署的版本，必须存在于版本目录中 */
        private String currentVersion;
        public String getCurrentVersion() { return currentVersion; }
        public void setCurrentVersion(String currentVersion) { this.currentVersion = currentVersion; }
    }

    // ========== CLI ==========
    public static class Cli {
        private boolean enabled = false;
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }
    public PlatformType getPlatform() { return platform; }
    public void setPlatform(PlatformType platform) { this.platform = platform; }
    public List<ServiceSpec> getServices() { return services; }
    public void setServices(List<ServiceSpec> services) { this.services = services; }
    public List<StoreSpec> getStores() { return stores; }
    public void setStores(List<StoreSpec> stores) { this.stores = stores; }
    public Map<String, Map<String, String>> getReleases() { return releases; }
    public void setReleases(Map<String, Map<String, String>> releases) { this.releases = releases; }
    public Map<String, List<SchemaChangeSpec>> getSchemaChanges() { return schemaChanges; }
    public void setSchemaChanges(Map<String, List<SchemaChangeSpec>> schemaChanges) { this.schemaChanges = schemaChanges; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public Signature getSignature() { return signature; }
    public void setSignature(Signature signature) { this.signature = signature; }
    public Backup getBackup() { return backup; }
    public void setBackup(Backup backup) { this.backup = backup; }
    public Deployment getDeployment() { return deployment; }
    public void setDeployment(Deployment deployment) { this.deployment = deployment; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Simulation getSimulation() { return simulation; }
    public void setSimulation(Simulation simulation) { this.simulation = simulation; }
    public Cli getCli() { return cli; }
    public void setCli(Cli cli) { this.cli = cli; }

    public List<String> serviceOrder() {
        List<String> order = new ArrayList<>();
        services.forEach(s -> order.add(s.getName()));
        return order;
    }

    public List<String> storeIds() {
        List<String> ids = new ArrayList<>();
        stores.forEach(s -> ids.add(s.getId()));
        return ids;
    }
}
