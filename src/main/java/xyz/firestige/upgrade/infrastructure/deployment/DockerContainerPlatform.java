package xyz.firestige.upgrade.infrastructure.deployment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.domain.deployment.PlatformException;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 基于 docker CLI 的容器平台
 * <p>
 * 实例以容器标签标识（upgrade.service / upgrade.generation / upgrade.ordinal / upgrade.version），
 * 流量指针与摘流列表写入路由文件（原子替换），由边缘代理读取。
 * 健康状态只在本进程内覆盖，重启后为 UNKNOWN。
 */
public class DockerContainerPlatform implements ContainerPlatform {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerPlatform.class);

    static final String LABEL_MANAGED = "upgrade.managed";
    static final String LABEL_SERVICE = "upgrade.service";
    static final String LABEL_GENERATION = "upgrade.generation";
    static final String LABEL_ORDINAL = "upgrade.ordinal";
    static final String LABEL_VERSION = "upgrade.version";

    private static final Pattern TRANSIENT = Pattern.compile(
            "timeout|tls handshake|connection reset|temporarily unavailable|too many requests|i/o timeout");

    private final CommandExecutor commandExecutor;
    private final ObjectMapper objectMapper;
    private final String dockerPath;
    private final String namePrefix;
    private final String network;
    private final Map<String, List<String>> runArgs;
    private final Path routingFile;
    private final String defaultGeneration;
    private final int capacity;
    private final Duration commandTimeout;
    private final Duration pullTimeout;
    private final Map<String, HealthOverlay> health = new ConcurrentHashMap<>();

    private record HealthOverlay(HealthStatus status, LocalDateTime checkedAt) {
    }

    /**
     * 路由文件内容
     */
    public static class RoutingState {
        public String liveGeneration;
        public Set<String> drained = new LinkedHashSet<>();
    }

    public DockerContainerPlatform(CommandExecutor commandExecutor,
                                   ObjectMapper objectMapper,
                                   String dockerPath,
                                   String namePrefix,
                                   String network,
                                   Map<String, List<String>> runArgs,
                                   Path routingFile,
                                   String defaultGeneration,
                                   int capacity,
                                   Duration commandTimeout,
                                   Duration pullTimeout) {
        this.commandExecutor = commandExecutor;
        this.objectMapper = objectMapper;
        this.dockerPath = dockerPath;
        this.namePrefix = namePrefix;
        this.network = network;
        this.runArgs = runArgs != null ? runArgs : Map.of();
        this.routingFile = routingFile;
        this.defaultGeneration = defaultGeneration;
        this.capacity = capacity;
        this.commandTimeout = commandTimeout;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public List<DeploymentUnit> listUnits() {
        CommandResult r = docker(List.of("ps", "-a", "--filter", "label=" + LABEL_MANAGED + "=true",
                "--format", "{{json .}}"), commandTimeout);
        RoutingState routing = readRouting();
        List<DeploymentUnit> units = new ArrayList<>();
        for (String line : r.stdout().split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            units.add(parseUnit(line, routing));
        }
        return units;
    }

    DeploymentUnit parseUnit(String jsonLine, RoutingState routing) {
        try {
            JsonNode node = objectMapper.readTree(jsonLine);
            Map<String, String> labels = parseLabels(node.path("Labels").asText(""));
            String service = labels.get(LABEL_SERVICE);
            String generation = labels.getOrDefault(LABEL_GENERATION, defaultGeneration);
            int ordinal = Integer.parseInt(labels.getOrDefault(LABEL_ORDINAL, "0"));
            String version = labels.get(LABEL_VERSION);
            String identity = DeploymentUnit.identityOf(service, generation, ordinal);
            boolean running = "running".equalsIgnoreCase(node.path("State").asText());
            boolean live = running && generation.equals(routing.liveGeneration) && !routing.drained.contains(identity);
            HealthOverlay overlay = health.get(identity);
            return new DeploymentUnit(identity, service, ordinal, generation, node.path("Image").asText(),
                    version, version,
                    overlay != null ? overlay.status() : (running ? HealthStatus.UNKNOWN : HealthStatus.UNHEALTHY),
                    overlay != null ? overlay.checkedAt() : null, live);
        } catch (IOException | RuntimeException e) {
            throw new PlatformException("无法解析 docker ps 输出: " + jsonLine, false, e);
        }
    }

    static Map<String, String> parseLabels(String raw) {
        Map<String, String> labels = new HashMap<>();
        for (String pair : raw.split(",")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                labels.put(pair.substring(0, idx).trim(), pair.substring(idx + 1).trim());
            }
        }
        return labels;
    }

    @Override
    public String liveGeneration() {
        return readRouting().liveGeneration;
    }

    @Override
    public DeploymentUnit startUnit(String service, int ordinal, String generation, String image, String version) {
        String identity = DeploymentUnit.identityOf(service, generation, ordinal);
        docker(runCommand(service, ordinal, generation, image, version), commandTimeout);
        log.info("已启动容器: {}, image: {}", containerName(identity), image);
        return new DeploymentUnit(identity, service, ordinal, generation, image, version, version,
                HealthStatus.UNKNOWN, null, false);
    }

    @Override
    public DeploymentUnit replaceUnit(String identity, String image, String version) {
        DeploymentUnit existing = listUnits().stream()
                .filter(u -> u.identity().equals(identity))
                .findFirst()
                .orElseThrow(() -> new PlatformException("实例不存在: " + identity, false));
        docker(List.of("rm", "-f", containerName(identity)), commandTimeout);
        health.remove(identity);
        docker(runCommand(existing.service(), existing.ordinal(), existing.generation(), image, version), commandTimeout);
        log.info("已替换容器: {}, image: {}", containerName(identity), image);
        return existing.withRelease(image, version);
    }

    @Override
    public void removeUnit(String identity) {
        docker(List.of("rm", "-f", containerName(identity)), commandTimeout);
        health.remove(identity);
        RoutingState routing = readRouting();
        if (routing.drained.remove(identity)) {
            writeRouting(routing);
        }
    }

    @Override
    public synchronized void drain(String identity) {
        RoutingState routing = readRouting();
        routing.drained.add(identity);
        writeRouting(routing);
    }

    @Override
    public synchronized void admit(String identity) {
        RoutingState routing = readRouting();
        routing.drained.remove(identity);
        writeRouting(routing);
    }

    @Override
    public synchronized void switchTraffic(String generation) {
        RoutingState routing = readRouting();
        routing.liveGeneration = generation;
        writeRouting(routing);
        log.info("路由指针已更新: {}", generation);
    }

    @Override
    public void pullImage(String image) {
        docker(List.of("pull", image), pullTimeout);
    }

    @Override
    public boolean imageAvailable(String image) {
        if (commandExecutor.execute(command(List.of("image", "inspect", image)), commandTimeout).isSuccess()) {
            return true;
        }
        return commandExecutor.execute(command(List.of("manifest", "inspect", image)), commandTimeout).isSuccess();
    }

    @Override
    public void recordHealth(String identity, HealthStatus status, LocalDateTime checkedAt) {
        health.put(identity, new HealthOverlay(status, checkedAt));
    }

    @Override
    public int capacity() {
        return capacity;
    }

    List<String> runCommand(String service, int ordinal, String generation, String image, String version) {
        String identity = DeploymentUnit.identityOf(service, generation, ordinal);
        List<String> args = new ArrayList<>(List.of("run", "-d", "--name", containerName(identity),
                "--restart", "unless-stopped",
                "--label", LABEL_MANAGED + "=true",
                "--label", LABEL_SERVICE + "=" + service,
                "--label", LABEL_GENERATION + "=" + generation,
                "--label", LABEL_ORDINAL + "=" + ordinal,
                "--label", LABEL_VERSION + "=" + version));
        if (network != null && !network.isBlank()) {
            args.add("--network");
            args.add(network);
            args.add("--network-alias");
            args.add(identity);
        }
        args.addAll(runArgs.getOrDefault(service, List.of()));
        args.add(image);
        return args;
    }

    private String containerName(String identity) {
        return namePrefix + identity;
    }

    private CommandResult docker(List<String> args, Duration timeout) {
        CommandResult r = commandExecutor.execute(command(args), timeout);
        if (!r.isSuccess()) {
            String msg = r.failureMessage();
            boolean retryable = r.timedOut() || TRANSIENT.matcher(msg.toLowerCase(Locale.ROOT)).find();
            throw new PlatformException("docker " + args.get(0) + " 失败: " + msg, retryable);
        }
        return r;
    }

    private List<String> command(List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(dockerPath);
        cmd.addAll(args);
        return cmd;
    }

    private RoutingState readRouting() {
        if (!Files.isRegularFile(routingFile)) {
            RoutingState initial = new RoutingState();
            initial.liveGeneration = defaultGeneration;
            return initial;
        }
        try {
            RoutingState state = objectMapper.readValue(routingFile.toFile(), RoutingState.class);
            if (state.liveGeneration == null) {
                state.liveGeneration = defaultGeneration;
            }
            if (state.drained == null) {
                state.drained = new LinkedHashSet<>();
            }
            return state;
        } catch (IOException e) {
            throw new PlatformException("读取路由文件失败: " + routingFile, false, e);
        }
    }

    private void writeRouting(RoutingState state) {
        try {
            Path dir = routingFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, routingFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            Files.move(tmp, routingFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PlatformException("写入路由文件失败: " + routingFile, true, e);
        }
    }
}
