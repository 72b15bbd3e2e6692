package xyz.firestige.upgrade.infrastructure.deployment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.domain.deployment.PlatformException;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DockerContainerPlatform 测试：docker CLI 用 Mockito 模拟，路由文件写入临时目录
 */
@DisplayName("docker 容器平台测试")
class DockerContainerPlatformTest {

    private static final String PS_OUTPUT = String.join("\n",
            "{\"Names\":\"edge-api-blue-0\",\"Image\":\"registry.test/api:1.0.0\",\"State\":\"running\","
                    + "\"Labels\":\"upgrade.managed=true,upgrade.service=api,upgrade.generation=blue,upgrade.ordinal=0,upgrade.version=1.0.0\"}",
            "{\"Names\":\"edge-api-green-0\",\"Image\":\"registry.test/api:2.0.0\",\"State\":\"exited\","
                    + "\"Labels\":\"upgrade.managed=true,upgrade.service=api,upgrade.generation=green,upgrade.ordinal=0,upgrade.version=2.0.0\"}",
            "");

    @TempDir
    Path dir;

    private CommandExecutor executor;
    private DockerContainerPlatform platform;

    @BeforeEach
    void setUp() {
        executor = mock(CommandExecutor.class);
        platform = new DockerContainerPlatform(executor, new ObjectMapper(), "docker", "edge-", "edge-net",
                Map.of("api", List.of("-e", "MODE=prod")), dir.resolve("routing.json"), "blue", 8,
                Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("从容器标签和路由文件推导实例状态")
    void listsUnitsFromLabels() {
        when(executor.execute(argThat(cmd -> cmd != null && cmd.contains("ps")), any()))
                .thenReturn(new CommandResult(0, PS_OUTPUT, "", false));

        List<DeploymentUnit> units = platform.listUnits();

        assertThat(units).hasSize(2);
        DeploymentUnit blue = units.get(0);
        assertThat(blue.identity()).isEqualTo("api-blue-0");
        assertThat(blue.currentVersion()).isEqualTo("1.0.0");
        assertThat(blue.live()).isTrue();
        assertThat(blue.healthStatus()).isEqualTo(HealthStatus.UNKNOWN);
        DeploymentUnit green = units.get(1);
        assertThat(green.live()).isFalse();
        assertThat(green.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("路由指针与摘流列表持久化在路由文件中")
    void routingSurvivesNewInstance() {
        when(executor.execute(argThat(cmd -> cmd != null && cmd.contains("ps")), any()))
                .thenReturn(new CommandResult(0, PS_OUTPUT, "", false));

        platform.drain("api-blue-0");
        assertThat(platform.listUnits().get(0).live()).isFalse();
        platform.admit("api-blue-0");
        platform.switchTraffic("green");

        DockerContainerPlatform reopened = new DockerContainerPlatform(executor, new ObjectMapper(), "docker", "edge-",
                null, null, dir.resolve("routing.json"), "blue", 8, Duration.ofSeconds(30), Duration.ofMinutes(5));
        assertThat(reopened.liveGeneration()).isEqualTo("green");
        assertThat(reopened.listUnits().get(0).live()).isFalse();
    }

    @Test
    @DisplayName("健康状态覆盖在进程内保留")
    void healthOverlay() {
        when(executor.execute(argThat(cmd -> cmd != null && cmd.contains("ps")), any()))
                .thenReturn(new CommandResult(0, PS_OUTPUT, "", false));

        platform.recordHealth("api-blue-0", HealthStatus.HEALTHY, LocalDateTime.now());

        assertThat(platform.listUnits().get(0).healthStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("启动命令带上标签、网络别名和服务参数")
    void runCommand() {
        assertThat(platform.runCommand("api", 1, "green", "registry.test/api:2.0.0", "2.0.0"))
                .containsSequence("run", "-d", "--name", "edge-api-green-1")
                .containsSequence("--label", "upgrade.version=2.0.0")
                .containsSequence("--network", "edge-net", "--network-alias", "api-green-1")
                .containsSequence("-e", "MODE=prod", "registry.test/api:2.0.0");
    }

    @Test
    @DisplayName("启动成功后返回未接流量的新实例")
    void startUnit() {
        when(executor.execute(anyList(), any())).thenReturn(new CommandResult(0, "abc123", "", false));

        DeploymentUnit unit = platform.startUnit("api", 0, "green", "registry.test/api:2.0.0", "2.0.0");

        assertThat(unit.identity()).isEqualTo("api-green-0");
        assertThat(unit.live()).isFalse();
        verify(executor).execute(argThat(cmd -> cmd != null && cmd.get(0).equals("docker") && cmd.get(1).equals("run")), eq(Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("瞬时错误标记为可重试，其余错误不可重试")
    void classifiesFailures() {
        when(executor.execute(argThat(cmd -> cmd != null && cmd.contains("pull")), any()))
                .thenReturn(new CommandResult(1, "", "Error response from daemon: Get https://registry.test/v2/: net/http: TLS handshake timeout", false));
        when(executor.execute(argThat(cmd -> cmd != null && cmd.contains("rm")), any()))
                .thenReturn(new CommandResult(1, "", "Error: No such container: edge-api-blue-9", false));

        assertThatThrownBy(() -> platform.pullImage("registry.test/api:2.0.0"))
                .isInstanceOfSatisfying(PlatformException.class, e -> assertThat(e.isRetryable()).isTrue());
        assertThatThrownBy(() -> platform.removeUnit("api-blue-9"))
                .isInstanceOfSatisfying(PlatformException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    @DisplayName("标签解析容忍空白与缺失值")
    void parsesLabels() {
        Map<String, String> labels = DockerContainerPlatform.parseLabels("a=1, b = 2,broken,c=");

        assertThat(labels).containsEntry("a", "1").containsEntry("b", "2").containsEntry("c", "").doesNotContainKey("broken");
    }
}
