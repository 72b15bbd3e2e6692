package xyz.firestige.upgrade.infrastructure.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;
import xyz.firestige.upgrade.infrastructure.health.HttpHealthProbe.StoreHealthCheck;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HttpHealthProbe 测试（RestTemplate 与命令执行器用 Mockito 模拟）
 */
@DisplayName("HTTP 健康探针测试")
class HttpHealthProbeTest {

    private RestTemplate restTemplate;
    private CommandExecutor executor;
    private HttpHealthProbe probe;

    private final DeploymentUnit api = new DeploymentUnit("api-green-1", "api", 1, "green",
            "registry.test/api:2.0.0", "2.0.0", "2.0.0", HealthStatus.UNKNOWN, null, false);

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        executor = mock(CommandExecutor.class);
        probe = new HttpHealthProbe(restTemplate, executor, "http://{identity}:8080/health",
                Map.of("web", "http://{service}-{generation}-{ordinal}.internal/ready"),
                Map.of("db", new StoreHealthCheck(null, List.of("pg_isready", "-h", "db")),
                        "cache", new StoreHealthCheck("http://cache:9000/health", null)),
                Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("URL 模板替换实例占位符")
    void resolvesTemplate() {
        assertThat(HttpHealthProbe.resolve("http://{service}-{generation}-{ordinal}/x", api))
                .isEqualTo("http://api-green-1/x");
    }

    @Test
    @DisplayName("2xx 视为健康")
    void unitHealthyOn2xx() {
        when(restTemplate.getForEntity("http://api-green-1:8080/health", String.class))
                .thenReturn(ResponseEntity.ok("UP"));

        assertThat(probe.probeUnit(api)).isTrue();
    }

    @Test
    @DisplayName("非 2xx 视为不健康")
    void unitUnhealthyOnNon2xx() {
        when(restTemplate.getForEntity(any(String.class), eq(String.class)))
                .thenReturn(ResponseEntity.status(HttpStatus.NO_CONTENT).body(""))
                .thenReturn(ResponseEntity.status(HttpStatus.MOVED_PERMANENTLY).body(""));

        assertThat(probe.probeUnit(api)).isTrue();
        assertThat(probe.probeUnit(api)).isFalse();
    }

    @Test
    @DisplayName("服务级 URL 模板优先")
    void serviceTemplateWins() {
        DeploymentUnit web = new DeploymentUnit("web-blue-0", "web", 0, "blue", "registry.test/web:1.0.0",
                "1.0.0", "1.0.0", HealthStatus.UNKNOWN, null, true);
        when(restTemplate.getForEntity("http://web-blue-0.internal/ready", String.class))
                .thenReturn(ResponseEntity.ok("ok"));

        assertThat(probe.probeUnit(web)).isTrue();
    }

    @Test
    @DisplayName("存储优先使用检查命令")
    void storeUsesCommand() {
        when(executor.execute(anyList(), any())).thenReturn(new CommandResult(0, "accepting connections", "", false));

        assertThat(probe.probeStore("db")).isTrue();
        verify(executor).execute(List.of("pg_isready", "-h", "db"), Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("存储检查命令失败视为不健康")
    void storeCommandFails() {
        when(executor.execute(anyList(), any())).thenReturn(new CommandResult(2, "", "no response", false));

        assertThat(probe.probeStore("db")).isFalse();
    }

    @Test
    @DisplayName("存储没有命令时 GET 健康 URL；未配置的存储视为不健康")
    void storeFallsBackToUrl() {
        when(restTemplate.getForEntity("http://cache:9000/health", String.class)).thenReturn(ResponseEntity.ok("ok"));

        assertThat(probe.probeStore("cache")).isTrue();
        assertThat(probe.probeStore("unknown")).isFalse();
    }
}
