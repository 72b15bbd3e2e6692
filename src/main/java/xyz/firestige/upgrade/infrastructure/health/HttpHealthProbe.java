package xyz.firestige.upgrade.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.health.HealthProbe;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 基于 HTTP 健康端点的探针
 * <p>
 * 实例 URL 模板支持占位符 {identity} {service} {generation} {ordinal}；
 * 存储优先执行配置的检查命令（退出码 0 视为健康），否则 GET 其健康 URL。
 * 2xx 视为健康，其余状态码和异常都视为一次失败。
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final RestTemplate restTemplate;
    private final CommandExecutor commandExecutor;
    private final String unitUrlTemplate;
    private final Map<String, String> serviceUrlTemplates;
    private final Map<String, StoreHealthCheck> storeChecks;
    private final Duration commandTimeout;

    /**
     * 存储检查配置
     */
    public record StoreHealthCheck(String url, List<String> command) {
    }

    public HttpHealthProbe(RestTemplate restTemplate,
                           CommandExecutor commandExecutor,
                           String unitUrlTemplate,
                           Map<String, String> serviceUrlTemplates,
                           Map<String, StoreHealthCheck> storeChecks,
                           Duration commandTimeout) {
        this.restTemplate = restTemplate;
        this.commandExecutor = commandExecutor;
        this.unitUrlTemplate = unitUrlTemplate;
        this.serviceUrlTemplates = serviceUrlTemplates != null ? serviceUrlTemplates : Map.of();
        this.storeChecks = storeChecks != null ? storeChecks : Map.of();
        this.commandTimeout = commandTimeout;
    }

    @Override
    public boolean probeUnit(DeploymentUnit unit) {
        String template = serviceUrlTemplates.getOrDefault(unit.service(), unitUrlTemplate);
        return get(resolve(template, unit));
    }

    @Override
    public boolean probeStore(String storeId) {
        StoreHealthCheck check = storeChecks.get(storeId);
        if (check == null) {
            log.warn("未配置存储健康检查, storeId: {}", storeId);
            return false;
        }
        if (check.command() != null && !check.command().isEmpty()) {
            CommandResult result = commandExecutor.execute(check.command(), commandTimeout);
            if (!result.isSuccess()) {
                log.debug("存储健康检查命令失败, storeId: {}, {}", storeId, result.failureMessage());
            }
            return result.isSuccess();
        }
        return get(check.url());
    }

    private boolean get(String url) {
        ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
        boolean ok = response.getStatusCode().is2xxSuccessful();
        log.debug("健康检查 {} -> {}", url, response.getStatusCode());
        return ok;
    }

    static String resolve(String template, DeploymentUnit unit) {
        return template
                .replace("{identity}", unit.identity())
                .replace("{service}", unit.service())
                .replace("{generation}", String.valueOf(unit.generation()))
                .replace("{ordinal}", String.valueOf(unit.ordinal()));
    }
}
