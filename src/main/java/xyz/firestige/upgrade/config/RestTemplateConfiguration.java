package xyz.firestige.upgrade.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 客户端配置（健康检查探针使用）
 */
@Configuration
public class RestTemplateConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RestTemplate restTemplate(UpgradeProperties properties) {
        UpgradeProperties.Health health = properties.getHealth();
        return new RestTemplateBuilder()
                .setConnectTimeout(health.getConnectTimeout())
                .setReadTimeout(health.getReadTimeout())
                .build();
    }
}
