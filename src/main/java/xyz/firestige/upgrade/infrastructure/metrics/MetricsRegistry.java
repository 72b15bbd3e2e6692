package xyz.firestige.upgrade.infrastructure.metrics;

import java.time.Duration;

/**
 * 会话指标出口
 * <p>
 * tags 按 key, value 成对传入。
 */
public interface MetricsRegistry {

    void incrementCounter(String name, String... tags);

    void setGauge(String name, double value, String... tags);

    void recordDuration(String name, Duration duration, String... tags);
}
