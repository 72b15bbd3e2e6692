package xyz.firestige.upgrade.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现
 * <p>
 * 同名同标签的 gauge 只注册一次，之后只更新持有的值。
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name, String... tags) {
        registry.counter(name, Tags.of(tags)).increment();
    }

    @Override
    public void setGauge(String name, double value, String... tags) {
        Tags t = Tags.of(tags);
        AtomicLong holder = gauges.computeIfAbsent(name + t, k -> {
            AtomicLong bits = new AtomicLong();
            registry.gauge(name, t, bits, b -> Double.longBitsToDouble(b.get()));
            return bits;
        });
        holder.set(Double.doubleToLongBits(value));
    }

    @Override
    public void recordDuration(String name, Duration duration, String... tags) {
        registry.timer(name, Tags.of(tags)).record(duration);
    }
}
