package xyz.firestige.upgrade.domain.deployment;

import java.util.Arrays;

/**
 * 部署策略
 */
public enum DeploymentStrategyType {

    /**
     * 并行切换（蓝绿）：新代全量启动后原子切流
     */
    PARALLEL_CUTOVER("parallel-cutover", "blue-green"),

    /**
     * 顺序替换（滚动）：逐个实例原地替换
     */
    SEQUENTIAL_REPLACE("sequential-replace", "rolling");

    private final String wireName;
    private final String alias;

    DeploymentStrategyType(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 按名称解析，兼容 blue-green / rolling 旧称和枚举名
     */
    public static DeploymentStrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            return PARALLEL_CUTOVER;
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized)
                        || t.alias.equals(normalized)
                        || t.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的部署策略: " + name));
    }

    /**
     * 执行该策略所需的实例容量
     *
     * @param liveUnits 当前在线实例数
     */
    public int requiredCapacity(int liveUnits) {
        return switch (this) {
            case PARALLEL_CUTOVER -> liveUnits * 2;
            case SEQUENTIAL_REPLACE -> liveUnits;
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
