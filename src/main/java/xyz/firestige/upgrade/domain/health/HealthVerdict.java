package xyz.firestige.upgrade.domain.health;

/**
 * 健康检查结论
 */
public enum HealthVerdict {

    /**
     * 全部通过
     */
    HEALTHY("健康"),

    /**
     * 部分通过
     */
    DEGRADED("降级"),

    /**
     * 全部失败
     */
    UNHEALTHY("不健康");

    private final String description;

    HealthVerdict(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static HealthVerdict of(int passed, int total) {
        if (passed == total) {
            return HEALTHY;
        }
        return passed == 0 ? UNHEALTHY : DEGRADED;
    }
}
