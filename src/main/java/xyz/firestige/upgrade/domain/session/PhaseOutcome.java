package xyz.firestige.upgrade.domain.session;

/**
 * 阶段结果
 */
public enum PhaseOutcome {

    SUCCESS("成功"),

    FAILURE("失败"),

    /**
     * 按请求跳过（skipBackup / verifySignatures=false）
     */
    SKIPPED("已跳过"),

    /**
     * 演练模式下仅模拟，未实际执行
     */
    SIMULATED("已模拟");

    private final String description;

    PhaseOutcome(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否允许会话继续推进到下一阶段
     */
    public boolean allowsProgress() {
        return this != FAILURE;
    }
}
