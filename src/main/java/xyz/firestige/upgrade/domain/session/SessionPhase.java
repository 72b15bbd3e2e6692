package xyz.firestige.upgrade.domain.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * 升级会话阶段枚举
 * <p>
 * 正常路径：
 * CREATED → VALIDATING → BACKING_UP → VERIFYING_SIGNATURES → DEPLOYING → HEALTH_CHECKING → FINALIZING → COMPLETED
 * <p>
 * 失败分支：
 * - 变更发生前（CREATED / VALIDATING / BACKING_UP / VERIFYING_SIGNATURES）失败 → FAILED，无需回滚
 * - 变更发生后（DEPLOYING / HEALTH_CHECKING / FINALIZING）失败 → ROLLING_BACK → ROLLED_BACK
 * - ROLLING_BACK 中数据恢复也失败 → FAILED（需人工介入）
 */
public enum SessionPhase {

    CREATED("已创建"),

    VALIDATING("预检中"),

    BACKING_UP("备份中"),

    VERIFYING_SIGNATURES("签名校验中"),

    DEPLOYING("部署中"),

    HEALTH_CHECKING("健康检查中"),

    FINALIZING("收尾中"),

    /**
     * 升级完成（终态）
     */
    COMPLETED("已完成"),

    ROLLING_BACK("回滚中"),

    /**
     * 已回滚到升级前状态（终态）
     */
    ROLLED_BACK("已回滚"),

    /**
     * 失败（终态）
     */
    FAILED("失败");

    private final String description;

    SessionPhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == FAILED;
    }

    /**
     * 该阶段是否已可能对部署单元产生变更
     * <p>
     * 处于这些阶段时取消或失败都必须先回滚
     */
    public boolean isMutating() {
        return this == DEPLOYING || this == HEALTH_CHECKING || this == FINALIZING || this == ROLLING_BACK;
    }

    /**
     * 允许的下一阶段
     */
    public Set<SessionPhase> allowedNext() {
        return switch (this) {
            case CREATED -> EnumSet.of(VALIDATING, FAILED);
            case VALIDATING -> EnumSet.of(BACKING_UP, FAILED);
            case BACKING_UP -> EnumSet.of(VERIFYING_SIGNATURES, FAILED);
            case VERIFYING_SIGNATURES -> EnumSet.of(DEPLOYING, FAILED);
            case DEPLOYING -> EnumSet.of(HEALTH_CHECKING, ROLLING_BACK);
            case HEALTH_CHECKING -> EnumSet.of(FINALIZING, ROLLING_BACK);
            case FINALIZING -> EnumSet.of(COMPLETED, ROLLING_BACK);
            case ROLLING_BACK -> EnumSet.of(ROLLED_BACK, FAILED);
            case COMPLETED, ROLLED_BACK, FAILED -> EnumSet.noneOf(SessionPhase.class);
        };
    }

    public boolean canTransitionTo(SessionPhase next) {
        return allowedNext().contains(next);
    }
}
