package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于区分升级会话各阶段的失败，决定编排器走 FAILED 还是回滚分支
 */
public enum ErrorType {

    /**
     * 预检失败（未发生任何变更，可直接终止）
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 备份失败（尚未部署，可直接终止）
     */
    BACKUP_ERROR("备份错误"),

    /**
     * 镜像签名校验失败（信任失败，不自动重试）
     */
    VERIFICATION_ERROR("签名校验错误"),

    /**
     * 部署失败（触发回滚）
     */
    DEPLOYMENT_ERROR("部署错误"),

    /**
     * 健康检查失败（触发回滚）
     */
    HEALTH_CHECK_ERROR("健康检查错误"),

    /**
     * 回滚失败（需要人工介入）
     */
    ROLLBACK_ERROR("回滚错误"),

    /**
     * 会话冲突（已有未结束的会话）
     */
    SESSION_CONFLICT("会话冲突"),

    /**
     * 操作员取消
     */
    CANCELLED("已取消"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 该类错误发生时是否需要走回滚分支
     */
    public boolean triggersRollback() {
        return this == DEPLOYMENT_ERROR || this == HEALTH_CHECK_ERROR;
    }
}
