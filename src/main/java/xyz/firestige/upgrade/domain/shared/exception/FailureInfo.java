package xyz.firestige.upgrade.domain.shared.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 会话失败原因
 * <p>
 * 不可变；随会话记录一起持久化，也原样出现在升级结果和状态查询中。
 */
public final class FailureInfo {

    private final ErrorType errorType;
    private final String errorMessage;

    /**
     * 失败时所处的阶段名称，会话创建前的失败为空
     */
    private final String failedAt;
    private final LocalDateTime timestamp;

    @JsonCreator
    public FailureInfo(@JsonProperty("errorType") ErrorType errorType,
                       @JsonProperty("errorMessage") String errorMessage,
                       @JsonProperty("failedAt") String failedAt,
                       @JsonProperty("timestamp") LocalDateTime timestamp) {
        this.errorType = Objects.requireNonNull(errorType, "errorType cannot be null");
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType, errorMessage, null, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, errorMessage, failedAt, null);
    }

    /**
     * 由异常构造；{@link UpgradeException} 保留其自带的错误类型，其余异常使用 defaultType
     */
    public static FailureInfo fromException(Exception e, ErrorType defaultType, String failedAt) {
        if (e instanceof UpgradeException ue) {
            return of(ue.getErrorType(), ue.getMessage(), failedAt);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return of(defaultType, message, failedAt);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return errorType + (failedAt != null ? "@" + failedAt : "") + ": " + errorMessage;
    }
}
