package xyz.firestige.upgrade.domain.shared.vo;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * SessionId 值对象
 *
 * 格式规则：upgrade-{yyyyMMddHHmmss}-{random}
 * 示例：upgrade-20240501120000-3f9a1c
 * 时间前缀使会话文件按名称排序即按创建时间排序，便于运维人员排查。
 */
public final class SessionId {

    private static final String PREFIX = "upgrade-";
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final String value;

    private SessionId(String value) {
        this.value = value;
    }

    /**
     * 生成新的会话 ID
     */
    public static SessionId generate() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return new SessionId(PREFIX + LocalDateTime.now().format(TS) + "-" + random);
    }

    /**
     * 创建 SessionId（带验证）
     *
     * @throws IllegalArgumentException 如果格式无效
     */
    public static SessionId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Session ID 不能为空");
        }
        if (!value.startsWith(PREFIX)) {
            throw new IllegalArgumentException(
                String.format("Session ID 格式无效，必须以 '%s' 开头: %s", PREFIX, value)
            );
        }
        if (value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException(String.format("Session ID 包含非法字符: %s", value));
        }
        return new SessionId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId sessionId = (SessionId) o;
        return Objects.equals(value, sessionId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
