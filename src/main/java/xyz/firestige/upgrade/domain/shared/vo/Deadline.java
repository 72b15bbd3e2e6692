package xyz.firestige.upgrade.domain.shared.vo;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 截止时间值对象
 * <p>
 * 每个阶段的预算在进入阶段时换算成一个绝对截止时间，阶段内的所有外部调用共享它。
 */
public record Deadline(Instant at) {

    public Deadline {
        Objects.requireNonNull(at, "at cannot be null");
    }

    public static Deadline after(Duration budget) {
        return new Deadline(Instant.now().plus(budget));
    }

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), at);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !Instant.now().isBefore(at);
    }

    /**
     * 取剩余时间与给定上限中较小者，用于单次外部调用的超时
     */
    public Duration cap(Duration perCall) {
        Duration left = remaining();
        return perCall.compareTo(left) < 0 ? perCall : left;
    }
}
