package xyz.firestige.upgrade.domain.session;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 阶段历史条目，只追加不修改
 */
public record PhaseRecord(SessionPhase phase, LocalDateTime timestamp, PhaseOutcome outcome, String detail) {

    public PhaseRecord {
        Objects.requireNonNull(phase, "phase cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(outcome, "outcome cannot be null");
    }

    public static PhaseRecord now(SessionPhase phase, PhaseOutcome outcome, String detail) {
        return new PhaseRecord(phase, LocalDateTime.now(), outcome, detail);
    }
}
