package xyz.firestige.upgrade.domain.health;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 健康检查报告
 */
public record HealthReport(HealthVerdict verdict, List<TargetHealth> targets) {

    public HealthReport {
        targets = List.copyOf(targets);
    }

    public static HealthReport of(List<TargetHealth> targets) {
        int passed = (int) targets.stream().filter(TargetHealth::healthy).count();
        return new HealthReport(HealthVerdict.of(passed, targets.size()), targets);
    }

    public boolean isHealthy() {
        return verdict == HealthVerdict.HEALTHY;
    }

    public List<String> unhealthyTargets() {
        return targets.stream().filter(t -> !t.healthy()).map(TargetHealth::name).collect(Collectors.toList());
    }

    public String summary() {
        long passed = targets.stream().filter(TargetHealth::healthy).count();
        String text = String.format("%s（%d/%d 通过）", verdict.getDescription(), passed, targets.size());
        return isHealthy() ? text : text + ", 未通过: " + unhealthyTargets();
    }
}
