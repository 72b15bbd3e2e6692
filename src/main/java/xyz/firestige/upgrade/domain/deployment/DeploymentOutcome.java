package xyz.firestige.upgrade.domain.deployment;

import java.util.List;

/**
 * 驱动操作结果
 *
 * @param affectedUnits 受影响的实例
 * @param detail        说明
 */
public record DeploymentOutcome(List<String> affectedUnits, String detail) {

    public DeploymentOutcome {
        affectedUnits = affectedUnits == null ? List.of() : List.copyOf(affectedUnits);
    }
}
