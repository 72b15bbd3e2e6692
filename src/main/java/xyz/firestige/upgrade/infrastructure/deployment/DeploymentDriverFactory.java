package xyz.firestige.upgrade.infrastructure.deployment;

import xyz.firestige.upgrade.domain.deployment.DeploymentDriver;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按策略选择部署驱动
 */
public class DeploymentDriverFactory {

    private final Map<DeploymentStrategyType, DeploymentDriver> drivers = new EnumMap<>(DeploymentStrategyType.class);

    public DeploymentDriverFactory(List<DeploymentDriver> drivers) {
        for (DeploymentDriver d : drivers) {
            this.drivers.put(d.strategy(), d);
        }
    }

    public DeploymentDriver forStrategy(DeploymentStrategyType strategy) {
        DeploymentDriver driver = drivers.get(strategy);
        if (driver == null) {
            throw new IllegalArgumentException("未注册的部署策略: " + strategy);
        }
        return driver;
    }
}
