package xyz.firestige.upgrade.infrastructure.health;

import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.health.HealthProbe;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存健康探针（模拟模式 / 测试）
 * <p>
 * 默认全部健康；可按实例标识、镜像或存储标记为不健康。
 */
public class InMemoryHealthProbe implements HealthProbe {

    private final Set<String> unhealthyUnits = ConcurrentHashMap.newKeySet();
    private final Set<String> unhealthyImages = ConcurrentHashMap.newKeySet();
    private final Set<String> unhealthyStores = ConcurrentHashMap.newKeySet();

    @Override
    public boolean probeUnit(DeploymentUnit unit) {
        return !unhealthyUnits.contains(unit.identity()) && !unhealthyImages.contains(unit.image());
    }

    @Override
    public boolean probeStore(String storeId) {
        return !unhealthyStores.contains(storeId);
    }

    public void markUnitUnhealthy(String identity) {
        unhealthyUnits.add(identity);
    }

    public void markImageUnhealthy(String image) {
        unhealthyImages.add(image);
    }

    public void markStoreUnhealthy(String storeId) {
        unhealthyStores.add(storeId);
    }

    public void reset() {
        unhealthyUnits.clear();
        unhealthyImages.clear();
        unhealthyStores.clear();
    }
}
