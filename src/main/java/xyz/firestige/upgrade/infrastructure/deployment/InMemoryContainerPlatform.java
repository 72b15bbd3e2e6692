package xyz.firestige.upgrade.infrastructure.deployment;

import xyz.firestige.upgrade.domain.deployment.ContainerPlatform;
import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.deployment.HealthStatus;
import xyz.firestige.upgrade.domain.deployment.PlatformException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存容器平台（模拟模式 / 测试）
 * <p>
 * 线程安全：所有操作在实例锁内完成。
 */
public class InMemoryContainerPlatform implements ContainerPlatform {

    private final Map<String, DeploymentUnit> units = new LinkedHashMap<>();
    private final Set<String> drained = new HashSet<>();
    private final Set<String> localImages = new HashSet<>();
    private final Set<String> registryImages = new HashSet<>();
    private final int capacity;
    private String liveGeneration;

    public InMemoryContainerPlatform(String liveGeneration, int capacity) {
        this.liveGeneration = liveGeneration;
        this.capacity = capacity;
    }

    /**
     * 放置初始实例，直接进入在线代
     */
    public synchronized void seed(String service, int replicas, String image, String version) {
        localImages.add(image);
        registryImages.add(image);
        for (int i = 0; i < replicas; i++) {
            String id = DeploymentUnit.identityOf(service, liveGeneration, i);
            units.put(id, new DeploymentUnit(id, service, i, liveGeneration, image, version, version,
                    HealthStatus.UNKNOWN, null, true));
        }
    }

    /**
     * 登记镜像仓库中存在的镜像
     */
    public synchronized void publish(String image) {
        registryImages.add(image);
    }

    @Override
    public synchronized List<DeploymentUnit> listUnits() {
        List<DeploymentUnit> list = new ArrayList<>();
        for (DeploymentUnit u : units.values()) {
            list.add(u.withLive(u.generation().equals(liveGeneration) && !drained.contains(u.identity())));
        }
        list.sort(Comparator.comparing(DeploymentUnit::service)
                .thenComparing(DeploymentUnit::generation)
                .thenComparingInt(DeploymentUnit::ordinal));
        return list;
    }

    @Override
    public synchronized String liveGeneration() {
        return liveGeneration;
    }

    @Override
    public synchronized DeploymentUnit startUnit(String service, int ordinal, String generation, String image, String version) {
        if (units.size() >= capacity) {
            throw new PlatformException(String.format("容量不足, capacity: %d", capacity), false);
        }
        requireLocal(image);
        String id = DeploymentUnit.identityOf(service, generation, ordinal);
        if (units.containsKey(id)) {
            throw new PlatformException("实例已存在: " + id, false);
        }
        DeploymentUnit unit = new DeploymentUnit(id, service, ordinal, generation, image, version, version,
                HealthStatus.UNKNOWN, null, false);
        units.put(id, unit);
        return unit;
    }

    @Override
    public synchronized DeploymentUnit replaceUnit(String identity, String image, String version) {
        DeploymentUnit existing = require(identity);
        requireLocal(image);
        DeploymentUnit replaced = existing.withRelease(image, version);
        units.put(identity, replaced);
        return replaced;
    }

    @Override
    public synchronized void removeUnit(String identity) {
        units.remove(identity);
        drained.remove(identity);
    }

    @Override
    public synchronized void drain(String identity) {
        require(identity);
        drained.add(identity);
    }

    @Override
    public synchronized void admit(String identity) {
        require(identity);
        drained.remove(identity);
    }

    @Override
    public synchronized void switchTraffic(String generation) {
        this.liveGeneration = generation;
    }

    @Override
    public synchronized void pullImage(String image) {
        if (!registryImages.contains(image)) {
            throw new PlatformException("镜像不存在: " + image, false);
        }
        localImages.add(image);
    }

    @Override
    public synchronized boolean imageAvailable(String image) {
        return localImages.contains(image) || registryImages.contains(image);
    }

    @Override
    public synchronized void recordHealth(String identity, HealthStatus status, LocalDateTime checkedAt) {
        DeploymentUnit u = units.get(identity);
        if (u != null) {
            units.put(identity, u.withHealth(status, checkedAt));
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private DeploymentUnit require(String identity) {
        DeploymentUnit u = units.get(identity);
        if (u == null) {
            throw new PlatformException("实例不存在: " + identity, false);
        }
        return u;
    }

    private void requireLocal(String image) {
        if (!localImages.contains(image)) {
            throw new PlatformException("镜像未拉取: " + image, false);
        }
    }
}
