package xyz.firestige.upgrade.application.validation;

import xyz.firestige.upgrade.domain.deployment.DeploymentUnit;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 从在线实例推导当前运行的版本清单
 * <p>
 * 在线实例必须全部运行同一个版本，且同一服务只能对应一个镜像。
 */
public class CurrentReleaseResolver {

    public ReleaseManifest resolve(List<DeploymentUnit> units) {
        Map<String, String> images = new LinkedHashMap<>();
        Set<String> versions = new TreeSet<>();
        for (DeploymentUnit u : units) {
            if (!u.live()) {
                continue;
            }
            if (u.currentVersion() == null) {
                throw new ValidationException("在线实例未标注版本: " + u.identity());
            }
            versions.add(u.currentVersion());
            String previous = images.putIfAbsent(u.service(), u.image());
            if (previous != null && !previous.equals(u.image())) {
                throw new ValidationException(String.format(
                        "服务 %s 的在线实例运行不同镜像: %s, %s", u.service(), previous, u.image()));
            }
        }
        if (images.isEmpty()) {
            throw new ValidationException("未发现在线实例，无法确定当前版本");
        }
        if (versions.size() != 1) {
            throw new ValidationException("在线实例版本不一致: " + versions);
        }
        return new ReleaseManifest(versions.iterator().next(), images);
    }

    /**
     * 各服务的在线实例数
     */
    public Map<String, Integer> countLiveUnits(List<DeploymentUnit> units) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DeploymentUnit u : units) {
            if (u.live()) {
                counts.merge(u.service(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
