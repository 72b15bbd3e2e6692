package xyz.firestige.upgrade.infrastructure.release;

import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.release.ReleaseCatalog;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 由配置提供的版本目录：版本号 → (服务 → 镜像引用)，以及每个版本随附的结构变更
 */
public class ConfiguredReleaseCatalog implements ReleaseCatalog {

    private final Map<String, ReleaseManifest> releases = new LinkedHashMap<>();
    private final Map<String, List<SchemaChange>> schemaChanges = new LinkedHashMap<>();

    public ConfiguredReleaseCatalog(Map<String, Map<String, String>> releases) {
        this(releases, Map.of());
    }

    public ConfiguredReleaseCatalog(Map<String, Map<String, String>> releases,
                                    Map<String, List<SchemaChange>> schemaChanges) {
        if (releases != null) {
            releases.forEach((version, images) -> this.releases.put(version, new ReleaseManifest(version, images)));
        }
        if (schemaChanges != null) {
            schemaChanges.forEach((version, changes) -> {
                if (!this.releases.containsKey(version)) {
                    throw new IllegalArgumentException("结构变更指向未知版本: " + version);
                }
                this.schemaChanges.put(version, List.copyOf(changes));
            });
        }
    }

    @Override
    public Optional<ReleaseManifest> find(String version) {
        return Optional.ofNullable(releases.get(version));
    }

    @Override
    public List<String> versions() {
        return new ArrayList<>(releases.keySet());
    }

    @Override
    public List<SchemaChange> schemaChanges(String version) {
        return schemaChanges.getOrDefault(version, List.of());
    }
}
