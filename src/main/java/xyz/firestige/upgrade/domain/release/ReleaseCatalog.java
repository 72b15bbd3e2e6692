package xyz.firestige.upgrade.domain.release;

import xyz.firestige.upgrade.domain.backup.SchemaChange;

import java.util.List;
import java.util.Optional;

/**
 * 可用版本目录
 */
public interface ReleaseCatalog {

    Optional<ReleaseManifest> find(String version);

    List<String> versions();

    /**
     * 升级到该版本时需要执行的结构变更，按执行顺序排列
     */
    default List<SchemaChange> schemaChanges(String version) {
        return List.of();
    }
}
