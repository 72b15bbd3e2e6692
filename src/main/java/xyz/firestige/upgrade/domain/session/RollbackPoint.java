package xyz.firestige.upgrade.domain.session;

import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 回滚点：升级前的版本清单与本次会话的备份记录
 * <p>
 * 源版本清单与各服务的在线实例数在会话创建时冻结；备份记录在备份阶段完成后一次性挂载，此后不再变化。
 *
 * @param unitCounts 创建会话时各服务的在线实例数，旧记录中缺失时为空
 */
public record RollbackPoint(ReleaseManifest source, List<BackupRecord> backupRefs, Map<String, Integer> unitCounts) {

    public RollbackPoint {
        Objects.requireNonNull(source, "source cannot be null");
        backupRefs = backupRefs == null ? List.of() : List.copyOf(backupRefs);
        unitCounts = unitCounts == null ? Map.of() : Map.copyOf(unitCounts);
    }

    public static RollbackPoint of(ReleaseManifest source, Map<String, Integer> unitCounts) {
        return new RollbackPoint(source, List.of(), unitCounts);
    }

    public RollbackPoint withBackups(List<BackupRecord> backups) {
        if (!backupRefs.isEmpty()) {
            throw new IllegalStateException("回滚点的备份记录已冻结，不允许重复挂载");
        }
        return new RollbackPoint(source, backups, unitCounts);
    }

    public String sourceVersion() {
        return source.version();
    }
}
