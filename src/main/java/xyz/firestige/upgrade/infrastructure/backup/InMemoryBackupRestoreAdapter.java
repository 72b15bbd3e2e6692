package xyz.firestige.upgrade.infrastructure.backup;

import xyz.firestige.upgrade.domain.backup.BackupRestoreAdapter;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.shared.exception.BackupException;
import xyz.firestige.upgrade.domain.shared.exception.SchemaMigrationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存备份/恢复适配器（模拟模式 / 测试）
 * <p>
 * 存储内容是一段字节；导出写文件，导入用文件内容整体替换存储内容。
 * 结构变更在内容末尾追加一行 "schema:{id}"，可以指定某个变更执行失败或校验不通过。
 */
public class InMemoryBackupRestoreAdapter implements BackupRestoreAdapter {

    private final Map<String, byte[]> stores = new ConcurrentHashMap<>();
    private final Set<String> failingChanges = ConcurrentHashMap.newKeySet();
    private final Set<String> unverifiableChanges = ConcurrentHashMap.newKeySet();

    public void put(String storeId, byte[] content) {
        stores.put(storeId, content.clone());
    }

    public void failOnChange(String changeId) {
        failingChanges.add(changeId);
    }

    public void rejectVerificationOf(String changeId) {
        unverifiableChanges.add(changeId);
    }

    public boolean hasApplied(String storeId, String changeId) {
        byte[] content = stores.get(storeId);
        return content != null && new String(content, StandardCharsets.UTF_8).contains(marker(changeId));
    }

    public byte[] contentOf(String storeId) {
        byte[] content = stores.get(storeId);
        return content == null ? null : content.clone();
    }

    @Override
    public String exportSnapshot(String storeId, Path artifact, Duration timeout) {
        byte[] content = stores.get(storeId);
        if (content == null) {
            throw new BackupException("存储不存在: " + storeId);
        }
        try {
            Files.write(artifact, content);
        } catch (IOException e) {
            throw new BackupException("写入备份文件失败: " + artifact, e);
        }
        return null;
    }

    @Override
    public void importSnapshot(String storeId, Path artifact, Duration timeout) {
        try {
            stores.put(storeId, Files.readAllBytes(artifact));
        } catch (IOException e) {
            throw new BackupException("读取备份文件失败: " + artifact, e);
        }
    }

    @Override
    public void applySchemaChange(SchemaChange change, Duration timeout) {
        byte[] content = stores.get(change.storeId());
        if (content == null) {
            throw new SchemaMigrationException("存储不存在: " + change.storeId());
        }
        if (failingChanges.contains(change.id())) {
            throw new SchemaMigrationException("结构变更执行失败: " + change.id());
        }
        byte[] line = marker(change.id()).getBytes(StandardCharsets.UTF_8);
        byte[] updated = Arrays.copyOf(content, content.length + line.length);
        System.arraycopy(line, 0, updated, content.length, line.length);
        stores.put(change.storeId(), updated);
    }

    @Override
    public boolean verifySchemaChange(SchemaChange change, Duration timeout) {
        return !unverifiableChanges.contains(change.id()) && hasApplied(change.storeId(), change.id());
    }

    private static String marker(String changeId) {
        return "\nschema:" + changeId;
    }
}
