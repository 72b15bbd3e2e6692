package xyz.firestige.upgrade.infrastructure.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.backup.BackupRestoreAdapter;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.shared.exception.BackupException;
import xyz.firestige.upgrade.domain.shared.exception.SchemaMigrationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 数据库迁移器：备份/恢复适配器之上的一层薄封装
 * <p>
 * 职责：
 * <ul>
 *   <li>备份产物落盘到 {backupRoot}/{storeId}/{backupId}/，附带 metadata.json</li>
 *   <li>创建后立即做 SHA-256 校验，校验失败视为备份从未创建（删除产物并抛出 {@link BackupException}）</li>
 *   <li>恢复前先校验，再做安全备份；导入失败时用安全备份还原后再抛出</li>
 *   <li>按 maxBackups 保留每个存储最近的备份</li>
 *   <li>按顺序执行目标版本的结构变更，撤销依赖升级前的备份</li>
 * </ul>
 */
public class DatabaseMigrator {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMigrator.class);

    static final String ARTIFACT_FILE = "snapshot.dump";
    static final String METADATA_FILE = "metadata.json";
    private static final DateTimeFormatter ID_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final BackupRestoreAdapter adapter;
    private final Path backupRoot;
    private final int maxBackups;
    private final boolean safetyBackupBeforeRestore;
    private final Duration operationTimeout;
    private final ObjectMapper objectMapper;

    public DatabaseMigrator(BackupRestoreAdapter adapter,
                            Path backupRoot,
                            int maxBackups,
                            boolean safetyBackupBeforeRestore,
                            Duration operationTimeout,
                            ObjectMapper objectMapper) {
        this.adapter = adapter;
        this.backupRoot = backupRoot;
        this.maxBackups = Math.max(1, maxBackups);
        this.safetyBackupBeforeRestore = safetyBackupBeforeRestore;
        this.operationTimeout = operationTimeout;
        this.objectMapper = objectMapper;
    }

    /**
     * 备份一个存储
     */
    public BackupRecord backup(String storeId) {
        return backup(storeId, "pre-upgrade");
    }

    /**
     * 备份一个存储
     *
     * @param storeId 存储标识
     * @param reason  备份原因，写入元数据
     * @return 已通过校验的备份记录
     * @throws BackupException 导出失败或校验失败
     */
    public BackupRecord backup(String storeId, String reason) {
        return backup(storeId, reason, Set.of());
    }

    private BackupRecord backup(String storeId, String reason, Set<String> protectedIds) {
        LocalDateTime now = LocalDateTime.now();
        String backupId = storeId + "-" + now.format(ID_TS) + "-" + UUID.randomUUID().toString().substring(0, 4);
        Path dir = backupRoot.resolve(storeId).resolve(backupId);
        Path artifact = dir.resolve(ARTIFACT_FILE);
        log.info("开始备份存储, storeId: {}, backupId: {}", storeId, backupId);

        try {
            Files.createDirectories(dir);
            String reported = adapter.exportSnapshot(storeId, artifact, operationTimeout);
            if (!Files.isRegularFile(artifact)) {
                throw new BackupException(String.format("导出未产生备份文件, storeId: %s", storeId));
            }
            String checksum = sha256(artifact);
            if (reported != null && !reported.equalsIgnoreCase(checksum)) {
                throw new BackupException(String.format(
                        "备份校验失败, storeId: %s, 导出工具摘要: %s, 实际摘要: %s", storeId, reported, checksum));
            }
            BackupRecord record = new BackupRecord(backupId, storeId, artifact.toString(), checksum,
                    Files.size(artifact), now, reason);
            if (!verify(record)) {
                throw new BackupException(String.format("备份创建后复核失败, storeId: %s, backupId: %s", storeId, backupId));
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(METADATA_FILE).toFile(), record);
            log.info("备份完成, storeId: {}, backupId: {}, size: {}B, sha256: {}", storeId, backupId, record.sizeBytes(), checksum);
            prune(storeId, protectedIds);
            return record;
        } catch (BackupException e) {
            discard(dir);
            throw e;
        } catch (IOException | RuntimeException e) {
            discard(dir);
            throw new BackupException(String.format("备份失败, storeId: %s, 原因: %s", storeId, e.getMessage()), e);
        }
    }

    /**
     * 从备份恢复存储，仅在回滚时调用；同一记录恢复两次结果相同
     *
     * @throws BackupException 校验失败或导入失败
     */
    public void restore(String storeId, BackupRecord record) {
        if (!storeId.equals(record.storeId())) {
            throw new BackupException(String.format(
                    "备份记录不属于该存储, storeId: %s, record.storeId: %s", storeId, record.storeId()));
        }
        if (!verify(record)) {
            throw new BackupException(String.format(
                    "备份文件缺失或校验失败，拒绝恢复, storeId: %s, backupId: %s", storeId, record.backupId()));
        }
        log.info("开始恢复存储, storeId: {}, backupId: {}", storeId, record.backupId());

        BackupRecord safety = null;
        if (safetyBackupBeforeRestore) {
            try {
                safety = backup(storeId, "pre-restore-safety", Set.of(record.backupId()));
            } catch (BackupException e) {
                log.warn("恢复前安全备份失败，继续恢复, storeId: {}, error: {}", storeId, e.getMessage());
            }
        }

        try {
            adapter.importSnapshot(storeId, Path.of(record.location()), operationTimeout);
        } catch (RuntimeException e) {
            log.error("导入备份失败, storeId: {}, backupId: {}", storeId, record.backupId(), e);
            if (safety != null) {
                try {
                    adapter.importSnapshot(storeId, Path.of(safety.location()), operationTimeout);
                    log.warn("已用安全备份还原存储, storeId: {}, safetyId: {}", storeId, safety.backupId());
                } catch (RuntimeException re) {
                    log.error("安全备份还原也失败, storeId: {}, safetyId: {}", storeId, safety.backupId(), re);
                }
            }
            throw new BackupException(String.format("恢复失败, storeId: %s, 原因: %s", storeId, e.getMessage()), e);
        }
        log.info("恢复完成, storeId: {}, backupId: {}", storeId, record.backupId());
    }

    /**
     * 按顺序执行结构变更，每条执行后立即校验；任一失败即停止
     *
     * @throws SchemaMigrationException 变更命令失败或校验未通过
     */
    public void migrateSchema(List<SchemaChange> changes) {
        for (SchemaChange change : changes) {
            log.info("执行结构变更, changeId: {}, storeId: {}, description: {}",
                    change.id(), change.storeId(), change.description());
            try {
                adapter.applySchemaChange(change, operationTimeout);
            } catch (SchemaMigrationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SchemaMigrationException(String.format(
                        "结构变更失败, changeId: %s, 原因: %s", change.id(), e.getMessage()), e);
            }
            if (!adapter.verifySchemaChange(change, operationTimeout)) {
                throw new SchemaMigrationException(String.format(
                        "结构变更校验未通过, changeId: %s, storeId: %s", change.id(), change.storeId()));
            }
            log.info("结构变更完成, changeId: {}", change.id());
        }
    }

    /**
     * 校验备份文件存在且摘要一致
     */
    public boolean verify(BackupRecord record) {
        Path artifact = Path.of(record.location());
        if (!Files.isRegularFile(artifact)) {
            return false;
        }
        try {
            return sha256(artifact).equalsIgnoreCase(record.checksum());
        } catch (IOException e) {
            log.warn("读取备份文件失败, backupId: {}, error: {}", record.backupId(), e.getMessage());
            return false;
        }
    }

    /**
     * 列出存储的备份，按创建时间倒序
     */
    public List<BackupRecord> listBackups(String storeId) {
        Path storeDir = backupRoot.resolve(storeId);
        if (!Files.isDirectory(storeDir)) {
            return List.of();
        }
        List<BackupRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(storeDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                readMetadata(dir).ifPresent(records::add);
            }
        } catch (IOException e) {
            throw new BackupException(String.format("读取备份目录失败, storeId: %s", storeId), e);
        }
        records.sort(Comparator.comparing(BackupRecord::createdAt).reversed());
        return records;
    }

    /**
     * 备份目录所在磁盘的可用空间
     */
    public long usableSpace() {
        try {
            Files.createDirectories(backupRoot);
            return Files.getFileStore(backupRoot).getUsableSpace();
        } catch (IOException e) {
            throw new BackupException("无法读取备份目录可用空间: " + backupRoot, e);
        }
    }

    private void prune(String storeId, Set<String> protectedIds) {
        List<BackupRecord> all;
        try {
            all = listBackups(storeId);
        } catch (BackupException e) {
            log.warn("清理过期备份失败, storeId: {}, error: {}", storeId, e.getMessage());
            return;
        }
        for (int i = maxBackups; i < all.size(); i++) {
            BackupRecord old = all.get(i);
            if (protectedIds.contains(old.backupId())) {
                continue;
            }
            log.info("清理过期备份, storeId: {}, backupId: {}", storeId, old.backupId());
            discard(Path.of(old.location()).getParent());
        }
    }

    private Optional<BackupRecord> readMetadata(Path dir) {
        Path metadata = dir.resolve(METADATA_FILE);
        if (!Files.isRegularFile(metadata)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(metadata.toFile(), BackupRecord.class));
        } catch (IOException e) {
            log.warn("备份元数据损坏，忽略, dir: {}, error: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private void discard(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("删除备份文件失败: {}, error: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("删除备份目录失败: {}, error: {}", dir, e.getMessage());
        }
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
