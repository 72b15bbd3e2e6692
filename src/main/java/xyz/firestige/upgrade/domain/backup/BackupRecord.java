package xyz.firestige.upgrade.domain.backup;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 备份记录：创建后不可变
 *
 * @param backupId  备份 ID（store 内唯一）
 * @param storeId   存储标识
 * @param location  备份产物路径
 * @param checksum  SHA-256 十六进制摘要
 * @param sizeBytes 产物大小
 * @param createdAt 创建时间
 * @param reason    创建原因（pre-upgrade / safety 等）
 */
public record BackupRecord(String backupId,
                           String storeId,
                           String location,
                           String checksum,
                           long sizeBytes,
                           LocalDateTime createdAt,
                           String reason) {

    public BackupRecord {
        Objects.requireNonNull(backupId, "backupId cannot be null");
        Objects.requireNonNull(storeId, "storeId cannot be null");
        Objects.requireNonNull(location, "location cannot be null");
        Objects.requireNonNull(checksum, "checksum cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }
}
