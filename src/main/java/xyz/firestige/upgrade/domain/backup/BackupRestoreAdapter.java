package xyz.firestige.upgrade.domain.backup;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 备份/恢复适配器（外部协作方）
 * <p>
 * 每个持久化存储提供一对导出/导入命令。两者都必须幂等：
 * 同一个产物导入两次，存储内容与导入一次相同。
 * 目标版本可以附带结构变更，变更在部署前执行，回滚时由导入快照撤销。
 */
public interface BackupRestoreAdapter {

    /**
     * 导出存储的一致性时间点快照到指定文件
     *
     * @param storeId  存储标识
     * @param artifact 目标文件
     * @param timeout  本次调用的超时
     * @return 导出工具自报的 SHA-256 摘要，不提供时返回 null
     */
    String exportSnapshot(String storeId, Path artifact, Duration timeout);

    /**
     * 用快照文件替换存储内容
     */
    void importSnapshot(String storeId, Path artifact, Duration timeout);

    /**
     * 执行一条结构变更
     *
     * @throws xyz.firestige.upgrade.domain.shared.exception.SchemaMigrationException 变更命令失败
     */
    void applySchemaChange(SchemaChange change, Duration timeout);

    /**
     * 校验结构变更已生效；未配置校验命令时视为通过
     */
    boolean verifySchemaChange(SchemaChange change, Duration timeout);
}
