package xyz.firestige.upgrade.infrastructure.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.backup.BackupRestoreAdapter;
import xyz.firestige.upgrade.domain.backup.SchemaChange;
import xyz.firestige.upgrade.domain.shared.exception.BackupException;
import xyz.firestige.upgrade.domain.shared.exception.SchemaMigrationException;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 基于外部命令的备份/恢复适配器
 * <p>
 * 每个存储配置一对命令模板，{file} 替换为备份文件的绝对路径，例如：
 * <pre>
 * export: ["sh", "-c", "docker exec app-postgres pg_dump -U app -Fc app > {file}"]
 * import: ["sh", "-c", "docker exec -i app-postgres pg_restore -U app -d app --clean --if-exists < {file}"]
 * </pre>
 * 结构变更的命令由版本目录随变更一起提供，原样执行。
 */
public class CommandBackupRestoreAdapter implements BackupRestoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandBackupRestoreAdapter.class);

    private final CommandExecutor commandExecutor;
    private final Map<String, StoreCommands> commands;

    /**
     * 单个存储的导出/导入命令模板
     */
    public record StoreCommands(List<String> exportCommand, List<String> importCommand) {
    }

    public CommandBackupRestoreAdapter(CommandExecutor commandExecutor, Map<String, StoreCommands> commands) {
        this.commandExecutor = commandExecutor;
        this.commands = commands;
    }

    @Override
    public String exportSnapshot(String storeId, Path artifact, Duration timeout) {
        List<String> command = render(commandsOf(storeId).exportCommand(), artifact);
        run("export", storeId, command, timeout);
        // 导出命令不自报摘要，由迁移器计算
        return null;
    }

    @Override
    public void importSnapshot(String storeId, Path artifact, Duration timeout) {
        List<String> command = render(commandsOf(storeId).importCommand(), artifact);
        run("import", storeId, command, timeout);
    }

    @Override
    public void applySchemaChange(SchemaChange change, Duration timeout) {
        if (change.command().isEmpty()) {
            throw new SchemaMigrationException("结构变更未配置命令: " + change.id());
        }
        CommandResult result = commandExecutor.execute(change.command(), timeout);
        if (!result.isSuccess()) {
            throw new SchemaMigrationException(String.format("结构变更命令失败, changeId: %s, storeId: %s, %s",
                    change.id(), change.storeId(), result.failureMessage()));
        }
        log.debug("结构变更命令完成, changeId: {}, storeId: {}", change.id(), change.storeId());
    }

    @Override
    public boolean verifySchemaChange(SchemaChange change, Duration timeout) {
        if (change.verifyCommand().isEmpty()) {
            return true;
        }
        CommandResult result = commandExecutor.execute(change.verifyCommand(), timeout);
        if (!result.isSuccess()) {
            log.warn("结构变更校验命令失败, changeId: {}, {}", change.id(), result.failureMessage());
        }
        return result.isSuccess();
    }

    private void run(String action, String storeId, List<String> command, Duration timeout) {
        CommandResult result = commandExecutor.execute(command, timeout);
        if (!result.isSuccess()) {
            throw new BackupException(String.format("%s 命令失败, storeId: %s, %s", action, storeId, result.failureMessage()));
        }
        log.debug("{} 命令完成, storeId: {}", action, storeId);
    }

    private StoreCommands commandsOf(String storeId) {
        StoreCommands c = commands.get(storeId);
        if (c == null || c.exportCommand() == null || c.importCommand() == null) {
            throw new BackupException("未配置存储的备份/恢复命令, storeId: " + storeId);
        }
        return c;
    }

    private static List<String> render(List<String> template, Path artifact) {
        String file = artifact.toAbsolutePath().toString();
        return template.stream().map(s -> s.replace("{file}", file)).collect(Collectors.toList());
    }
}
