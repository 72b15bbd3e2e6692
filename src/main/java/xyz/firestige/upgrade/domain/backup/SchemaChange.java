package xyz.firestige.upgrade.domain.backup;

import java.util.List;
import java.util.Objects;

/**
 * 目标版本随附的一条存储结构变更
 *
 * @param id            变更标识，在同一版本内唯一
 * @param storeId       作用的存储，必须是已配置备份的存储
 * @param description   变更说明
 * @param command       执行变更的命令
 * @param verifyCommand 变更后的校验命令，为空表示不校验
 */
public record SchemaChange(String id,
                           String storeId,
                           String description,
                           List<String> command,
                           List<String> verifyCommand) {

    public SchemaChange {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(storeId, "storeId cannot be null");
        command = command == null ? List.of() : List.copyOf(command);
        verifyCommand = verifyCommand == null ? List.of() : List.copyOf(verifyCommand);
    }
}
