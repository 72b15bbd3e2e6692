package xyz.firestige.upgrade.domain.health;

/**
 * 单个检查对象（实例或存储）的结果
 *
 * @param name     实例标识或存储标识
 * @param store    是否为存储
 * @param healthy  是否通过
 * @param attempts 实际探测次数
 * @param detail   最近一次失败原因
 */
public record TargetHealth(String name, boolean store, boolean healthy, int attempts, String detail) {
}
