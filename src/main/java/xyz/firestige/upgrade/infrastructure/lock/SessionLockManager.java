package xyz.firestige.upgrade.infrastructure.lock;

import java.time.Duration;

/**
 * 会话锁管理接口（技术无关）
 * <p>
 * 职责：
 * - 确保同一部署目标在任意时刻只有一个未结束的升级会话
 * - 获取失败立即返回，不排队
 * <p>
 * 实现可以是：
 * - 文件锁（默认，单机）
 * - Redis SET NX（多台运维机共享同一部署目标）
 * - InMemory（测试）
 */
public interface SessionLockManager {

    /**
     * 尝试获取部署目标的会话锁
     *
     * @param target    部署目标
     * @param sessionId 持有者
     * @param ttl       过期时间（仅对支持过期的实现有效）
     * @return true=成功获取，false=已被占用
     */
    boolean tryAcquire(String target, String sessionId, Duration ttl);

    /**
     * 释放锁；非持有者调用时不做任何事
     */
    void release(String target, String sessionId);

    /**
     * 锁是否被占用（任何持有者）
     */
    boolean isHeld(String target);

    /**
     * 当前持有者，未知时返回 null
     */
    String holder(String target);

    /**
     * 续租（可选）
     */
    default boolean renew(String target, String sessionId, Duration ttl) {
        return false;
    }
}
