package xyz.firestige.upgrade.infrastructure.lock;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存会话锁（测试 / 单进程模拟）
 */
public class InMemorySessionLockManager implements SessionLockManager {

    private final Map<String, String> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String target, String sessionId, Duration ttl) {
        return locks.putIfAbsent(target, sessionId) == null;
    }

    @Override
    public void release(String target, String sessionId) {
        locks.remove(target, sessionId);
    }

    @Override
    public boolean isHeld(String target) {
        return locks.containsKey(target);
    }

    @Override
    public String holder(String target) {
        return locks.get(target);
    }
}
