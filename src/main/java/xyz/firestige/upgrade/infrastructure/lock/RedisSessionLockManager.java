package xyz.firestige.upgrade.infrastructure.lock;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * 会话锁 Redis 实现（分布式锁）
 * <p>
 * 使用 Redis SET NX 原子获取锁，TTL 防止崩溃后泄漏。
 * 会话运行时间可能超过 TTL，编排器在每个阶段边界续租。
 * 释放和续租用 Lua 脚本在服务端比较持有者后再删除/续期，锁过期后被他人获取时不会误删或误续。
 */
public class RedisSessionLockManager implements SessionLockManager {

    private static final String DEFAULT_PREFIX = "upgrade:lock:target:";

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end", Long.class);

    static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end", Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisSessionLockManager(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? DEFAULT_PREFIX
                : keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":";
    }

    @Override
    public boolean tryAcquire(String target, String sessionId, Duration ttl) {
        if (target == null || sessionId == null || ttl == null) {
            return false;
        }
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key(target), sessionId, ttl);
        return Boolean.TRUE.equals(success);
    }

    @Override
    public void release(String target, String sessionId) {
        if (sessionId == null) {
            return;
        }
        redisTemplate.execute(RELEASE_SCRIPT, List.of(key(target)), sessionId);
    }

    @Override
    public boolean isHeld(String target) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(target)));
    }

    @Override
    public String holder(String target) {
        return redisTemplate.opsForValue().get(key(target));
    }

    @Override
    public boolean renew(String target, String sessionId, Duration ttl) {
        if (sessionId == null || ttl == null) {
            return false;
        }
        Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(key(target)), sessionId,
                String.valueOf(ttl.toMillis()));
        return renewed != null && renewed == 1L;
    }

    private String key(String target) {
        return keyPrefix + target;
    }
}
