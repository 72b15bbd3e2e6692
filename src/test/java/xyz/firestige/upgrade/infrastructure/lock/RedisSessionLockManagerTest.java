package xyz.firestige.upgrade.infrastructure.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisSessionLockManager 测试（Mockito 模拟 StringRedisTemplate）
 */
@DisplayName("Redis 会话锁测试")
class RedisSessionLockManagerTest {

    private static final Duration TTL = Duration.ofMinutes(30);
    private static final String KEY = "upgrade:lock:target:edge";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> ops;
    private RedisSessionLockManager locks;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        locks = new RedisSessionLockManager(redisTemplate, "upgrade:lock:target");
    }

    @Test
    @DisplayName("SET NX 成功即获取锁")
    void acquireUsesSetIfAbsent() {
        when(ops.setIfAbsent(KEY, "upgrade-a", TTL)).thenReturn(true);

        assertTrue(locks.tryAcquire("edge", "upgrade-a", TTL));
    }

    @Test
    @DisplayName("键已存在时获取失败")
    void acquireFailsWhenKeyExists() {
        when(ops.setIfAbsent(KEY, "upgrade-b", TTL)).thenReturn(false);

        assertFalse(locks.tryAcquire("edge", "upgrade-b", TTL));
    }

    @Test
    @DisplayName("释放在服务端比较持有者后删除，不做客户端先读后删")
    void releaseComparesOwnerOnServer() {
        locks.release("edge", "upgrade-a");

        verify(redisTemplate).execute(RedisSessionLockManager.RELEASE_SCRIPT, List.of(KEY), "upgrade-a");
        verify(redisTemplate, never()).delete(anyString());
        verify(ops, never()).get(anyString());
        assertTrue(RedisSessionLockManager.RELEASE_SCRIPT.getScriptAsString()
                .contains("redis.call('get', KEYS[1]) == ARGV[1]"));
    }

    @Test
    @DisplayName("锁过期后被其他会话获取：原持有者的释放不删除新锁")
    void staleOwnerReleaseLeavesNewLock() {
        when(redisTemplate.execute(eq(RedisSessionLockManager.RELEASE_SCRIPT), eq(List.of(KEY)), eq("upgrade-a")))
                .thenReturn(0L);

        locks.release("edge", "upgrade-a");
        locks.release("edge", null);

        verify(redisTemplate).execute(RedisSessionLockManager.RELEASE_SCRIPT, List.of(KEY), "upgrade-a");
        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    @DisplayName("续租只对持有者生效，TTL 以毫秒传给脚本")
    void renewOnlyByOwner() {
        when(redisTemplate.execute(eq(RedisSessionLockManager.RENEW_SCRIPT), eq(List.of(KEY)),
                eq("upgrade-a"), eq("1800000"))).thenReturn(1L);
        when(redisTemplate.execute(eq(RedisSessionLockManager.RENEW_SCRIPT), eq(List.of(KEY)),
                eq("upgrade-b"), eq("1800000"))).thenReturn(0L);

        assertTrue(locks.renew("edge", "upgrade-a", TTL));
        assertFalse(locks.renew("edge", "upgrade-b", TTL));
        assertFalse(locks.renew("edge", null, TTL));
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("持有者与占用状态读自 Redis")
    void holderAndIsHeld() {
        when(ops.get(KEY)).thenReturn("upgrade-a");
        when(redisTemplate.hasKey(KEY)).thenReturn(true);

        assertEquals("upgrade-a", locks.holder("edge"));
        assertTrue(locks.isHeld("edge"));
    }
}
