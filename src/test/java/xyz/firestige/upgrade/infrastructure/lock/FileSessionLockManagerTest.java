package xyz.firestige.upgrade.infrastructure.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileSessionLockManager 测试
 */
@DisplayName("文件会话锁测试")
class FileSessionLockManagerTest {

    private static final Duration TTL = Duration.ofMinutes(1);

    @TempDir
    Path lockDir;

    @Test
    @DisplayName("同一目标只能被一个会话持有，释放后可重新获取")
    void exclusiveAcquire() {
        FileSessionLockManager locks = new FileSessionLockManager(lockDir);

        assertTrue(locks.tryAcquire("edge", "upgrade-a", TTL));
        assertFalse(locks.tryAcquire("edge", "upgrade-b", TTL));
        assertTrue(locks.isHeld("edge"));
        assertEquals("upgrade-a", locks.holder("edge"));

        locks.release("edge", "upgrade-a");

        assertFalse(locks.isHeld("edge"));
        assertTrue(locks.tryAcquire("edge", "upgrade-b", TTL));
        assertEquals("upgrade-b", locks.holder("edge"));
        locks.release("edge", "upgrade-b");
    }

    @Test
    @DisplayName("非持有者释放不生效")
    void releaseByNonHolderIgnored() {
        FileSessionLockManager locks = new FileSessionLockManager(lockDir);
        locks.tryAcquire("edge", "upgrade-a", TTL);

        locks.release("edge", "upgrade-b");

        assertTrue(locks.isHeld("edge"));
        locks.release("edge", "upgrade-a");
    }

    @Test
    @DisplayName("不同目标互不影响")
    void targetsAreIndependent() {
        FileSessionLockManager locks = new FileSessionLockManager(lockDir);

        assertTrue(locks.tryAcquire("edge", "upgrade-a", TTL));
        assertTrue(locks.tryAcquire("core", "upgrade-b", TTL));

        locks.release("edge", "upgrade-a");
        locks.release("core", "upgrade-b");
    }

    @Test
    @DisplayName("另一个管理器实例看到文件锁已被占用，并能读出持有者")
    void secondManagerSeesLock() {
        FileSessionLockManager first = new FileSessionLockManager(lockDir);
        FileSessionLockManager second = new FileSessionLockManager(lockDir);
        first.tryAcquire("edge", "upgrade-a", TTL);

        assertFalse(second.tryAcquire("edge", "upgrade-b", TTL));
        assertTrue(second.isHeld("edge"));
        assertEquals("upgrade-a", second.holder("edge"));

        first.release("edge", "upgrade-a");
        assertTrue(second.tryAcquire("edge", "upgrade-b", TTL));
        second.release("edge", "upgrade-b");
    }
}
