package xyz.firestige.upgrade.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于文件锁的会话锁（单机默认实现）
 * <p>
 * 锁文件 {lockDir}/{target}.lock 由操作系统咨询锁保护，进程崩溃时锁自动释放；
 * 文件内容是持有者的 sessionId，仅用于排查。锁文件本身不删除。
 */
public class FileSessionLockManager implements SessionLockManager {

    private static final Logger log = LoggerFactory.getLogger(FileSessionLockManager.class);

    private final Path lockDir;
    private final Map<String, Held> held = new ConcurrentHashMap<>();

    private record Held(String sessionId, FileChannel channel, FileLock lock) {
    }

    public FileSessionLockManager(Path lockDir) {
        this.lockDir = lockDir;
        try {
            Files.createDirectories(lockDir);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建锁目录: " + lockDir, e);
        }
    }

    @Override
    public synchronized boolean tryAcquire(String target, String sessionId, Duration ttl) {
        if (held.containsKey(target)) {
            return false;
        }
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile(target), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                return false;
            }
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(sessionId.getBytes(StandardCharsets.UTF_8)));
            channel.force(false);
            held.put(target, new Held(sessionId, channel, lock));
            log.info("已获取会话锁, target: {}, sessionId: {}", target, sessionId);
            return true;
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            return false;
        } catch (IOException e) {
            closeQuietly(channel);
            throw new UncheckedIOException("获取会话锁失败: " + target, e);
        }
    }

    @Override
    public synchronized void release(String target, String sessionId) {
        Held h = held.get(target);
        if (h == null || !h.sessionId().equals(sessionId)) {
            return;
        }
        held.remove(target);
        try {
            h.lock().release();
        } catch (IOException e) {
            log.warn("释放文件锁失败, target: {}, error: {}", target, e.getMessage());
        } finally {
            closeQuietly(h.channel());
        }
        log.info("已释放会话锁, target: {}, sessionId: {}", target, sessionId);
    }

    @Override
    public synchronized boolean isHeld(String target) {
        if (held.containsKey(target)) {
            return true;
        }
        Path file = lockFile(target);
        if (!Files.exists(file)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            FileLock probe = channel.tryLock();
            if (probe == null) {
                return true;
            }
            probe.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("检查会话锁失败: " + target, e);
        }
    }

    @Override
    public String holder(String target) {
        Held h = held.get(target);
        if (h != null) {
            return h.sessionId();
        }
        Path file = lockFile(target);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? null : content;
        } catch (IOException e) {
            return null;
        }
    }

    private Path lockFile(String target) {
        return lockDir.resolve(target + ".lock");
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("关闭锁文件失败: {}", e.getMessage());
        }
    }
}
