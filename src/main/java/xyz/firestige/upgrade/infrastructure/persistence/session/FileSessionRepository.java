package xyz.firestige.upgrade.infrastructure.persistence.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.session.SessionRepository;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 基于文件的会话仓储：每个会话一个 JSON 文件
 * <p>
 * 写入流程：同目录临时文件 → fsync → 原子 rename 覆盖，读者只会看到旧值或新值。
 */
public class FileSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSessionRepository.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSessionRepository(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建会话目录: " + directory, e);
        }
    }

    @Override
    public void save(UpdateSession session) {
        Path target = fileOf(session.getSessionId());
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, "." + session.getSessionId().getValue(), ".tmp");
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(SessionDocumentMapper.toDocument(session));
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ch.write(ByteBuffer.wrap(json));
                ch.force(true);
            }
            move(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("写入会话记录失败: " + target, e);
        }
    }

    @Override
    public Optional<UpdateSession> findById(SessionId sessionId) {
        Path file = fileOf(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public List<UpdateSession> findAll() {
        List<UpdateSession> sessions = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "upgrade-*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    sessions.add(read(file));
                } catch (UncheckedIOException | IllegalArgumentException e) {
                    log.warn("会话记录无法解析，已忽略: {}, error: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("读取会话目录失败: " + directory, e);
        }
        sessions.sort(Comparator.comparing(UpdateSession::getStartedAt)
                .thenComparing(s -> s.getSessionId().getValue()));
        return sessions;
    }

    @Override
    public void delete(SessionId sessionId) {
        try {
            Files.deleteIfExists(fileOf(sessionId));
        } catch (IOException e) {
            throw new UncheckedIOException("删除会话记录失败: " + sessionId, e);
        }
    }

    private UpdateSession read(Path file) {
        try {
            SessionDocument doc = mapper.readValue(file.toFile(), SessionDocument.class);
            return SessionDocumentMapper.toDomain(doc);
        } catch (IOException e) {
            throw new UncheckedIOException("读取会话记录失败: " + file, e);
        }
    }

    private Path fileOf(SessionId sessionId) {
        return directory.resolve(sessionId.getValue() + SUFFIX);
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("文件系统不支持原子 rename，退化为普通替换: {}", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("清理临时文件失败: {}, error: {}", p, e.getMessage());
        }
    }
}
