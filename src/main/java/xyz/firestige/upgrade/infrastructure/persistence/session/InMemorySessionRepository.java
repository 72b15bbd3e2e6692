package xyz.firestige.upgrade.infrastructure.persistence.session;

import xyz.firestige.upgrade.domain.session.SessionRepository;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存会话仓储（测试）
 * <p>
 * 保存的是文档快照，读出时重建聚合，与文件实现的语义一致。
 */
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, SessionDocument> store = new ConcurrentHashMap<>();

    @Override
    public void save(UpdateSession session) {
        store.put(session.getSessionId().getValue(), SessionDocumentMapper.toDocument(session));
    }

    @Override
    public Optional<UpdateSession> findById(SessionId sessionId) {
        SessionDocument doc = store.get(sessionId.getValue());
        return doc == null ? Optional.empty() : Optional.of(SessionDocumentMapper.toDomain(doc));
    }

    @Override
    public List<UpdateSession> findAll() {
        return store.values().stream()
                .map(SessionDocumentMapper::toDomain)
                .sorted(Comparator.comparing(UpdateSession::getStartedAt)
                        .thenComparing(s -> s.getSessionId().getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public void delete(SessionId sessionId) {
        store.remove(sessionId.getValue());
    }
}
