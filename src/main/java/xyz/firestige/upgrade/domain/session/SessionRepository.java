package xyz.firestige.upgrade.domain.session;

import xyz.firestige.upgrade.domain.shared.vo.SessionId;

import java.util.List;
import java.util.Optional;

/**
 * 升级会话仓储
 * <p>
 * save 必须是原子替换：读到的记录要么是旧值，要么是新值。
 */
public interface SessionRepository {

    void save(UpdateSession session);

    Optional<UpdateSession> findById(SessionId sessionId);

    /**
     * 按开始时间升序返回全部会话
     */
    List<UpdateSession> findAll();

    void delete(SessionId sessionId);
}
