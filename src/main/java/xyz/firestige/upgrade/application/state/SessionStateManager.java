package xyz.firestige.upgrade.application.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.SessionRepository;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.session.event.SessionEvent;
import xyz.firestige.upgrade.domain.shared.event.DomainEventPublisher;
import xyz.firestige.upgrade.domain.shared.exception.SessionConflictException;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.infrastructure.lock.SessionLockManager;
import xyz.firestige.upgrade.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.upgrade.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 会话状态管理器
 * <p>
 * 职责：
 * 1. 会话排他：部署目标锁 + 持久化记录中的未结束会话检查，冲突立即失败，不排队
 * 2. 先落盘再执行：阶段变更先持久化，再由编排器执行该阶段的工作
 * 3. 持久化成功后发布聚合收集的领域事件
 * 4. 会话进入终态或被放弃时释放锁
 */
public class SessionStateManager {

    private static final Logger log = LoggerFactory.getLogger(SessionStateManager.class);

    private final SessionRepository repository;
    private final SessionLockManager lockManager;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final Duration lockTtl;

    public SessionStateManager(SessionRepository repository,
                               SessionLockManager lockManager,
                               DomainEventPublisher eventPublisher,
                               MetricsRegistry metrics,
                               Duration lockTtl) {
        this.repository = repository;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.lockTtl = lockTtl;
    }

    /**
     * 创建会话：获取部署目标锁并写入第一条记录
     *
     * @throws SessionConflictException 锁已被占用，或存在未结束的会话记录
     */
    public void create(UpdateSession session) {
        String target = session.getDeploymentTarget();
        String id = session.getSessionId().getValue();
        if (!lockManager.tryAcquire(target, id, lockTtl)) {
            String holder = lockManager.holder(target);
            log.warn("部署目标已被锁定, target: {}, holder: {}", target, holder);
            throw new SessionConflictException(
                    String.format("部署目标 %s 已有进行中的会话: %s", target, holder), holder);
        }
        try {
            assertNoActiveSession(target, session.getSessionId());
            persist(session);
        } catch (RuntimeException e) {
            lockManager.release(target, id);
            throw e;
        }
        metrics.incrementCounter("upgrade_session_started", "strategy", session.getStrategy().getWireName());
        if (!session.isDryRun()) {
            metrics.setGauge("upgrade_session_active", 1, "target", target);
        }
        log.info("会话已创建, sessionId: {}, target: {}, {} -> {}", id, target,
                session.getSourceVersion(), session.getTargetVersion());
    }

    /**
     * 检查持久化记录中是否存在占用该目标的其他会话（崩溃后遗留的非终态记录也算）
     *
     * @throws SessionConflictException 存在未结束的会话
     */
    public void assertNoActiveSession(String target, SessionId self) {
        for (UpdateSession s : repository.findAll()) {
            if (s.holdsTarget() && s.getDeploymentTarget().equals(target) && !s.getSessionId().equals(self)) {
                throw new SessionConflictException(String.format(
                        "部署目标 %s 存在未结束的会话 %s（阶段: %s），请先回滚或放弃该会话",
                        target, s.getSessionId(), s.getPhase()), s.getSessionId().getValue());
            }
        }
    }

    /**
     * 进入新阶段并立即落盘
     */
    public void enterPhase(UpdateSession session, SessionPhase phase) {
        session.enterPhase(phase);
        persist(session);
        lockManager.renew(session.getDeploymentTarget(), session.getSessionId().getValue(), lockTtl);
        log.info("进入阶段, sessionId: {}, phase: {}", session.getSessionId(), phase);
    }

    /**
     * 追加阶段结果；会话不在该阶段时先推进到该阶段
     */
    public void appendPhase(UpdateSession session, SessionPhase phase, PhaseOutcome outcome, String detail) {
        if (session.getPhase() != phase) {
            session.enterPhase(phase);
        }
        session.recordOutcome(outcome, detail);
        persist(session);
        log.info("阶段结束, sessionId: {}, phase: {}, outcome: {}, detail: {}",
                session.getSessionId(), phase, outcome, detail);
    }

    /**
     * 按会话 ID 追加阶段结果
     */
    public UpdateSession appendPhase(SessionId sessionId, SessionPhase phase, PhaseOutcome outcome, String detail) {
        UpdateSession session = get(sessionId);
        appendPhase(session, phase, outcome, detail);
        return session;
    }

    /**
     * 持久化会话并发布领域事件；终态时释放锁
     */
    public void save(UpdateSession session) {
        persist(session);
    }

    public UpdateSession get(SessionId sessionId) {
        return repository.findById(sessionId)
                .orElseThrow(() -> new ValidationException("会话不存在: " + sessionId));
    }

    public Optional<UpdateSession> find(SessionId sessionId) {
        return repository.findById(sessionId);
    }

    public List<UpdateSession> listActive() {
        return repository.findAll().stream()
                .filter(s -> !s.isTerminal())
                .collect(Collectors.toList());
    }

    public Optional<UpdateSession> latest() {
        List<UpdateSession> all = repository.findAll();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    /**
     * 最近一个未完成的会话：优先取最近的非终态会话（崩溃遗留），没有时取最近一个未以 COMPLETED 结束的会话
     */
    public Optional<UpdateSession> latestNotCompleted() {
        List<UpdateSession> all = repository.findAll();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (!all.get(i).isTerminal()) {
                return Optional.of(all.get(i));
            }
        }
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).getPhase() != SessionPhase.COMPLETED) {
                return Optional.of(all.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * 操作员放弃崩溃后遗留的会话
     */
    public UpdateSession abandon(SessionId sessionId, String operator) {
        UpdateSession session = get(sessionId);
        if (session.isTerminal()) {
            throw new ValidationException(String.format("会话已结束，无需放弃, sessionId: %s, phase: %s",
                    sessionId, session.getPhase()));
        }
        session.abandon(operator);
        persist(session);
        log.warn("会话已被放弃, sessionId: {}, operator: {}, 需要人工介入: {}",
                sessionId, operator, session.isManualInterventionRequired());
        return session;
    }

    /**
     * 释放部署目标锁（演练会话在预检后调用）
     */
    public void releaseLock(UpdateSession session) {
        lockManager.release(session.getDeploymentTarget(), session.getSessionId().getValue());
    }

    /**
     * 为遗留会话重新获取锁（手动回滚前调用）
     *
     * @throws SessionConflictException 锁被其他会话持有
     */
    public void reacquire(UpdateSession session) {
        String target = session.getDeploymentTarget();
        String id = session.getSessionId().getValue();
        if (lockManager.tryAcquire(target, id, lockTtl)) {
            return;
        }
        String holder = lockManager.holder(target);
        if (!id.equals(holder)) {
            throw new SessionConflictException(
                    String.format("部署目标 %s 的锁被其他会话持有: %s", target, holder), holder);
        }
    }

    /**
     * 保留最近 keep 条终态记录，删除更早的
     *
     * @return 删除的记录数
     */
    public int prune(int keep) {
        List<UpdateSession> terminal = new ArrayList<>();
        for (UpdateSession s : repository.findAll()) {
            if (s.isTerminal()) {
                terminal.add(s);
            }
        }
        int excess = terminal.size() - Math.max(0, keep);
        for (int i = 0; i < excess; i++) {
            repository.delete(terminal.get(i).getSessionId());
            log.info("清理历史会话记录, sessionId: {}", terminal.get(i).getSessionId());
        }
        return Math.max(0, excess);
    }

    private void persist(UpdateSession session) {
        repository.save(session);
        List<SessionEvent> events = new ArrayList<>(session.getDomainEvents());
        session.clearDomainEvents();
        eventPublisher.publishAll(events);
        if (session.isTerminal()) {
            lockManager.release(session.getDeploymentTarget(), session.getSessionId().getValue());
            countTerminal(session);
        }
    }

    private void countTerminal(UpdateSession session) {
        String strategy = session.getStrategy().getWireName();
        switch (session.getPhase()) {
            case COMPLETED -> metrics.incrementCounter("upgrade_session_completed", "strategy", strategy);
            case ROLLED_BACK -> metrics.incrementCounter("upgrade_session_rolled_back", "strategy", strategy);
            case FAILED -> metrics.incrementCounter(session.isManualInterventionRequired()
                    ? "upgrade_session_critical" : "upgrade_session_failed", "strategy", strategy);
            default -> { }
        }
        if (session.getFinishedAt() != null) {
            metrics.recordDuration("upgrade_session_duration",
                    Duration.between(session.getStartedAt(), session.getFinishedAt()),
                    "outcome", session.getPhase().name());
        }
        if (!session.isDryRun()) {
            metrics.setGauge("upgrade_session_active", 0, "target", session.getDeploymentTarget());
        }
    }
}
