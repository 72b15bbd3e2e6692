package xyz.firestige.upgrade.application.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.session.event.SessionPhaseChangedEvent;
import xyz.firestige.upgrade.domain.session.event.SessionStartedEvent;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.exception.SessionConflictException;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.infrastructure.lock.InMemorySessionLockManager;
import xyz.firestige.upgrade.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.upgrade.infrastructure.persistence.session.InMemorySessionRepository;
import xyz.firestige.upgrade.testutil.RecordingEventPublisher;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SessionStateManager 测试
 */
@DisplayName("会话状态管理器测试")
class SessionStateManagerTest {

    private static final String TARGET = "edge";

    private InMemorySessionRepository repository;
    private InMemorySessionLockManager locks;
    private RecordingEventPublisher events;
    private SessionStateManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository();
        locks = new InMemorySessionLockManager();
        events = new RecordingEventPublisher();
        manager = new SessionStateManager(repository, locks, events, new NoopMetricsRegistry(), Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("创建会话：获取锁、持久化并发布开始事件")
    void createAcquiresLockAndPersists() {
        UpdateSession session = newSession(false);

        manager.create(session);

        assertThat(locks.holder(TARGET)).isEqualTo(session.getSessionId().getValue());
        assertThat(repository.findById(session.getSessionId())).isPresent();
        assertThat(events.hasEvent(SessionStartedEvent.class)).isTrue();
        assertThat(session.getDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("锁被占用时立即失败，不写入记录")
    void createConflictsOnHeldLock() {
        UpdateSession first = newSession(false);
        manager.create(first);
        UpdateSession second = newSession(false);

        assertThatThrownBy(() -> manager.create(second))
                .isInstanceOf(SessionConflictException.class)
                .hasMessageContaining(first.getSessionId().getValue());
        assertThat(repository.findById(second.getSessionId())).isEmpty();
    }

    @Test
    @DisplayName("锁已丢失但存在未结束的记录时仍然冲突，并释放刚获取的锁")
    void createConflictsOnStaleRecord() {
        UpdateSession stale = newSession(false);
        repository.save(stale);
        UpdateSession next = newSession(false);

        assertThatThrownBy(() -> manager.create(next))
                .isInstanceOf(SessionConflictException.class)
                .hasMessageContaining(stale.getSessionId().getValue());
        assertThat(locks.isHeld(TARGET)).isFalse();
    }

    @Test
    @DisplayName("演练会话的记录不占用部署目标")
    void dryRunRecordDoesNotBlock() {
        repository.save(newSession(true));

        UpdateSession real = newSession(false);
        manager.create(real);

        assertThat(locks.holder(TARGET)).isEqualTo(real.getSessionId().getValue());
    }

    @Test
    @DisplayName("进入终态时释放锁")
    void terminalReleasesLock() {
        UpdateSession session = newSession(false);
        manager.create(session);
        manager.enterPhase(session, SessionPhase.VALIDATING);
        manager.appendPhase(session, SessionPhase.VALIDATING, PhaseOutcome.FAILURE, "unknown version");

        session.fail(FailureInfo.of(ErrorType.VALIDATION_ERROR, "unknown version"), false);
        manager.save(session);

        assertThat(locks.isHeld(TARGET)).isFalse();
        assertThat(manager.get(session.getSessionId()).getPhase()).isEqualTo(SessionPhase.FAILED);
        assertThat(events.getEventsOfType(SessionPhaseChangedEvent.class)).isNotEmpty();
    }

    @Test
    @DisplayName("按会话 ID 追加阶段结果")
    void appendPhaseById() {
        UpdateSession session = newSession(false);
        manager.create(session);

        UpdateSession updated = manager.appendPhase(session.getSessionId(), SessionPhase.VALIDATING,
                PhaseOutcome.SUCCESS, "ok");

        assertThat(updated.getPhase()).isEqualTo(SessionPhase.VALIDATING);
        assertThat(manager.get(session.getSessionId()).lastOutcomeOf(SessionPhase.VALIDATING))
                .isEqualTo(PhaseOutcome.SUCCESS);
    }

    @Test
    @DisplayName("latestNotCompleted 跳过已完成的会话")
    void latestNotCompletedSkipsCompleted() throws Exception {
        UpdateSession failed = newSession(false);
        failed.fail(FailureInfo.of(ErrorType.VALIDATION_ERROR, "x"), false);
        repository.save(failed);
        Thread.sleep(5);
        UpdateSession completed = completedSession();
        repository.save(completed);

        assertThat(manager.latest()).map(UpdateSession::getSessionId).contains(completed.getSessionId());
        assertThat(manager.latestNotCompleted()).map(UpdateSession::getSessionId).contains(failed.getSessionId());
    }

    @Test
    @DisplayName("latestNotCompleted 优先返回崩溃遗留的非终态会话，即使之后还有失败的会话")
    void latestNotCompletedPrefersNonTerminal() throws Exception {
        UpdateSession stale = newSession(false);
        stale.enterPhase(SessionPhase.VALIDATING);
        stale.enterPhase(SessionPhase.BACKING_UP);
        stale.enterPhase(SessionPhase.VERIFYING_SIGNATURES);
        stale.enterPhase(SessionPhase.DEPLOYING);
        repository.save(stale);
        Thread.sleep(5);
        UpdateSession rejected = terminalSession();

        assertThat(manager.latest()).map(UpdateSession::getSessionId).contains(rejected.getSessionId());
        assertThat(manager.latestNotCompleted()).map(UpdateSession::getSessionId).contains(stale.getSessionId());
    }

    @Test
    @DisplayName("放弃遗留会话后释放锁；已结束的会话不能放弃")
    void abandonReleasesLock() {
        UpdateSession session = newSession(false);
        manager.create(session);
        manager.enterPhase(session, SessionPhase.VALIDATING);

        UpdateSession abandoned = manager.abandon(session.getSessionId(), "alice");

        assertThat(abandoned.getPhase()).isEqualTo(SessionPhase.FAILED);
        assertThat(locks.isHeld(TARGET)).isFalse();
        assertThatThrownBy(() -> manager.abandon(session.getSessionId(), "alice"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("清理只删除最早的终态记录，保留进行中的会话")
    void pruneKeepsRecentTerminal() throws Exception {
        UpdateSession oldest = terminalSession();
        Thread.sleep(5);
        UpdateSession middle = terminalSession();
        Thread.sleep(5);
        UpdateSession newest = terminalSession();
        UpdateSession active = newSession(false);
        manager.create(active);

        int removed = manager.prune(2);

        assertThat(removed).isEqualTo(1);
        assertThat(repository.findById(oldest.getSessionId())).isEmpty();
        assertThat(repository.findById(middle.getSessionId())).isPresent();
        assertThat(repository.findById(newest.getSessionId())).isPresent();
        assertThat(repository.findById(active.getSessionId())).isPresent();
        assertThat(manager.prune(5)).isZero();
    }

    @Test
    @DisplayName("查询不存在的会话抛出校验异常")
    void getUnknownSession() {
        assertThatThrownBy(() -> manager.get(SessionId.of("upgrade-20200101000000-abcdef")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("会话不存在");
    }

    private UpdateSession terminalSession() {
        UpdateSession s = newSession(false);
        s.fail(FailureInfo.of(ErrorType.VALIDATION_ERROR, "x"), false);
        repository.save(s);
        return s;
    }

    private UpdateSession completedSession() {
        UpdateSession s = newSession(false);
        s.enterPhase(SessionPhase.VALIDATING);
        s.enterPhase(SessionPhase.BACKING_UP);
        s.enterPhase(SessionPhase.VERIFYING_SIGNATURES);
        s.enterPhase(SessionPhase.DEPLOYING);
        s.enterPhase(SessionPhase.HEALTH_CHECKING);
        s.enterPhase(SessionPhase.FINALIZING);
        s.complete();
        return s;
    }

    private static UpdateSession newSession(boolean dryRun) {
        ReleaseManifest source = new ReleaseManifest("1.0.0", Map.of("api", "registry.test/api:1.0.0"));
        return UpdateSession.start(SessionId.generate(), TARGET, DeploymentStrategyType.PARALLEL_CUTOVER, source,
                "2.0.0", dryRun, false, true, Duration.ofMinutes(5));
    }
}
