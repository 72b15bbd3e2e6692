package xyz.firestige.upgrade.infrastructure.persistence.session;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.upgrade.domain.backup.BackupRecord;
import xyz.firestige.upgrade.domain.deployment.DeploymentStrategyType;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.PhaseOutcome;
import xyz.firestige.upgrade.domain.session.SessionPhase;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.shared.exception.FailureInfo;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.domain.signature.VerificationResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FileSessionRepository 测试
 */
@DisplayName("文件会话仓储测试")
class FileSessionRepositoryTest {

    @TempDir
    Path dir;

    private FileSessionRepository repository;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        repository = new FileSessionRepository(dir, mapper);
    }

    @Test
    @DisplayName("保存后重新读取，聚合字段完整")
    void savesAndReloadsFullSession() {
        // Given
        UpdateSession session = newSession(DeploymentStrategyType.SEQUENTIAL_REPLACE);
        session.enterPhase(SessionPhase.VALIDATING);
        session.recordOutcome(PhaseOutcome.SUCCESS, "ok");
        session.enterPhase(SessionPhase.BACKING_UP);
        BackupRecord backup = new BackupRecord("db-1", "db", dir.resolve("db-1").toString(), "abc123", 42,
                LocalDateTime.now(), "pre-upgrade");
        session.attachBackups(List.of(backup));
        session.recordVerificationResults(List.of(VerificationResult.failed("registry.test/api:2.0.0", "no signature")));
        session.fail(FailureInfo.of(ErrorType.VERIFICATION_ERROR, "signature", "VERIFYING_SIGNATURES"), false);

        // When
        repository.save(session);
        UpdateSession loaded = repository.findById(session.getSessionId()).orElseThrow();

        // Then
        assertThat(loaded.getPhase()).isEqualTo(SessionPhase.FAILED);
        assertThat(loaded.getStrategy()).isEqualTo(DeploymentStrategyType.SEQUENTIAL_REPLACE);
        assertThat(loaded.getPhaseHistory()).isEqualTo(session.getPhaseHistory());
        assertThat(loaded.getBackupRefs()).containsExactly(backup);
        assertThat(loaded.getRollbackPoint().source().imageOf("api")).isEqualTo("registry.test/api:1.0.0");
        assertThat(loaded.getRollbackPoint().backupRefs()).containsExactly(backup);
        assertThat(loaded.getVerificationResults().get("registry.test/api:2.0.0").verified()).isFalse();
        assertThat(loaded.getFailureInfo().getErrorType()).isEqualTo(ErrorType.VERIFICATION_ERROR);
        assertThat(loaded.getPhaseTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(loaded.getFinishedAt()).isNotNull();
    }

    @Test
    @DisplayName("存储结构改动标记与升级前在线实例数随会话持久化")
    void persistsDataMigratedAndUnitCounts() {
        UpdateSession session = UpdateSession.start(SessionId.generate(), "edge", DeploymentStrategyType.PARALLEL_CUTOVER,
                new ReleaseManifest("1.0.0", Map.of("api", "registry.test/api:1.0.0")), Map.of("api", 2),
                "2.0.0", false, false, true, Duration.ofMinutes(5));
        for (SessionPhase p : List.of(SessionPhase.VALIDATING, SessionPhase.BACKING_UP,
                SessionPhase.VERIFYING_SIGNATURES, SessionPhase.DEPLOYING)) {
            session.enterPhase(p);
        }
        session.markDataMigrated();

        repository.save(session);
        UpdateSession loaded = repository.findById(session.getSessionId()).orElseThrow();

        assertThat(loaded.isDataMigrated()).isTrue();
        assertThat(loaded.getRollbackPoint().unitCounts()).containsExactly(Map.entry("api", 2));
    }

    @Test
    @DisplayName("覆盖写入不留下临时文件")
    void overwriteLeavesNoTempFiles() throws Exception {
        UpdateSession session = newSession(DeploymentStrategyType.PARALLEL_CUTOVER);
        repository.save(session);
        session.enterPhase(SessionPhase.VALIDATING);
        repository.save(session);

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly(session.getSessionId().getValue() + ".json");
        }
        assertThat(repository.findById(session.getSessionId()).orElseThrow().getPhase())
                .isEqualTo(SessionPhase.VALIDATING);
    }

    @Test
    @DisplayName("findAll 按开始时间升序，跳过损坏的记录")
    void findAllSkipsCorruptRecords() throws Exception {
        UpdateSession first = newSession(DeploymentStrategyType.PARALLEL_CUTOVER);
        Thread.sleep(5);
        UpdateSession second = newSession(DeploymentStrategyType.PARALLEL_CUTOVER);
        repository.save(second);
        repository.save(first);
        Files.writeString(dir.resolve("upgrade-20200101000000-broken.json"), "{not json", StandardCharsets.UTF_8);

        List<UpdateSession> all = repository.findAll();

        assertThat(all).extracting(UpdateSession::getSessionId)
                .containsExactly(first.getSessionId(), second.getSessionId());
    }

    @Test
    @DisplayName("删除后查不到，重复删除不报错")
    void deleteIsIdempotent() {
        UpdateSession session = newSession(DeploymentStrategyType.PARALLEL_CUTOVER);
        repository.save(session);

        repository.delete(session.getSessionId());
        repository.delete(session.getSessionId());

        assertThat(repository.findById(session.getSessionId())).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }

    private static UpdateSession newSession(DeploymentStrategyType strategy) {
        ReleaseManifest source = new ReleaseManifest("1.0.0", Map.of("api", "registry.test/api:1.0.0"));
        return UpdateSession.start(SessionId.generate(), "edge", strategy, source, "2.0.0",
                false, false, true, Duration.ofMinutes(5));
    }
}
