package xyz.firestige.upgrade.domain.signature;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;
import xyz.firestige.upgrade.infrastructure.signature.InMemorySignatureLookup;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SignatureVerifier 测试
 */
@DisplayName("镜像签名校验器测试")
class SignatureVerifierTest {

    private static final List<String> IMAGES = List.of(
            "registry.test/api:2.0.0", "registry.test/web:2.0.0", "registry.test/worker:2.0.0");

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("全部已签名时报告通过，结果顺序与输入一致")
    void allVerified() {
        SignatureVerifier verifier = new SignatureVerifier(new InMemorySignatureLookup(), executor);

        VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofSeconds(2));

        assertThat(report.allVerified()).isTrue();
        assertThat(report.results()).extracting(VerificationResult::imageRef).containsExactlyElementsOf(IMAGES);
        assertThat(report.failedRefs()).isEmpty();
    }

    @Test
    @DisplayName("单个镜像未签名不影响其他镜像的结果")
    void oneUnverified() {
        InMemorySignatureLookup lookup = new InMemorySignatureLookup();
        lookup.mark("registry.test/web:2.0.0", SignatureStatus.UNVERIFIED);
        lookup.mark("registry.test/worker:2.0.0", SignatureStatus.UNKNOWN);
        SignatureVerifier verifier = new SignatureVerifier(lookup, executor);

        VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofSeconds(2));

        assertThat(report.allVerified()).isFalse();
        assertThat(report.failedRefs()).containsExactly("registry.test/web:2.0.0", "registry.test/worker:2.0.0");
        assertThat(report.results().get(0).verified()).isTrue();
        assertThat(report.failureSummary())
                .contains("registry.test/web:2.0.0: 签名未通过")
                .contains("registry.test/worker:2.0.0: 签名状态未知");
    }

    @Test
    @DisplayName("透明日志不可达时所有镜像都判为未通过")
    void transparencyLogDown() {
        InMemorySignatureLookup lookup = new InMemorySignatureLookup();
        lookup.setTransparencyLogDown(true);
        SignatureVerifier verifier = new SignatureVerifier(lookup, executor);

        VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofSeconds(2));

        assertThat(report.results()).noneMatch(VerificationResult::verified);
        assertThat(report.results()).allMatch(r -> r.reason().startsWith("透明日志不可达"));
    }

    @Test
    @DisplayName("超时的镜像判为未通过，其余镜像照常完成")
    void slowLookupTimesOut() {
        ImageSignatureLookup slow = (imageRef, timeout) -> {
            if (imageRef.contains("web")) {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return SignatureLookupResult.verified("ok");
        };
        SignatureVerifier verifier = new SignatureVerifier(slow, executor);

        VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofMillis(300));

        assertThat(report.failedRefs()).containsExactly("registry.test/web:2.0.0");
        assertThat(report.results().get(1).reason()).startsWith("校验超时");
    }

    @Test
    @DisplayName("查询抛出异常时记录原因")
    void lookupThrows() {
        ImageSignatureLookup broken = (imageRef, timeout) -> {
            throw new IllegalStateException("registry 401");
        };
        SignatureVerifier verifier = new SignatureVerifier(broken, executor);

        VerificationReport report = verifier.verifyAll(List.of("registry.test/api:2.0.0"), Duration.ofSeconds(1));

        assertThat(report.results().get(0).reason()).isEqualTo("签名查询异常: registry 401");
    }

    @Test
    @DisplayName("镜像数超过并发度时，排队时间不计入单镜像预算")
    void queuedChecksGetTheirOwnBudget() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ImageSignatureLookup steady = (imageRef, timeout) -> {
                try {
                    Thread.sleep(600);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return SignatureLookupResult.verified("ok");
            };
            SignatureVerifier verifier = new SignatureVerifier(steady, single);

            VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofSeconds(1),
                    Deadline.after(Duration.ofSeconds(10)));

            assertThat(report.allVerified()).isTrue();
            assertThat(report.failedRefs()).isEmpty();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    @DisplayName("整批截止时间到期仍未开始的校验判为未通过")
    void checksNotStartedBeforeOverallDeadlineFail() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ImageSignatureLookup hanging = (imageRef, timeout) -> {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return SignatureLookupResult.verified("ok");
            };
            SignatureVerifier verifier = new SignatureVerifier(hanging, single);

            long begin = System.currentTimeMillis();
            VerificationReport report = verifier.verifyAll(IMAGES, Duration.ofSeconds(10),
                    Deadline.after(Duration.ofMillis(300)));

            assertThat(System.currentTimeMillis() - begin).isLessThan(3000);
            assertThat(report.allVerified()).isFalse();
            assertThat(report.results()).noneMatch(VerificationResult::verified);
        } finally {
            single.shutdownNow();
        }
    }
}
