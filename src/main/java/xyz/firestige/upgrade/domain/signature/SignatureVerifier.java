package xyz.firestige.upgrade.domain.signature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 镜像签名校验器
 * <p>
 * 职责：
 * <ul>
 *   <li>在有界线程池上并发校验每个镜像</li>
 *   <li>每个校验独立超时（从开始执行时起算），失败互不影响（不取消兄弟任务）</li>
 *   <li>汇总为 {@link VerificationReport}，全部通过才算通过</li>
 * </ul>
 * 校验只读，不修改任何部署状态；结果不做自动重试。
 */
public class SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final long QUEUE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ImageSignatureLookup lookup;
    private final ExecutorService executor;

    public SignatureVerifier(ImageSignatureLookup lookup, ExecutorService executor) {
        this.lookup = lookup;
        this.executor = executor;
    }

    /**
     * 并发校验一批镜像，整体等待上限按全部串行执行估算
     *
     * @param imageRefs       镜像引用列表
     * @param perCheckTimeout 每个镜像的校验预算
     * @return 与输入顺序一致的校验报告
     */
    public VerificationReport verifyAll(List<String> imageRefs, Duration perCheckTimeout) {
        Duration overall = perCheckTimeout.multipliedBy(Math.max(1, imageRefs.size())).plusSeconds(1);
        return verifyAll(imageRefs, perCheckTimeout, Deadline.after(overall));
    }

    /**
     * 并发校验一批镜像
     * <p>
     * 每个校验的预算从它真正开始执行时起算，在线程池中排队的时间不计入；
     * 排队和执行都受 {@code overall} 约束，到期仍未开始的校验判为未通过。
     *
     * @param imageRefs       镜像引用列表
     * @param perCheckTimeout 每个镜像的校验预算
     * @param overall         整批校验的截止时间（通常是阶段截止时间）
     * @return 与输入顺序一致的校验报告
     */
    public VerificationReport verifyAll(List<String> imageRefs, Duration perCheckTimeout, Deadline overall) {
        log.info("开始校验镜像签名, 数量: {}, 单镜像超时: {}s", imageRefs.size(), perCheckTimeout.toSeconds());

        List<TimedCheck> checks = new ArrayList<>();
        for (String ref : imageRefs) {
            TimedCheck check = new TimedCheck(ref);
            check.future = executor.submit(() -> {
                check.startedAt.set(System.nanoTime());
                return verifyOne(ref, perCheckTimeout);
            });
            checks.add(check);
        }

        List<VerificationResult> results = new ArrayList<>();
        for (TimedCheck check : checks) {
            results.add(await(check, perCheckTimeout, overall));
        }

        VerificationReport report = new VerificationReport(results);
        if (report.allVerified()) {
            log.info("镜像签名全部校验通过, 数量: {}", results.size());
        } else {
            log.error("镜像签名校验未通过, 失败镜像: {}", report.failedRefs());
        }
        return report;
    }

    private static final class TimedCheck {
        private final String imageRef;
        private final AtomicLong startedAt = new AtomicLong(NOT_STARTED);
        private Future<VerificationResult> future;

        private TimedCheck(String imageRef) {
            this.imageRef = imageRef;
        }
    }

    private VerificationResult verifyOne(String imageRef, Duration timeout) {
        try {
            SignatureLookupResult result = lookup.lookup(imageRef, timeout);
            return switch (result.status()) {
                case VERIFIED -> VerificationResult.passed(imageRef, result.detail());
                case UNVERIFIED -> VerificationResult.failed(imageRef, "签名未通过: " + result.detail());
                case UNKNOWN -> VerificationResult.failed(imageRef, "签名状态未知: " + result.detail());
            };
        } catch (TransparencyLogUnavailableException e) {
            log.error("透明日志不可达, image: {}, error: {}", imageRef, e.getMessage());
            return VerificationResult.failed(imageRef, "透明日志不可达: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("签名查询异常, image: {}, error: {}", imageRef, e.getMessage());
            return VerificationResult.failed(imageRef, "签名查询异常: " + e.getMessage());
        }
    }

    private VerificationResult await(TimedCheck check, Duration budget, Deadline overall) {
        Future<VerificationResult> future = check.future;
        try {
            while (true) {
                long started = check.startedAt.get();
                long overallNanos = overall.remaining().toNanos();
                if (started == NOT_STARTED) {
                    if (overallNanos <= 0) {
                        future.cancel(true);
                        log.warn("签名校验排队超过截止时间, image: {}", check.imageRef);
                        return VerificationResult.failed(check.imageRef, "校验未能在截止时间前开始");
                    }
                    try {
                        return future.get(Math.min(overallNanos, QUEUE_POLL_NANOS), TimeUnit.NANOSECONDS);
                    } catch (TimeoutException e) {
                        continue;
                    }
                }
                long checkNanos = started + budget.toNanos() - System.nanoTime();
                long waitNanos = Math.max(0L, Math.min(checkNanos, overallNanos));
                try {
                    return future.get(waitNanos, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("签名校验超时, image: {}, budget: {}s", check.imageRef, budget.toSeconds());
                    return VerificationResult.failed(check.imageRef, "校验超时（" + budget.toSeconds() + "s）");
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return VerificationResult.failed(check.imageRef, "签名查询异常: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return VerificationResult.failed(check.imageRef, "校验被中断");
        }
    }
}
