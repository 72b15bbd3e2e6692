package xyz.firestige.upgrade.domain.signature;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一批镜像的签名校验报告
 */
public record VerificationReport(List<VerificationResult> results) {

    public VerificationReport {
        results = List.copyOf(results);
    }

    /**
     * 全部通过才允许会话继续
     */
    public boolean allVerified() {
        return results.stream().allMatch(VerificationResult::verified);
    }

    public List<String> failedRefs() {
        return results.stream()
                .filter(r -> !r.verified())
                .map(VerificationResult::imageRef)
                .collect(Collectors.toList());
    }

    /**
     * 失败明细，逐条原样列出
     */
    public String failureSummary() {
        return results.stream()
                .filter(r -> !r.verified())
                .map(r -> r.imageRef() + ": " + r.reason())
                .collect(Collectors.joining("; "));
    }
}
