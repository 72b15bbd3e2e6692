package xyz.firestige.upgrade.domain.signature;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 单个镜像的签名校验结果
 */
public record VerificationResult(String imageRef, boolean verified, String reason, LocalDateTime checkedAt) {

    public VerificationResult {
        Objects.requireNonNull(imageRef, "imageRef cannot be null");
        Objects.requireNonNull(checkedAt, "checkedAt cannot be null");
    }

    public static VerificationResult passed(String imageRef, String reason) {
        return new VerificationResult(imageRef, true, reason, LocalDateTime.now());
    }

    public static VerificationResult failed(String imageRef, String reason) {
        return new VerificationResult(imageRef, false, reason, LocalDateTime.now());
    }
}
