package xyz.firestige.upgrade.infrastructure.signature;

import xyz.firestige.upgrade.domain.signature.ImageSignatureLookup;
import xyz.firestige.upgrade.domain.signature.SignatureLookupResult;
import xyz.firestige.upgrade.domain.signature.SignatureStatus;
import xyz.firestige.upgrade.domain.signature.TransparencyLogUnavailableException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存签名查询（模拟模式 / 测试）
 * <p>
 * 默认所有镜像都已签名；可以逐个镜像改写结果，或模拟透明日志不可达。
 */
public class InMemorySignatureLookup implements ImageSignatureLookup {

    private final Map<String, SignatureStatus> overrides = new ConcurrentHashMap<>();
    private volatile boolean transparencyLogDown;

    @Override
    public SignatureLookupResult lookup(String imageRef, Duration timeout) {
        if (transparencyLogDown) {
            throw new TransparencyLogUnavailableException("rekor: connection refused");
        }
        SignatureStatus status = overrides.getOrDefault(imageRef, SignatureStatus.VERIFIED);
        return new SignatureLookupResult(status, "simulated");
    }

    public void mark(String imageRef, SignatureStatus status) {
        overrides.put(imageRef, status);
    }

    public void setTransparencyLogDown(boolean down) {
        this.transparencyLogDown = down;
    }

    public void reset() {
        overrides.clear();
        transparencyLogDown = false;
    }
}
