package xyz.firestige.upgrade.testutil;

import xyz.firestige.upgrade.domain.signature.ImageSignatureLookup;
import xyz.firestige.upgrade.domain.signature.SignatureLookupResult;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 可以挂起的签名查询，用于在签名校验阶段制造一个可观察的停顿
 */
public class GatedSignatureLookup implements ImageSignatureLookup {

    private final ImageSignatureLookup delegate;
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);

    public GatedSignatureLookup(ImageSignatureLookup delegate) {
        this.delegate = delegate;
    }

    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        CountDownLatch g = gate;
        if (g != null) {
            g.countDown();
        }
    }

    public boolean awaitEntered(long seconds) throws InterruptedException {
        return entered.await(seconds, TimeUnit.SECONDS);
    }

    @Override
    public SignatureLookupResult lookup(String imageRef, Duration timeout) {
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                g.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return delegate.lookup(imageRef, timeout);
    }
}
