package xyz.firestige.upgrade.domain.signature;

import java.time.Duration;

/**
 * 镜像签名查询（外部协作方）
 * <p>
 * 只读操作，不得修改任何部署状态。
 */
public interface ImageSignatureLookup {

    /**
     * 查询镜像签名
     *
     * @param imageRef 镜像引用
     * @param timeout  单次查询超时
     * @return 查询结果
     * @throws TransparencyLogUnavailableException 透明日志不可达
     */
    SignatureLookupResult lookup(String imageRef, Duration timeout);
}
