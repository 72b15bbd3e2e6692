package xyz.firestige.upgrade.domain.signature;

/**
 * 签名查询结果
 */
public enum SignatureStatus {

    VERIFIED,

    UNVERIFIED,

    /**
     * 查询不到签名信息，按未通过处理
     */
    UNKNOWN
}
