package xyz.firestige.upgrade.domain.signature;

/**
 * 单次签名查询的结果及说明
 */
public record SignatureLookupResult(SignatureStatus status, String detail) {

    public static SignatureLookupResult verified(String detail) {
        return new SignatureLookupResult(SignatureStatus.VERIFIED, detail);
    }

    public static SignatureLookupResult unverified(String detail) {
        return new SignatureLookupResult(SignatureStatus.UNVERIFIED, detail);
    }

    public static SignatureLookupResult unknown(String detail) {
        return new SignatureLookupResult(SignatureStatus.UNKNOWN, detail);
    }
}
