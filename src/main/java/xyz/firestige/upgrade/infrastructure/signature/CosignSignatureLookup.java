package xyz.firestige.upgrade.infrastructure.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.domain.signature.ImageSignatureLookup;
import xyz.firestige.upgrade.domain.signature.SignatureLookupResult;
import xyz.firestige.upgrade.domain.signature.TransparencyLogUnavailableException;
import xyz.firestige.upgrade.infrastructure.execution.CommandExecutor;
import xyz.firestige.upgrade.infrastructure.execution.CommandResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 基于 cosign CLI 的签名查询
 * <p>
 * 默认无密钥模式：证书身份与 OIDC 签发方正则 + 透明日志；
 * 配置了公钥路径时改用密钥模式。
 * <p>
 * stderr 识别规则：
 * <ul>
 *   <li>没有匹配签名 → UNVERIFIED</li>
 *   <li>透明日志（rekor / tlog）连接类错误 → {@link TransparencyLogUnavailableException}</li>
 *   <li>镜像或清单不存在 → UNKNOWN</li>
 *   <li>其他非零退出 → UNVERIFIED</li>
 * </ul>
 */
public class CosignSignatureLookup implements ImageSignatureLookup {

    private static final Logger log = LoggerFactory.getLogger(CosignSignatureLookup.class);

    private static final Pattern NO_SIGNATURE = Pattern.compile("no matching signatures|no signatures found|signature mismatch");
    private static final Pattern TLOG = Pattern.compile("rekor|tlog|transparency log");
    private static final Pattern UNREACHABLE = Pattern.compile(
            "connection refused|no such host|i/o timeout|dial tcp|timeout|503|502|service unavailable|unreachable");
    private static final Pattern NOT_FOUND = Pattern.compile("manifest_unknown|manifest unknown|not found|name_unknown");

    private final CommandExecutor commandExecutor;
    private final ObjectMapper objectMapper;
    private final String cosignPath;
    private final boolean keyless;
    private final String publicKeyPath;
    private final String identityRegexp;
    private final String oidcIssuerRegexp;
    private final List<String> trustedSigners;

    public CosignSignatureLookup(CommandExecutor commandExecutor,
                                 ObjectMapper objectMapper,
                                 String cosignPath,
                                 boolean keyless,
                                 String publicKeyPath,
                                 String identityRegexp,
                                 String oidcIssuerRegexp,
                                 List<String> trustedSigners) {
        if (!keyless && (publicKeyPath == null || publicKeyPath.isBlank())) {
            throw new IllegalArgumentException("未启用无密钥模式时必须配置公钥路径");
        }
        this.commandExecutor = commandExecutor;
        this.objectMapper = objectMapper;
        this.cosignPath = cosignPath;
        this.keyless = keyless;
        this.publicKeyPath = publicKeyPath;
        this.identityRegexp = identityRegexp != null ? identityRegexp : ".*";
        this.oidcIssuerRegexp = oidcIssuerRegexp != null ? oidcIssuerRegexp : ".*";
        this.trustedSigners = trustedSigners != null ? trustedSigners : List.of();
    }

    @Override
    public SignatureLookupResult lookup(String imageRef, Duration timeout) {
        List<String> command = buildCommand(imageRef);
        CommandResult result = commandExecutor.execute(command, timeout);

        if (result.timedOut()) {
            return SignatureLookupResult.unknown("cosign 超时");
        }
        if (result.exitCode() == 0) {
            return SignatureLookupResult.verified(describe(result.stdout()));
        }

        String stderr = result.stderr() == null ? "" : result.stderr().trim();
        String lower = stderr.toLowerCase(Locale.ROOT);
        if (NO_SIGNATURE.matcher(lower).find()) {
            return SignatureLookupResult.unverified(stderr);
        }
        if (TLOG.matcher(lower).find() && UNREACHABLE.matcher(lower).find()) {
            throw new TransparencyLogUnavailableException(stderr);
        }
        if (NOT_FOUND.matcher(lower).find()) {
            return SignatureLookupResult.unknown(stderr);
        }
        log.debug("cosign 返回非零退出码, image: {}, code: {}", imageRef, result.exitCode());
        return SignatureLookupResult.unverified(result.failureMessage());
    }

    List<String> buildCommand(String imageRef) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cosignPath);
        cmd.add("verify");
        if (keyless) {
            cmd.add("--certificate-identity-regexp");
            cmd.add(identityRegexp);
            cmd.add("--certificate-oidc-issuer-regexp");
            cmd.add(oidcIssuerRegexp);
        } else {
            cmd.add("--key");
            cmd.add(publicKeyPath);
        }
        for (String signer : trustedSigners) {
            cmd.add("--certificate-identity");
            cmd.add(signer);
        }
        cmd.add("--output");
        cmd.add("json");
        cmd.add(imageRef);
        return cmd;
    }

    private String describe(String stdout) {
        String method = keyless ? "keyless" : "key-based";
        try {
            JsonNode node = objectMapper.readTree(stdout);
            int count = node != null && node.isArray() ? node.size() : 1;
            return method + ", signatures: " + count;
        } catch (JsonProcessingException e) {
            // 退出码为 0 时输出不可解析也视为通过
            return method;
        }
    }
}
