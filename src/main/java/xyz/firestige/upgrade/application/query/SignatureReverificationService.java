package xyz.firestige.upgrade.application.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.upgrade.application.state.SessionStateManager;
import xyz.firestige.upgrade.domain.release.ReleaseCatalog;
import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.session.UpdateSession;
import xyz.firestige.upgrade.domain.shared.exception.ValidationException;
import xyz.firestige.upgrade.domain.shared.vo.SessionId;
import xyz.firestige.upgrade.domain.signature.SignatureVerifier;
import xyz.firestige.upgrade.domain.signature.VerificationReport;

import java.time.Duration;

/**
 * 按需重新校验某个会话目标版本的镜像签名
 * <p>
 * 只返回新的报告，不修改会话记录中已保存的校验结果。
 */
public class SignatureReverificationService {

    private static final Logger log = LoggerFactory.getLogger(SignatureReverificationService.class);

    private final SessionStateManager stateManager;
    private final ReleaseCatalog catalog;
    private final SignatureVerifier verifier;
    private final Duration perCheckTimeout;

    public SignatureReverificationService(SessionStateManager stateManager,
                                          ReleaseCatalog catalog,
                                          SignatureVerifier verifier,
                                          Duration perCheckTimeout) {
        this.stateManager = stateManager;
        this.catalog = catalog;
        this.verifier = verifier;
        this.perCheckTimeout = perCheckTimeout;
    }

    public VerificationReport reverify(SessionId sessionId) {
        UpdateSession session = stateManager.get(sessionId);
        ReleaseManifest target = catalog.find(session.getTargetVersion())
                .orElseThrow(() -> new ValidationException("目标版本已不在版本目录中: " + session.getTargetVersion()));
        log.info("重新校验镜像签名, sessionId: {}, version: {}", sessionId, target.version());
        return verifier.verifyAll(target.imageRefs(), perCheckTimeout);
    }
}
