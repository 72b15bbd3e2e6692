package xyz.firestige.upgrade.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import xyz.firestige.upgrade.application.orchestration.SessionOutcome;
import xyz.firestige.upgrade.application.orchestration.UpgradeRequest;
import xyz.firestige.upgrade.application.orchestration.UpgradeResult;
import xyz.firestige.upgrade.domain.shared.exception.ErrorType;
import xyz.firestige.upgrade.domain.signature.VerificationReport;
import xyz.firestige.upgrade.facade.UpgradeFacade;
import xyz.firestige.upgrade.facade.exception.UpgradeOperationException;

import java.util.List;
import java.util.Optional;

/**
 * 命令行入口
 * <p>
 * 用法：
 * <pre>
 * upgrade  --version=2.0.0 [--strategy=parallel-cutover] [--dry-run] [--skip-backup]
 *          [--no-verify-signatures] [--timeout=600]
 * rollback [--session=...]
 * status   [--session=...]
 * cancel   --session=... [--operator=...]
 * abandon  --session=... [--operator=...]
 * reverify --session=...
 * prune
 * </pre>
 * 退出码：0 完成，1 已回滚，2 失败，3 需要人工介入，64 参数错误。
 */
@Component
@ConditionalOnProperty(prefix = "upgrade.cli", name = "enabled", havingValue = "true")
public class UpgradeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(UpgradeCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ROLLED_BACK = 1;
    static final int EXIT_FAILED = 2;
    static final int EXIT_MANUAL_INTERVENTION = 3;
    static final int EXIT_USAGE = 64;

    private final UpgradeFacade facade;
    private final ObjectMapper objectMapper;
    private volatile int exitCode = EXIT_OK;

    public UpgradeCommandRunner(UpgradeFacade facade, ObjectMapper objectMapper) {
        this.facade = facade;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            logger.error("[CLI] 缺少命令, 可用: upgrade / rollback / status / cancel / abandon / reverify / prune");
            exitCode = EXIT_USAGE;
            return;
        }
        String command = commands.get(0);
        try {
            exitCode = dispatch(command, args);
        } catch (IllegalArgumentException e) {
            logger.error("[CLI] 参数错误: {}", e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (UpgradeOperationException e) {
            logger.error("[CLI] 命令执行失败: {}, 原因: {}", command, e.getMessage());
            exitCode = e.getFailureInfo() != null && e.getFailureInfo().getErrorType() == ErrorType.VALIDATION_ERROR
                    ? EXIT_USAGE : EXIT_FAILED;
        }
    }

    int dispatch(String command, ApplicationArguments args) throws JsonProcessingException {
        switch (command) {
            case "upgrade":
                return report(facade.upgrade(toRequest(args)));
            case "rollback":
                return report(facade.rollback(option(args, "session")));
            case "status":
                print(facade.status(option(args, "session")));
                return EXIT_OK;
            case "cancel":
                facade.cancel(required(args, "session"), option(args, "operator").orElse("cli"));
                return EXIT_OK;
            case "abandon":
                print(facade.abandon(required(args, "session"), option(args, "operator").orElse("cli")));
                return EXIT_OK;
            case "reverify":
                VerificationReport report = facade.reverifySignatures(required(args, "session"));
                print(report);
                return report.allVerified() ? EXIT_OK : EXIT_FAILED;
            case "prune":
                logger.info("[CLI] 已清理 {} 条历史会话", facade.pruneHistory());
                return EXIT_OK;
            default:
                logger.error("[CLI] 未知命令: {}", command);
                return EXIT_USAGE;
        }
    }

    static UpgradeRequest toRequest(ApplicationArguments args) {
        UpgradeRequest request = new UpgradeRequest();
        request.setTargetVersion(option(args, "version").orElse(null));
        option(args, "strategy").ifPresent(request::setStrategy);
        request.setDryRun(args.containsOption("dry-run"));
        request.setSkipBackup(args.containsOption("skip-backup"));
        request.setVerifySignatures(!args.containsOption("no-verify-signatures"));
        option(args, "timeout").map(Integer::valueOf).ifPresent(request::setTimeoutSeconds);
        return request;
    }

    static int exitCodeOf(UpgradeResult result) {
        if (result.isManualInterventionRequired()) {
            return EXIT_MANUAL_INTERVENTION;
        }
        if (result.getOutcome() == SessionOutcome.COMPLETED) {
            return EXIT_OK;
        }
        return result.getOutcome() == SessionOutcome.ROLLED_BACK ? EXIT_ROLLED_BACK : EXIT_FAILED;
    }

    private int report(UpgradeResult result) throws JsonProcessingException {
        print(result);
        return exitCodeOf(result);
    }

    private void print(Object value) throws JsonProcessingException {
        System.out.println(objectMapper.writeValueAsString(value));
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    private static String required(ApplicationArguments args, String name) {
        return option(args, name).orElseThrow(() -> new IllegalArgumentException("缺少参数 --" + name));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
