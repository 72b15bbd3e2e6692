package xyz.firestige.upgrade.application.orchestration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * 升级请求
 */
public class UpgradeRequest {

    @NotBlank(message = "目标版本不能为空")
    private String targetVersion;

    /**
     * parallel-cutover（默认）| sequential-replace
     */
    @Pattern(regexp = "parallel-cutover|sequential-replace|blue-green|rolling",
            message = "不支持的部署策略")
    private String strategy;

    private boolean dryRun;

    /**
     * 跳过备份（不推荐）
     */
    private boolean skipBackup;

    private boolean verifySignatures = true;

    /**
     * 每个阶段的时间预算，为空时使用配置的默认值
     */
    @Positive(message = "超时时间必须为正数")
    private Integer timeoutSeconds;

    public UpgradeRequest() {
    }

    public static UpgradeRequest of(String targetVersion) {
        UpgradeRequest request = new UpgradeRequest();
        request.setTargetVersion(targetVersion);
        return request;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public void setTargetVersion(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isSkipBackup() {
        return skipBackup;
    }

    public void setSkipBackup(boolean skipBackup) {
        this.skipBackup = skipBackup;
    }

    public boolean isVerifySignatures() {
        return verifySignatures;
    }

    public void setVerifySignatures(boolean verifySignatures) {
        this.verifySignatures = verifySignatures;
    }

    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(Integer timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String toString() {
        return "UpgradeRequest{" +
                "targetVersion='" + targetVersion + '\'' +
                ", strategy='" + strategy + '\'' +
                ", dryRun=" + dryRun +
                ", skipBackup=" + skipBackup +
                ", verifySignatures=" + verifySignatures +
                ", timeoutSeconds=" + timeoutSeconds +
                '}';
    }
}
