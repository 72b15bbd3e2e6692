package xyz.firestige.upgrade.infrastructure.execution;

/**
 * 外部命令执行结果
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    /**
     * 失败时的简要描述，优先 stderr
     */
    public String failureMessage() {
        if (timedOut) {
            return "命令超时";
        }
        String text = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return "exit " + exitCode + (text == null || text.isBlank() ? "" : ": " + text.trim());
    }
}
