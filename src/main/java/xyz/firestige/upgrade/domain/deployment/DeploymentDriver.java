package xyz.firestige.upgrade.domain.deployment;

import xyz.firestige.upgrade.domain.release.ReleaseManifest;
import xyz.firestige.upgrade.domain.shared.vo.Deadline;

import java.util.List;

/**
 * 部署驱动：两种策略共用的契约
 * <p>
 * 驱动不会自行回滚；部署失败时抛出 {@link xyz.firestige.upgrade.domain.shared.exception.DeploymentException}，
 * 由编排器决定调用 {@link #rollback}。回滚所需的信息全部从 {@link #status()} 推导。
 */
public interface DeploymentDriver {

    DeploymentStrategyType strategy();

    /**
     * 演练模式下描述将要执行的动作
     */
    List<String> describePlan(ReleaseManifest source, ReleaseManifest target);

    /**
     * 把实例推进到目标版本
     *
     * @throws xyz.firestige.upgrade.domain.shared.exception.DeploymentException 任一实例失败
     */
    DeploymentOutcome deploy(ReleaseManifest target, Deadline deadline);

    /**
     * 驱动级回滚
     *
     * @param source 升级前版本清单
     * @throws xyz.firestige.upgrade.domain.shared.exception.RollbackException 无法恢复健康的旧状态，需要数据恢复
     */
    DeploymentOutcome rollback(ReleaseManifest source, Deadline deadline);

    /**
     * 数据恢复后重新部署源版本
     */
    DeploymentOutcome redeploy(ReleaseManifest source, Deadline deadline);

    /**
     * 收尾：并行切换释放旧代，顺序替换无额外动作；执行后不再自动回滚
     */
    DeploymentOutcome finalizeDeployment(ReleaseManifest target);

    /**
     * 当前实例状态，直接读自平台
     */
    List<DeploymentUnit> status();
}
