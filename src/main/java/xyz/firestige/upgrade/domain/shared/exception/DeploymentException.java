package xyz.firestige.upgrade.domain.shared.exception;

/**
 * 部署异常，编排器收到后进入回滚分支
 */
public class DeploymentException extends UpgradeException {

    public DeploymentException(String message) {
        super(ErrorType.DEPLOYMENT_ERROR, message);
    }

    public DeploymentException(String message, Throwable cause) {
        super(ErrorType.DEPLOYMENT_ERROR, message, cause);
    }
}
