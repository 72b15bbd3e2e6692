package xyz.firestige.upgrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 升级编排引擎启动类
 * <p>
 * upgrade.cli.enabled=true 时按命令行参数执行一次操作后退出，退出码见 UpgradeCommandRunner。
 */
@SpringBootApplication
public class UpgradeOrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(UpgradeOrchestratorApplication.class, args);
        if (context.getEnvironment().getProperty("upgrade.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
