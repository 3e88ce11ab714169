package win.ixuni.strontium.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import win.ixuni.strontium.core.config.StrontiumProperties;

/**
 * Strontium 服务器启动类
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.strontium.server")
@EnableConfigurationProperties(StrontiumProperties.class)
@EnableScheduling
public class StrontiumServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrontiumServerApplication.class, args);
    }
}
