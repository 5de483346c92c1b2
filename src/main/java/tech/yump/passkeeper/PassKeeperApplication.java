package tech.yump.passkeeper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.passkeeper.config.PassKeeperProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(PassKeeperProperties.class)
public class PassKeeperApplication {

  public static void main(String[] args) {
    SpringApplication.run(PassKeeperApplication.class, args);
    log.info(">>> PassKeeper Application Started <<<");
  }
}
