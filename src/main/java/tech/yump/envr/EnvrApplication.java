package tech.yump.envr;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.envr.config.EnvrProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(EnvrProperties.class)
public class EnvrApplication {

  public static void main(String[] args) {
    SpringApplication.run(EnvrApplication.class, args);
    log.info(">>> envr Application Started <<<");
  }
}
