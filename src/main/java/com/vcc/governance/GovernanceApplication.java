package com.vcc.governance;

import com.vcc.governance.config.GovernanceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernanceApplication {
  public static void main(String[] args) {
    SpringApplication.run(GovernanceApplication.class, args);
  }
}
