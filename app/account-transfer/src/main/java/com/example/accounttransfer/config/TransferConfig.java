package com.example.accounttransfer.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TransferProperties.class)
public class TransferConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
