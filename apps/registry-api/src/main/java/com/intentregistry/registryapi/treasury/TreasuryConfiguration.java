package com.intentregistry.registryapi.treasury;

import com.intentregistry.domain.treasury.ValueTransfer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TreasuryConfiguration {
  @Bean
  @ConditionalOnMissingBean(ValueTransfer.class)
  public ValueTransfer valueTransfer() {
    return new LoggingValueTransfer();
  }
}
