package com.intentregistry.registryapi.store;

import com.intentregistry.registryapi.config.RegistryProperties;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class KeyValueStoreConfiguration {
  private static final Logger log = LoggerFactory.getLogger(KeyValueStoreConfiguration.class);

  @Bean
  @ConditionalOnProperty(
      prefix = "registry.store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public KeyValueStore inMemoryKeyValueStore() {
    log.info("Registry store type=memory");
    return new InMemoryKeyValueStore();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "registry.store", name = "type", havingValue = "jdbc")
  static class JdbcStoreConfiguration {
    @Bean
    public DataSource registryDataSource(RegistryProperties properties) {
      RegistryProperties.Jdbc jdbc = properties.getStore().getJdbc();
      return DataSourceBuilder.create()
          .url(jdbc.getUrl())
          .username(jdbc.getUsername())
          .password(jdbc.getPassword())
          .build();
    }

    @Bean
    public KeyValueStore jdbcKeyValueStore(DataSource registryDataSource) {
      Flyway.configure()
          .dataSource(registryDataSource)
          .locations("classpath:db/migration")
          .load()
          .migrate();
      log.info("Registry store type=jdbc migrated=true");
      return new JdbcKeyValueStore(
          new JdbcTemplate(registryDataSource),
          new TransactionTemplate(new DataSourceTransactionManager(registryDataSource)));
    }
  }
}
