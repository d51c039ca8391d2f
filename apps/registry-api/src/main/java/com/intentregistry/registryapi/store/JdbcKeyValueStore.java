package com.intentregistry.registryapi.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/** PostgreSQL-backed store; one row per key in {@code registry_kv}. */
public class JdbcKeyValueStore implements KeyValueStore {
  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public JdbcKeyValueStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  @Override
  public Optional<String> get(String key) {
    String sql = "SELECT kv_value FROM registry_kv WHERE kv_key = ?";
    List<String> rows = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("kv_value"), key);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public void putAll(Map<String, String> entries) {
    if (entries.isEmpty()) {
      return;
    }
    String sql =
        """
        INSERT INTO registry_kv (kv_key, kv_value, updated_at)
        VALUES (?, ?, NOW())
        ON CONFLICT (kv_key) DO UPDATE
        SET kv_value = EXCLUDED.kv_value,
            updated_at = NOW()
        """;
    List<Object[]> batch = new ArrayList<>(entries.size());
    entries.forEach((key, value) -> batch.add(new Object[] {key, value}));
    transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(sql, batch));
  }
}
