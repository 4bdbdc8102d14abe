/*
 * Where: Reminder data access
 * What: Reads key/value application settings
 */
package com.raidledger.reminder.repository;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AppSettingRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findValue(String key) {
    final String sql =
        """
        SELECT value
        FROM app_settings
        WHERE key = :key
        """;
    final List<String> values =
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("key", key), String.class);
    return values.stream().findFirst();
  }
}
