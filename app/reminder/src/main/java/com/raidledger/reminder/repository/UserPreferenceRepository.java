/*
 * Where: Reminder data access
 * What: Reads the raw "timezone" preference values of users
 * Why: Normalizing "auto" and validating zone ids is the timezone resolver's job, not SQL's
 */
package com.raidledger.reminder.repository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserPreferenceRepository {

  static final String TIMEZONE_KEY = "timezone";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<Long, String> findTimezonesByUserIds(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT user_id, value
        FROM user_preferences
        WHERE key = :key
          AND user_id IN (:userIds)
        ORDER BY user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("key", TIMEZONE_KEY).addValue("userIds", userIds);
    return queryTimezones(sql, params);
  }

  public Map<Long, String> findAllTimezones() {
    final String sql =
        """
        SELECT user_id, value
        FROM user_preferences
        WHERE key = :key
        ORDER BY user_id
        """;
    return queryTimezones(sql, new MapSqlParameterSource().addValue("key", TIMEZONE_KEY));
  }

  private Map<Long, String> queryTimezones(String sql, MapSqlParameterSource params) {
    final Map<Long, String> timezones = new LinkedHashMap<>();
    final RowCallbackHandler handler =
        rs -> timezones.put(rs.getLong("user_id"), rs.getString("value"));
    jdbcTemplate.query(sql, params, handler);
    return timezones;
  }
}
