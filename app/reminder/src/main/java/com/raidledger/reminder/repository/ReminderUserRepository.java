/*
 * Where: Reminder data access
 * What: Batch-loads user identity rows for reminder recipients
 */
package com.raidledger.reminder.repository;

import com.raidledger.reminder.model.UserRecord;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReminderUserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<UserRecord> findByIds(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT id, discord_id
        FROM users
        WHERE id IN (:userIds)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> new UserRecord(rs.getLong("id"), rs.getString("discord_id")));
  }
}
