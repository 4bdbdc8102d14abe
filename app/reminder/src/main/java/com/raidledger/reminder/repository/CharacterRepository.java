/*
 * Where: Reminder data access
 * What: Batch-loads characters of reminder recipients in a stable order
 * Why: The "first character" fallback must be deterministic across ticks
 */
package com.raidledger.reminder.repository;

import com.raidledger.reminder.model.CharacterRecord;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CharacterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<CharacterRecord> findByUserIds(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT user_id, game_id, name, class
        FROM characters
        WHERE user_id IN (:userIds)
        ORDER BY user_id, display_order, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new CharacterRecord(
                rs.getLong("user_id"),
                rs.getObject("game_id", Long.class),
                rs.getString("name"),
                rs.getString("class")));
  }
}
