/*
 * Where: Reminder data access
 * What: Reads active events and their per-window reminder flags
 * Why: Each tick takes one snapshot of candidate events instead of re-reading per window
 */
package com.raidledger.reminder.repository;

import static com.raidledger.common.JdbcTimestampUtils.toInstant;
import static com.raidledger.common.JdbcTimestampUtils.toTimestamp;

import com.raidledger.reminder.model.EventSnapshot;
import com.raidledger.reminder.model.ReminderFlag;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReminderEventRepository {

  private static final String EVENT_COLUMNS =
      """
      e.id, e.title, e.starts_at, e.ends_at, e.game_id, e.cancelled_at,
      e.reminder_15min, e.reminder_1hour, e.reminder_24hour
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<EventSnapshot> findActiveStartingBetween(Instant from, Instant to) {
    final String sql =
        "SELECT "
            + EVENT_COLUMNS
            + """
            FROM events e
            WHERE e.cancelled_at IS NULL
              AND e.starts_at >= :from
              AND e.starts_at <= :to
            ORDER BY e.starts_at, e.id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<EventSnapshot> findSignedUpActiveStartingBetween(
      long userId, Instant from, Instant to) {
    final String sql =
        "SELECT DISTINCT "
            + EVENT_COLUMNS
            + """
            FROM event_signups s
            JOIN events e ON e.id = s.event_id
            WHERE s.user_id = :userId
              AND e.cancelled_at IS NULL
              AND e.starts_at >= :from
              AND e.starts_at <= :to
            ORDER BY e.starts_at, e.id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private EventSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
    final EnumSet<ReminderFlag> flags = EnumSet.noneOf(ReminderFlag.class);
    for (ReminderFlag flag : ReminderFlag.values()) {
      if (rs.getBoolean(flag.columnName())) {
        flags.add(flag);
      }
    }
    return new EventSnapshot(
        rs.getLong("id"),
        rs.getString("title"),
        toInstant(rs.getTimestamp("starts_at")),
        toInstant(rs.getTimestamp("ends_at")),
        rs.getObject("game_id", Long.class),
        toInstant(rs.getTimestamp("cancelled_at")),
        flags);
  }
}
