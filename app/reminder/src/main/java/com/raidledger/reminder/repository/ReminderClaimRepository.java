/*
 * Where: Reminder data access
 * What: The dispatch ledger over event_reminders_sent
 * Why: The unique (event_id, user_id, reminder_type) constraint is the only synchronization
 *      point between overlapping ticks and scheduler instances
 */
package com.raidledger.reminder.repository;

import static com.raidledger.common.JdbcTimestampUtils.toInstant;

import com.raidledger.reminder.model.ReminderClaimKey;
import com.raidledger.reminder.model.ReminderSentRecord;
import com.raidledger.reminder.service.ClaimStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReminderClaimRepository implements ClaimStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public boolean tryClaim(ReminderClaimKey key) {
    // ON CONFLICT DO NOTHING reports 0 rows instead of raising, so a lost race is not an error
    final String sql =
        """
        INSERT INTO event_reminders_sent (event_id, user_id, reminder_type)
        VALUES (:eventId, :userId, :reminderType)
        ON CONFLICT (event_id, user_id, reminder_type) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", key.eventId())
            .addValue("userId", key.userId())
            .addValue("reminderType", key.reminderType());
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<ReminderSentRecord> findByUserId(long userId, int limit) {
    final String sql =
        """
        SELECT event_id, user_id, reminder_type, sent_at
        FROM event_reminders_sent
        WHERE user_id = :userId
        ORDER BY sent_at DESC, id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new ReminderSentRecord(
                rs.getLong("event_id"),
                rs.getLong("user_id"),
                rs.getString("reminder_type"),
                toInstant(rs.getTimestamp("sent_at"))));
  }
}
