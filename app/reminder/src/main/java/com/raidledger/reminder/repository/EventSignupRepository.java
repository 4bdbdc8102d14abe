/*
 * Where: Reminder data access
 * What: Batch-loads signups for a set of events
 */
package com.raidledger.reminder.repository;

import com.raidledger.reminder.model.SignupRecord;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventSignupRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<SignupRecord> findByEventIds(Collection<Long> eventIds) {
    if (eventIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT event_id, user_id
        FROM event_signups
        WHERE event_id IN (:eventIds)
        ORDER BY event_id, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventIds", eventIds);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new SignupRecord(rs.getLong("event_id"), rs.getObject("user_id", Long.class)));
  }
}
