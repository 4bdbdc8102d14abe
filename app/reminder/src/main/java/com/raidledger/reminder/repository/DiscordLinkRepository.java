/*
 * Where: Reminder data access
 * What: Reads Discord message references and voice channel bindings
 * Why: Reminder payloads link to the event embed and the game's voice channel when known
 */
package com.raidledger.reminder.repository;

import com.raidledger.reminder.model.DiscordEventMessageRecord;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DiscordLinkRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DiscordEventMessageRecord> findFirstEventMessage(long eventId) {
    final String sql =
        """
        SELECT event_id, guild_id, channel_id, message_id
        FROM discord_event_messages
        WHERE event_id = :eventId
        ORDER BY id
        LIMIT 1
        """;
    final List<DiscordEventMessageRecord> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource().addValue("eventId", eventId),
            (rs, rowNum) ->
                new DiscordEventMessageRecord(
                    rs.getLong("event_id"),
                    rs.getString("guild_id"),
                    rs.getString("channel_id"),
                    rs.getString("message_id")));
    return rows.stream().findFirst();
  }

  public Optional<String> findVoiceChannelForGame(long gameId) {
    final String sql =
        """
        SELECT voice_channel_id
        FROM channel_bindings
        WHERE game_id = :gameId
        ORDER BY id
        LIMIT 1
        """;
    return queryFirst(sql, new MapSqlParameterSource().addValue("gameId", gameId));
  }

  public Optional<String> findDefaultVoiceChannel() {
    final String sql =
        """
        SELECT voice_channel_id
        FROM channel_bindings
        WHERE game_id IS NULL
        ORDER BY id
        LIMIT 1
        """;
    return queryFirst(sql, new MapSqlParameterSource());
  }

  private Optional<String> queryFirst(String sql, MapSqlParameterSource params) {
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }
}
