package com.raidledger.reminder;

import static com.raidledger.common.JdbcTimestampUtils.toTimestamp;

import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Inserts rows owned by other subsystems so reminder queries have something to read. */
@RequiredArgsConstructor
public class ReminderFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insertUser(String discordId) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO users (discord_id) VALUES (:discordId) RETURNING id",
        new MapSqlParameterSource().addValue("discordId", discordId),
        Long.class);
  }

  public long insertEvent(
      String title,
      Instant startsAt,
      Long gameId,
      boolean reminder15min,
      boolean reminder1hour,
      boolean reminder24hour) {
    return jdbcTemplate.queryForObject(
        """
        INSERT INTO events (
          title, starts_at, ends_at, game_id, reminder_15min, reminder_1hour, reminder_24hour
        ) VALUES (
          :title, :startsAt, :endsAt, :gameId, :r15, :r1h, :r24h
        ) RETURNING id
        """,
        new MapSqlParameterSource()
            .addValue("title", title)
            .addValue("startsAt", toTimestamp(startsAt))
            .addValue("endsAt", toTimestamp(startsAt.plus(Duration.ofHours(3))))
            .addValue("gameId", gameId)
            .addValue("r15", reminder15min)
            .addValue("r1h", reminder1hour)
            .addValue("r24h", reminder24hour),
        Long.class);
  }

  public void cancelEvent(long eventId, Instant cancelledAt) {
    jdbcTemplate.update(
        "UPDATE events SET cancelled_at = :cancelledAt WHERE id = :id",
        new MapSqlParameterSource()
            .addValue("id", eventId)
            .addValue("cancelledAt", toTimestamp(cancelledAt)));
  }

  public void insertSignup(long eventId, Long userId) {
    jdbcTemplate.update(
        "INSERT INTO event_signups (event_id, user_id) VALUES (:eventId, :userId)",
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("userId", userId));
  }

  public void insertTimezone(long userId, String timezone) {
    jdbcTemplate.update(
        "INSERT INTO user_preferences (user_id, key, value) VALUES (:userId, 'timezone', :value)",
        new MapSqlParameterSource().addValue("userId", userId).addValue("value", timezone));
  }

  public void insertCharacter(
      long userId, Long gameId, String name, String characterClass, int displayOrder) {
    jdbcTemplate.update(
        """
        INSERT INTO characters (user_id, game_id, name, class, display_order)
        VALUES (:userId, :gameId, :name, :characterClass, :displayOrder)
        """,
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("gameId", gameId)
            .addValue("name", name)
            .addValue("characterClass", characterClass)
            .addValue("displayOrder", displayOrder));
  }

  public void insertSetting(String key, String value) {
    jdbcTemplate.update(
        "INSERT INTO app_settings (key, value) VALUES (:key, :value)",
        new MapSqlParameterSource().addValue("key", key).addValue("value", value));
  }

  public void insertEventMessage(long eventId, String guildId, String channelId, String messageId) {
    jdbcTemplate.update(
        """
        INSERT INTO discord_event_messages (event_id, guild_id, channel_id, message_id)
        VALUES (:eventId, :guildId, :channelId, :messageId)
        """,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("guildId", guildId)
            .addValue("channelId", channelId)
            .addValue("messageId", messageId));
  }

  public void insertChannelBinding(Long gameId, String voiceChannelId) {
    jdbcTemplate.update(
        "INSERT INTO channel_bindings (game_id, voice_channel_id) VALUES (:gameId, :voice)",
        new MapSqlParameterSource().addValue("gameId", gameId).addValue("voice", voiceChannelId));
  }
}
