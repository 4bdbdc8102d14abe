/*
 * Where: Reminder service layer
 * What: Resolves the Discord links a reminder payload can carry
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.DiscordEventMessageRecord;
import com.raidledger.reminder.repository.AppSettingRepository;
import com.raidledger.reminder.repository.DiscordLinkRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventEmbedService {

  static final String DEFAULT_VOICE_CHANNEL_KEY = "discord_default_voice_channel";

  private final DiscordLinkRepository discordLinkRepository;
  private final AppSettingRepository appSettingRepository;

  /** Jump URL of the event's announcement message, if one was posted. */
  public Optional<String> getDiscordEmbedUrl(long eventId) {
    return discordLinkRepository
        .findFirstEventMessage(eventId)
        .map(DiscordEventMessageRecord::jumpUrl);
  }

  /**
   * Voice channel for the event: the game's own binding, then the catch-all binding, then the
   * admin-configured default.
   */
  public Optional<String> resolveVoiceChannelId(@Nullable Long gameId) {
    if (gameId != null) {
      final Optional<String> gameChannel = discordLinkRepository.findVoiceChannelForGame(gameId);
      if (gameChannel.isPresent()) {
        return gameChannel;
      }
    }
    final Optional<String> defaultBinding = discordLinkRepository.findDefaultVoiceChannel();
    if (defaultBinding.isPresent()) {
      return defaultBinding;
    }
    return appSettingRepository
        .findValue(DEFAULT_VOICE_CHANNEL_KEY)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }
}
