package com.raidledger.reminder.model;

public record DiscordEventMessageRecord(
    long eventId, String guildId, String channelId, String messageId) {

  public String jumpUrl() {
    return "https://discord.com/channels/" + guildId + "/" + channelId + "/" + messageId;
  }
}
