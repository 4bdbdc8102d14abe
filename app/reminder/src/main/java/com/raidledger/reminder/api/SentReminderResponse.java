package com.raidledger.reminder.api;

import java.time.Instant;
import java.util.List;

public record SentReminderResponse(long userId, List<SentReminderItem> items) {

  public record SentReminderItem(long eventId, String reminderType, Instant sentAt) {}
}
