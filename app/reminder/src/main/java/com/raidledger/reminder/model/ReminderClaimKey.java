/*
 * Where: Reminder domain model
 * What: The (event, user, reminder type) triple that may be claimed at most once
 */
package com.raidledger.reminder.model;

import java.util.Objects;

public record ReminderClaimKey(long eventId, long userId, String reminderType) {

  public ReminderClaimKey {
    Objects.requireNonNull(reminderType, "reminderType");
  }
}
